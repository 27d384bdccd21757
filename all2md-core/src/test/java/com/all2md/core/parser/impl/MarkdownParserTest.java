package com.all2md.core.parser.impl;

import com.all2md.core.ast.Alignment;
import com.all2md.core.ast.BlockQuote;
import com.all2md.core.ast.Code;
import com.all2md.core.ast.CodeBlock;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Emphasis;
import com.all2md.core.ast.FootnoteDefinition;
import com.all2md.core.ast.FootnoteReference;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.HtmlBlock;
import com.all2md.core.ast.Image;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.Nodes;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.Strikethrough;
import com.all2md.core.ast.Strong;
import com.all2md.core.ast.Table;
import com.all2md.core.ast.TaskStatus;
import com.all2md.core.ast.Text;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.transform.Transforms;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MarkdownParser}.
 */
class MarkdownParserTest {

    private final MarkdownParser parser = new MarkdownParser();

    @Test
    void getFileExtensions_includesMdAndMarkdown() {
        assertThat(parser.getId()).isEqualTo("markdown");
        assertThat(parser.supports("README.MD")).isTrue();
        assertThat(parser.supports("notes.markdown")).isTrue();
        assertThat(parser.supports("data.json")).isFalse();
    }

    @Test
    void parse_withHeadingsAndParagraphs_buildsBlocks() {
        Document document = parser.parse("# Title\n\nHello world.\n\n## Sub\n");

        assertThat(document.children()).containsExactly(
            new Heading(1, "Title"), new Paragraph("Hello world."), new Heading(2, "Sub"));
        assertThat(document.metadata()).isEmpty();
    }

    @Test
    void parse_withInlineFormatting_mapsEachVariant() {
        Document document = parser.parse("a *em* **strong** `code` ~~gone~~\n");

        Paragraph paragraph = (Paragraph) document.children().get(0);
        assertThat(paragraph.content()).hasAtLeastOneElementOfType(Emphasis.class);
        assertThat(Transforms.extractNodes(document, Strong.class)).hasSize(1);
        assertThat(Transforms.extractNodes(document, Code.class)).extracting(Code::content).containsExactly("code");
        assertThat(Transforms.extractNodes(document, Strikethrough.class)).hasSize(1);
        assertThat(paragraph.content().get(0)).isEqualTo(new Text("a "));
    }

    @Test
    void parse_withEscapedCharacters_unescapesText() {
        Document document = parser.parse("2\\*3 \\[x\\]\n");

        assertThat(Nodes.extractText(document)).isEqualTo("2*3 [x]");
    }

    @Test
    void parse_withFencedCode_keepsLanguageAndFence() {
        Document document = parser.parse("~~~~python extra\nprint(1)\n~~~~\n");

        CodeBlock code = (CodeBlock) document.children().get(0);
        assertThat(code.content()).isEqualTo("print(1)");
        assertThat(code.language()).isEqualTo("python");
        assertThat(code.fenceChar()).isEqualTo('~');
        assertThat(code.fenceLength()).isEqualTo(4);
    }

    @Test
    void parse_withIndentedCode_returnsCodeBlockWithoutLanguage() {
        Document document = parser.parse("    indented\n");

        CodeBlock code = (CodeBlock) document.children().get(0);
        assertThat(code.content()).isEqualTo("indented");
        assertThat(code.language()).isNull();
    }

    @Test
    void parse_withLists_mapsOrderingStartAndTasks() {
        Document document = parser.parse("3. three\n4. four\n\n- [x] done\n- [ ] todo\n");

        ListBlock ordered = (ListBlock) document.children().get(0);
        assertThat(ordered.ordered()).isTrue();
        assertThat(ordered.start()).isEqualTo(3);
        assertThat(ordered.items()).hasSize(2);

        ListBlock tasks = (ListBlock) document.children().get(1);
        assertThat(tasks.items()).extracting(item -> item.taskStatus())
            .containsExactly(TaskStatus.CHECKED, TaskStatus.UNCHECKED);
        assertThat(Nodes.extractText(tasks.items().get(0)).strip()).isEqualTo("done");
    }

    @Test
    void parse_withNestedList_nestsInsideItem() {
        Document document = parser.parse("- a\n  - b\n");

        ListBlock list = (ListBlock) document.children().get(0);
        assertThat(list.items()).hasSize(1);
        assertThat(list.items().get(0).children()).hasSize(2);
        assertThat(list.items().get(0).children().get(1)).isInstanceOf(ListBlock.class);
    }

    @Test
    void parse_withBlockQuoteAndBreak_mapsBoth() {
        Document document = parser.parse("> quoted\n\n---\n");

        assertThat(document.children().get(0)).isEqualTo(new BlockQuote(List.of(new Paragraph("quoted"))));
        assertThat(document.children().get(1)).isInstanceOf(ThematicBreak.class);
    }

    @Test
    void parse_withTable_mapsHeaderRowsAndAlignments() {
        Document document = parser.parse("| A | B |\n|:---|---:|\n| 1 | 2 |\n| 3 | 4 |\n");

        Table table = (Table) document.children().get(0);
        assertThat(table.header()).isNotNull();
        assertThat(table.header().cells()).hasSize(2);
        assertThat(table.rows()).hasSize(2);
        assertThat(table.alignments()).containsExactly(Alignment.LEFT, Alignment.RIGHT);
        assertThat(Nodes.extractText(table.rows().get(1).cells().get(0)).strip()).isEqualTo("3");
    }

    @Test
    void parse_withLinksAndImages_resolvesReferences() {
        Document document = parser.parse("""
            [inline](https://example.com "Title") and [ref][r] and ![logo](img/logo.png)
            and <https://auto.example.com> and [missing][nope]

            [r]: https://ref.example.com
            """);

        List<Link> links = Transforms.extractNodes(document, Link.class);
        assertThat(links).extracting(Link::url)
            .containsExactly("https://example.com", "https://ref.example.com", "https://auto.example.com");
        assertThat(links.get(0).title()).isEqualTo("Title");
        assertThat(Transforms.extractNodes(document, Image.class)).singleElement()
            .satisfies(image -> {
                assertThat(image.url()).isEqualTo("img/logo.png");
                assertThat(image.altText()).isEqualTo("logo");
            });
        assertThat(Nodes.extractText(document)).contains("[missing][nope]");
        assertThat(document.children()).hasSize(1);
    }

    @Test
    void parse_withFootnotes_mapsReferencesAndDefinitions() {
        Document document = parser.parse("Text[^1] more.\n\n[^1]: The note.\n");

        assertThat(Transforms.extractNodes(document, FootnoteReference.class))
            .extracting(FootnoteReference::identifier).containsExactly("1");
        FootnoteDefinition definition = Transforms.extractNodes(document, FootnoteDefinition.class).get(0);
        assertThat(definition.identifier()).isEqualTo("1");
        assertThat(Nodes.extractText(definition).strip()).isEqualTo("The note.");
    }

    @Test
    void parse_withHtmlBlock_keepsRawHtml() {
        Document document = parser.parse("<div>\nraw\n</div>\n");

        assertThat(document.children().get(0)).isEqualTo(new HtmlBlock("<div>\nraw\n</div>"));
    }

    @Test
    void parse_withFrontMatter_readsMetadata() {
        Document document = parser.parse("""
            ---
            title: Guide
            tags: [a, b]
            version: 2
            ---
            # Body
            """);

        assertThat(document.metadata())
            .containsEntry("title", "Guide")
            .containsEntry("tags", List.of("a", "b"))
            .containsEntry("version", 2L);
        assertThat(document.children()).containsExactly(new Heading(1, "Body"));
    }

    @Test
    void parse_withInvalidFrontMatter_keepsItInBody() {
        Document document = parser.parse("---\n: [broken\n---\nText\n");

        assertThat(document.metadata()).isEmpty();
        assertThat(document.children()).isNotEmpty();
    }

    @Test
    void parse_withEmptyInput_returnsEmptyDocument() {
        assertThat(parser.parse("").children()).isEmpty();
    }
}
