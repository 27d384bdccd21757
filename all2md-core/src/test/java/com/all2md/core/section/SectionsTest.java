package com.all2md.core.section;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.Nodes;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.transform.HeadingIdTransformer;
import com.all2md.core.transform.Transforms;
import com.all2md.core.visitor.NodeCollector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Sections}.
 */
class SectionsTest {

    /** H1 A, P a, H2 B, P b, H1 C, P c. */
    private static Document nested() {
        return new Document(List.of(
            new Heading(1, "A"),
            new Paragraph("a"),
            new Heading(2, "B"),
            new Paragraph("b"),
            new Heading(1, "C"),
            new Paragraph("c")), Map.of("title", "Doc"));
    }

    private static List<String> texts(Document document) {
        return document.children().stream().map(Nodes::extractText).toList();
    }

    @Test
    void getAllSections_withNestedHeadings_returnsOneSectionPerHeading() {
        List<Section> sections = Sections.getAllSections(nested());

        assertThat(sections).extracting(Section::headingText).containsExactly("A", "B", "C");
        assertThat(sections.get(0).content()).hasSize(3);
        assertThat(sections.get(0).endIndex()).isEqualTo(4);
        assertThat(sections.get(1).content()).containsExactly(new Paragraph("b"));
    }

    @Test
    void getAllSections_withPreamble_listsPreambleFirst() {
        Document document = new Document(List.of(new Paragraph("intro"), new Heading(1, "A")));

        List<Section> sections = Sections.getAllSections(document);

        assertThat(sections).hasSize(2);
        assertThat(sections.get(0).isPreamble()).isTrue();
        assertThat(sections.get(0).level()).isZero();
        assertThat(sections.get(0).headingText()).isEmpty();
    }

    @Test
    void getAllSections_withLevelRange_filtersHeadings() {
        List<Section> sections = Sections.getAllSections(nested(), 2, 2);

        assertThat(sections).extracting(Section::headingText).containsExactly("B");
    }

    @Test
    void getAllSections_withInvalidRange_throwsException() {
        assertThatThrownBy(() -> Sections.getAllSections(nested(), 3, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void countSections_withNestedHeadings_countsTopLevelOnly() {
        Document document = nested();

        assertThat(Sections.getAllSections(document)).hasSize(3);
        assertThat(Sections.countSections(document)).isEqualTo(2);
        assertThat(Sections.countSections(document, 2)).isEqualTo(1);
    }

    @Test
    void countSections_withNoHeadings_returnsZero() {
        assertThat(Sections.countSections(new Document(List.of(new Paragraph("x"))))).isZero();
    }

    @Test
    void findSectionByHeading_ignoresCaseAndSurroundingSpace() {
        assertThat(Sections.findSectionByHeading(nested(), "  b "))
            .hasValueSatisfying(section -> assertThat(section.level()).isEqualTo(2));
        assertThat(Sections.findSectionByHeading(nested(), "missing")).isEmpty();
    }

    @Test
    void getSectionByIndex_withNegativeIndex_countsFromEnd() {
        assertThat(Sections.getSectionByIndex(nested(), -1))
            .hasValueSatisfying(section -> assertThat(section.headingText()).isEqualTo("C"));
        assertThat(Sections.getSectionByIndex(nested(), 3)).isEmpty();
    }

    @Test
    void findHeading_withLevel_returnsIndexOfMatch() {
        assertThat(Sections.findHeading(nested(), "c", 1))
            .hasValueSatisfying(match -> assertThat(match.index()).isEqualTo(4));
        assertThat(Sections.findHeading(nested(), "c", 2)).isEmpty();
    }

    @Test
    void removeSection_withParentSection_removesNestedSubsection() {
        Document edited = Sections.removeSection(nested(), SectionTarget.heading("A"));

        assertThat(texts(edited)).containsExactly("C", "c");
        assertThat(edited.metadata()).containsEntry("title", "Doc");
    }

    @Test
    void removeSection_leavesOriginalUntouched() {
        Document original = nested();

        Sections.removeSection(original, SectionTarget.index(0));

        assertThat(original.children()).hasSize(6);
    }

    @Test
    void addSectionAfter_insertsAfterNestedSubsections() {
        List<Block> added = List.of(new Heading(1, "New"));

        Document edited = Sections.addSectionAfter(nested(), SectionTarget.heading("A"), added);

        assertThat(texts(edited)).containsExactly("A", "a", "B", "b", "New", "C", "c");
    }

    @Test
    void addSectionBefore_insertsBeforeHeading() {
        Document edited = Sections.addSectionBefore(nested(), SectionTarget.heading("B"), List.of(new Paragraph("x")));

        assertThat(texts(edited)).containsExactly("A", "a", "x", "B", "b", "C", "c");
    }

    @Test
    void replaceSection_replacesWholeSpanIncludingHeading() {
        Document edited = Sections.replaceSection(nested(), SectionTarget.heading("A"),
            List.of(new Heading(1, "A2"), new Paragraph("new")));

        assertThat(texts(edited)).containsExactly("A2", "new", "C", "c");
    }

    @Test
    void insertIntoSection_atStartAndEnd_placesBlocksInsideSection() {
        Document start = Sections.insertIntoSection(nested(), SectionTarget.heading("A"),
            List.of(new Paragraph("first")), InsertPosition.START);
        Document end = Sections.insertIntoSection(nested(), SectionTarget.heading("A"),
            List.of(new Paragraph("last")), InsertPosition.END);

        assertThat(texts(start)).startsWith("A", "first", "a");
        assertThat(texts(end)).containsExactly("A", "a", "B", "b", "last", "C", "c");
    }

    @Test
    void extractSection_returnsSectionWithDocumentMetadata() {
        Document extracted = Sections.extractSection(nested(), SectionTarget.heading("B"));

        assertThat(texts(extracted)).containsExactly("B", "b");
        assertThat(extracted.metadata()).containsEntry("title", "Doc");
    }

    @Test
    void resolve_withUnknownTarget_throwsSectionNotFound() {
        assertThatThrownBy(() -> Sections.resolve(nested(), SectionTarget.heading("Nope")))
            .isInstanceOf(SectionNotFoundException.class);
        assertThatThrownBy(() -> Sections.resolve(nested(), SectionTarget.index(10)))
            .isInstanceOf(SectionNotFoundException.class);
    }

    @Test
    void splitBySections_returnsPreambleAndTopLevelSections() {
        Document document = new Document(List.of(
            new Paragraph("intro"), new Heading(1, "A"), new Heading(2, "B"), new Heading(1, "C")));

        List<Document> pieces = Sections.splitBySections(document);

        assertThat(pieces).hasSize(3);
        assertThat(texts(pieces.get(1))).containsExactly("A", "B");
    }

    @Test
    void parseSectionRanges_withMixedSpec_returnsSortedZeroBasedIndexes() {
        assertThat(Sections.parseSectionRanges("1-3,5,8-", 9)).containsExactly(0, 1, 2, 4, 7, 8);
        assertThat(Sections.parseSectionRanges("3-1", 5)).containsExactly(0, 1, 2);
        assertThat(Sections.parseSectionRanges("7", 5)).isEmpty();
    }

    @Test
    void parseSectionRanges_withGarbage_throwsException() {
        assertThatThrownBy(() -> Sections.parseSectionRanges("x", 5))
            .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void querySections_withWildcards_matchesHeadingsIgnoringCase() {
        Document document = new Document(List.of(
            new Heading(1, "Chapter 1"), new Heading(1, "Chapter 2"), new Heading(1, "Appendix")));

        assertThat(Sections.querySections(document, "chapter *", false))
            .extracting(Section::headingText).containsExactly("Chapter 1", "Chapter 2");
        assertThat(Sections.querySections(document, "Appendi?", false))
            .extracting(Section::headingText).containsExactly("Appendix");
        assertThat(Sections.querySections(document, "chapter *", true)).isEmpty();
    }

    @Test
    void querySections_withoutWildcards_requiresWholeHeading() {
        assertThat(Sections.querySections(nested(), "a", false)).extracting(Section::headingText).containsExactly("A");
        assertThat(Sections.querySections(nested(), "A.", false)).isEmpty();
    }

    @Test
    void isMultiSectionSpec_recognizesRangesAndWildcards() {
        assertThat(Sections.isMultiSectionSpec("#:1-3")).isTrue();
        assertThat(Sections.isMultiSectionSpec("Intro*")).isTrue();
        assertThat(Sections.isMultiSectionSpec("#2")).isFalse();
        assertThat(Sections.isMultiSectionSpec("Intro")).isFalse();
    }

    @Test
    void extractSections_withRanges_joinsSectionsWithSeparator() {
        // Given
        Document document = nested();

        // When
        Document result = Sections.extractSections(document, "#:2-3");

        // Then
        assertThat(result.children()).hasSize(5);
        assertThat(result.children().get(2)).isInstanceOf(ThematicBreak.class);
        assertThat(texts(result)).containsExactly("B", "b", "", "C", "c");
        assertThat(result.metadata()).containsEntry("title", "Doc");
    }

    @Test
    void extractSections_withNestedMatch_copiesItOnce() {
        Document result = Sections.extractSections(nested(), "#:1-2", false, null);

        assertThat(texts(result)).containsExactly("A", "a", "B", "b");
    }

    @Test
    void extractSections_withUnmatchedPattern_throwsSectionNotFound() {
        assertThatThrownBy(() -> Sections.extractSections(nested(), "Z*"))
            .isInstanceOf(SectionNotFoundException.class)
            .hasMessageContaining("Z*");
    }

    @Test
    void extractSections_withEmptyRange_throwsException() {
        assertThatThrownBy(() -> Sections.extractSections(nested(), "#:9"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No sections in range");
    }

    @Test
    void extractSections_withoutHeadings_throwsException() {
        Document document = new Document(List.of(new Paragraph("only text")));

        assertThatThrownBy(() -> Sections.extractSections(document, "#:1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Document contains no sections (headings)");
    }

    @Test
    void generateToc_withFlat_listsAllHeadingsAtOneLevel() {
        ListBlock toc = Sections.generateToc(nested(), 3, true);

        assertThat(toc.items()).hasSize(3).allSatisfy(item -> assertThat(item.children()).hasSize(1));
        assertThat(NodeCollector.collect(new Document(List.of(toc)), Link.class))
            .extracting(Link::url).containsExactly("#a", "#b", "#c");
    }

    @Test
    void generateToc_withNestedHeadings_buildsNestedLinks() {
        ListBlock toc = Sections.generateToc(nested(), 3);

        assertThat(toc.items()).hasSize(2);
        ListItem first = toc.items().get(0);
        assertThat(first.children()).hasSize(2);
        List<Link> links = NodeCollector.collect(new Document(List.of(toc)), Link.class);
        assertThat(links).extracting(Link::url).containsExactly("#a", "#b", "#c");
    }

    @Test
    void generateToc_withDepthLimit_omitsDeeperHeadings() {
        ListBlock toc = Sections.generateToc(nested(), 1);

        List<Link> links = NodeCollector.collect(new Document(List.of(toc)), Link.class);
        assertThat(links).extracting(Link::url).containsExactly("#a", "#c");
    }

    @Test
    void generateToc_withDuplicateHeadings_makesAnchorsUnique() {
        Document document = new Document(List.of(new Heading(1, "Intro"), new Heading(1, "Intro")));

        List<Link> links = NodeCollector.collect(new Document(List.of(Sections.generateToc(document, 2))), Link.class);

        assertThat(links).extracting(Link::url).containsExactly("#intro", "#intro-2");
    }

    @Test
    void generateToc_withExistingId_usesIt() {
        Heading heading = new Heading(1, "Intro").withMetadata(Map.of(Heading.ID_KEY, "custom"));

        ListBlock toc = Sections.generateToc(new Document(List.of(heading)), 3);

        assertThat(NodeCollector.collect(new Document(List.of(toc)), Link.class))
            .extracting(Link::url).containsExactly("#custom");
    }

    @Test
    void generateToc_withDocumentMergedWithItself_givesEachCopyItsOwnAnchor() {
        // Given
        Document part = new Document(List.of(new Heading(1, "Intro"), new Paragraph("text")));
        Document merged = Transforms.mergeDocuments(List.of(part, part), new ThematicBreak());

        // When
        ListBlock toc = Sections.generateToc(merged, 3);

        // Then
        Document withIds = new HeadingIdTransformer().transformDocument(merged);
        List<String> ids = NodeCollector.collect(withIds, Heading.class).stream()
            .map(heading -> "#" + heading.metadata().get(Heading.ID_KEY))
            .toList();
        assertThat(NodeCollector.collect(new Document(List.of(toc)), Link.class))
            .extracting(Link::url)
            .containsExactly("#intro", "#intro-2")
            .containsExactlyElementsOf(ids);
    }

    @Test
    void generateToc_withExistingIdOnLaterHeading_doesNotReuseItForEarlierSlug() {
        Document document = new Document(List.of(
            new Heading(1, "Intro"),
            new Heading(1, "Other").withMetadata(Map.of(Heading.ID_KEY, "intro"))));

        ListBlock toc = Sections.generateToc(document, 3);

        assertThat(NodeCollector.collect(new Document(List.of(toc)), Link.class))
            .extracting(Link::url).containsExactly("#intro-2", "#intro");
    }

    @Test
    void generateToc_withInvalidDepth_throwsException() {
        assertThatThrownBy(() -> Sections.generateToc(nested(), 7))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void insertToc_atStart_addsTitleAndList() {
        Document edited = Sections.insertToc(nested(), TocPosition.START, 3);

        assertThat(edited.children().get(0)).isEqualTo(new Heading(1, Sections.DEFAULT_TOC_TITLE));
        assertThat(edited.children().get(1)).isInstanceOf(ListBlock.class);
        assertThat(edited.children()).hasSize(8);
    }

    @Test
    void insertToc_afterFirstHeading_usesNextLevelTitle() {
        Document edited = Sections.insertToc(nested(), TocPosition.AFTER_FIRST_HEADING, 3, "Contents");

        assertThat(edited.children().get(1)).isEqualTo(new Heading(2, "Contents"));
        assertThat(edited.children().get(2)).isInstanceOf(ListBlock.class);
    }

    @Test
    void insertToc_withoutTitle_insertsOnlyList() {
        Document edited = Sections.insertToc(nested(), TocPosition.START, 3, null);

        assertThat(edited.children().get(0)).isInstanceOf(ListBlock.class);
    }

    @Test
    void insertToc_withoutHeadings_returnsDocumentUnchanged() {
        Document document = new Document(List.of(new Paragraph("plain")));

        assertThat(Sections.insertToc(document, TocPosition.START, 3)).isSameAs(document);
    }
}
