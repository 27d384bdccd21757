package com.all2md.core.section;

import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.ThematicBreak;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentSplitter}.
 */
class DocumentSplitterTest {

    private static Document chapters() {
        return new Document(List.of(
            new Paragraph("intro words here"),
            new Heading(1, "Chapter One"),
            new Paragraph("one two three four"),
            new Heading(2, "Detail"),
            new Paragraph("five six"),
            new Heading(1, "Chapter Two"),
            new Paragraph("seven eight nine ten")), Map.of("author", "me"));
    }

    @Test
    void split_byH1_returnsPreambleAndChapters() {
        List<SplitResult> pieces = DocumentSplitter.split(chapters(), "h1");

        assertThat(pieces).extracting(SplitResult::title)
            .containsExactly(DocumentSplitter.PREAMBLE_TITLE, "Chapter One", "Chapter Two");
        assertThat(pieces).extracting(SplitResult::index).containsExactly(1, 2, 3);
        assertThat(pieces.get(1).document().children()).hasSize(4);
        assertThat(pieces.get(2).document().metadata()).containsEntry("author", "me");
    }

    @Test
    void split_byH2_dropsContentUnderHigherHeadings() {
        List<SplitResult> pieces = DocumentSplitter.split(chapters(), "H2");

        assertThat(pieces).extracting(SplitResult::title)
            .containsExactly(DocumentSplitter.PREAMBLE_TITLE, "Detail");
    }

    @Test
    void split_byBreak_dropsBreaksAndNamesParts() {
        Document document = new Document(List.of(
            new Paragraph("a"), new ThematicBreak(), new ThematicBreak(), new Paragraph("b")));

        List<SplitResult> pieces = DocumentSplitter.split(document, "break");

        assertThat(pieces).extracting(SplitResult::title).containsExactly("Part 1", "Part 2");
        assertThat(pieces.get(1).document().children()).containsExactly(new Paragraph("b"));
    }

    @Test
    void split_byWords_keepsSectionsWhole() {
        List<SplitResult> pieces = DocumentSplitter.split(chapters(), "words:8");

        assertThat(pieces).extracting(SplitResult::title)
            .containsExactly(DocumentSplitter.PREAMBLE_TITLE, "Chapter One", "Chapter Two");
        assertThat(pieces.get(1).wordCount()).isEqualTo(9);
        assertThat(pieces.stream().mapToInt(SplitResult::wordCount).sum()).isEqualTo(18);
    }

    @Test
    void split_intoParts_returnsAtMostRequestedPieces() {
        List<SplitResult> pieces = DocumentSplitter.split(chapters(), "parts:2");

        assertThat(pieces).hasSize(2);
        assertThat(pieces.get(0).title()).isEqualTo(DocumentSplitter.PREAMBLE_TITLE);
        assertThat(pieces.get(0).wordCount()).isEqualTo(12);
        assertThat(pieces.get(1).title()).isEqualTo("Chapter Two");
    }

    @Test
    void split_withNothingToSplitOn_returnsWholeDocument() {
        Document document = new Document(List.of(new Paragraph("just text")));

        List<SplitResult> pieces = DocumentSplitter.split(document, "h1");

        assertThat(pieces).hasSize(1);
        assertThat(pieces.get(0).document()).isSameAs(document);
        assertThat(pieces.get(0).filenameSlug()).isEmpty();
    }

    @Test
    void split_withUnknownStrategy_throwsException() {
        assertThatThrownBy(() -> DocumentSplitter.split(chapters(), "h7"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid split strategy");
    }

    @Test
    void splitIntoParts_withOnePart_returnsSinglePiece() {
        assertThat(DocumentSplitter.splitIntoParts(chapters(), 1)).hasSize(1);
    }

    @Test
    void splitByWordCount_withZeroTarget_throwsException() {
        assertThatThrownBy(() -> DocumentSplitter.splitByWordCount(chapters(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void filenameSlug_withLimits_truncatesTitle() {
        SplitResult result = new SplitResult(new Document(List.of()), 1, "A Very Long Chapter Title", 0);

        assertThat(result.filenameSlug()).isEqualTo("a-very-long-chapter-title");
        assertThat(result.filenameSlug(6, "_")).isEqualTo("a_very");
    }
}
