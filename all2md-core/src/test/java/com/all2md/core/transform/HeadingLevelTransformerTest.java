package com.all2md.core.transform;

import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Paragraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HeadingLevelTransformer}.
 */
class HeadingLevelTransformerTest {

    private static Document headings() {
        return new Document(List.of(new Heading(1, "One"), new Paragraph("p"), new Heading(3, "Three")));
    }

    private static List<Integer> levels(Document document) {
        return Transforms.extractNodes(document, Heading.class).stream().map(Heading::level).toList();
    }

    @Test
    void transform_withPositiveOffset_demotesHeadings() {
        Document result = new HeadingLevelTransformer(1).transformDocument(headings());

        assertThat(levels(result)).containsExactly(2, 4);
    }

    @Test
    void transform_withZeroOffset_returnsEqualDocument() {
        Document original = headings();

        assertThat(new HeadingLevelTransformer(0).transformDocument(original)).isEqualTo(original);
    }

    @Test
    void transform_withLargeOffsets_clampsToValidLevels() {
        assertThat(levels(new HeadingLevelTransformer(10).transformDocument(headings()))).containsExactly(6, 6);
        assertThat(levels(new HeadingLevelTransformer(-10).transformDocument(headings()))).containsExactly(1, 1);
    }

    @Test
    void transform_withCustomRange_clampsToIt() {
        Document result = new HeadingLevelTransformer(0, 2, 3).transformDocument(headings());

        assertThat(levels(result)).containsExactly(2, 3);
    }

    @Test
    void constructor_withInvalidRange_throwsException() {
        assertThatThrownBy(() -> new HeadingLevelTransformer(0, 0, 6))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HeadingLevelTransformer(0, 4, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
