package com.all2md.core.footnote;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.FootnoteDefinition;
import com.all2md.core.ast.FootnoteReference;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.Text;
import com.all2md.core.serialization.AstSerializer;
import com.all2md.core.transform.Transforms;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FootnoteCollector}.
 */
class FootnoteCollectorTest {

    private static List<Block> body(String text) {
        return List.of(new Paragraph(text));
    }

    @Test
    void registerReference_withNullIdentifiers_numbersAroundCustomOnes() {
        FootnoteCollector collector = new FootnoteCollector();

        String first = collector.registerReference(null);
        String custom = collector.registerReference("custom");
        String second = collector.registerReference(null);

        assertThat(List.of(first, custom, second)).containsExactly("1", "custom", "2");
    }

    @Test
    void registerReference_withExplicitNumber_skipsItWhenAutoNumbering() {
        FootnoteCollector collector = new FootnoteCollector();

        collector.registerReference("2");
        String first = collector.registerReference(null);
        String second = collector.registerReference(null);

        assertThat(first).isEqualTo("1");
        assertThat(second).isEqualTo("3");
    }

    @Test
    void registerReference_withSameRawIdentifier_returnsSameCanonicalAndCounts() {
        FootnoteCollector collector = new FootnoteCollector();

        String a = collector.registerReference("note one");
        String b = collector.registerReference("note one");

        assertThat(a).isEqualTo("note-one").isEqualTo(b);
        assertThat(collector.referenceCount("note-one", FootnoteCollector.FOOTNOTE)).isEqualTo(2);
    }

    @Test
    void registerReference_withCollidingSanitizedIdentifiers_appendsSuffix() {
        FootnoteCollector collector = new FootnoteCollector();

        String first = collector.registerReference("a b");
        String second = collector.registerReference("a.b");
        String third = collector.registerReference("a/b");

        assertThat(List.of(first, second, third)).containsExactly("a-b", "a-b-2", "a-b-3");
    }

    @Test
    void registerReference_withOnlyDisallowedCharacters_usesFallbackPrefix() {
        FootnoteCollector collector = new FootnoteCollector(1, "fn");

        assertThat(collector.registerReference("***")).isEqualTo("fn");
    }

    @Test
    void registerReference_withDifferentNoteTypes_numbersIndependently() {
        FootnoteCollector collector = new FootnoteCollector(5, "note");

        String footnote = collector.registerReference(null, FootnoteCollector.FOOTNOTE);
        String endnote = collector.registerReference(null, FootnoteCollector.ENDNOTE);

        assertThat(footnote).isEqualTo("5");
        assertThat(endnote).isEqualTo("5");
    }

    @Test
    void constructor_withInvalidFallbackPrefix_throwsException() {
        assertThatThrownBy(() -> new FootnoteCollector(1, "bad prefix"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FootnoteCollector(1, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registerDefinition_withDuplicate_keepsFirst() {
        FootnoteCollector collector = new FootnoteCollector();

        collector.registerDefinition("x", body("first"));
        collector.registerDefinition("x", body("second"));

        FootnoteDefinition definition = collector.definitionFor("x", FootnoteCollector.FOOTNOTE).orElseThrow();
        assertThat(definition.content()).containsExactly(new Paragraph("first"));
    }

    @Test
    void registerDefinition_withEmptyContent_registersIdentifierOnly() {
        FootnoteCollector collector = new FootnoteCollector();

        String id = collector.registerDefinition("empty", List.of());

        assertThat(id).isEqualTo("empty");
        assertThat(collector.hasDefinition("empty", FootnoteCollector.FOOTNOTE)).isFalse();
        assertThat(collector.iterDefinitions()).isEmpty();
    }

    @Test
    void iterDefinitions_withPriority_groupsByNoteTypeInRegistrationOrder() {
        FootnoteCollector collector = new FootnoteCollector();
        collector.registerDefinition("e1", body("end"), FootnoteCollector.ENDNOTE);
        collector.registerDefinition("b", body("b"));
        collector.registerDefinition("a", body("a"));

        List<String> ids = collector.iterDefinitions(List.of(FootnoteCollector.FOOTNOTE, FootnoteCollector.ENDNOTE))
            .map(FootnoteDefinition::identifier)
            .toList();

        assertThat(ids).containsExactly("b", "a", "e1");
    }

    @Test
    void iterDefinitions_calledTwice_restarts() {
        FootnoteCollector collector = new FootnoteCollector();
        collector.registerDefinition("a", body("a"));

        assertThat(collector.iterDefinitions()).hasSize(1);
        assertThat(collector.iterDefinitions()).hasSize(1);
    }

    @Test
    void collectDefinitions_withDocument_registersNestedDefinitionsWithNoteType() {
        FootnoteDefinition endnote = new FootnoteDefinition("later", body("end"),
            Map.of(FootnoteDefinition.NOTE_TYPE, FootnoteCollector.ENDNOTE), null);
        Document document = new Document(List.of(
            new Paragraph("text"),
            new FootnoteDefinition("first", body("one")),
            endnote));

        FootnoteCollector collector = new FootnoteCollector().collectDefinitions(document);

        assertThat(collector.hasDefinition("first", FootnoteCollector.FOOTNOTE)).isTrue();
        assertThat(collector.hasDefinition("later", FootnoteCollector.ENDNOTE)).isTrue();
        assertThat(collector.iterDefinitions().map(FootnoteDefinition::noteType))
            .containsExactly(FootnoteCollector.FOOTNOTE, FootnoteCollector.ENDNOTE);
    }

    @Test
    void serializedDocument_keepsFootnotesResolvable() {
        // Given
        Document original = new Document(List.of(
            new Heading(1, "Title"),
            new Paragraph(List.of(new Text("See "), new FootnoteReference("1"))),
            new FootnoteDefinition("1", List.of(new Paragraph(List.of(new Text("Detail")))))));

        // When
        Document restored = AstSerializer.jsonToAst(AstSerializer.astToJson(original));
        List<FootnoteReference> references = Transforms.extractNodes(restored, FootnoteReference.class);
        FootnoteCollector collector = new FootnoteCollector();
        String defined = collector.registerDefinition("1", body("Detail"));
        String referenced = collector.registerReference(references.get(0).identifier());

        // Then
        assertThat(restored).isEqualTo(original);
        assertThat(references).extracting(FootnoteReference::identifier).containsExactly("1");
        assertThat(referenced).isEqualTo(defined);
        assertThat(collector.iterDefinitions()).extracting(FootnoteDefinition::identifier).containsExactly(defined);
    }
}
