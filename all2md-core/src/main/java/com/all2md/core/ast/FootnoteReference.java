package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Marker pointing at a {@link FootnoteDefinition}.
 *
 * <p>The model does not check that a matching definition exists.
 *
 * @param identifier identifier of the referenced note
 * @param metadata metadata; {@code note_type} distinguishes footnotes from endnotes
 * @param sourceLocation origin in the source document, or null
 */
public record FootnoteReference(
    String identifier,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public FootnoteReference {
        Objects.requireNonNull(identifier, "identifier must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public FootnoteReference(String identifier) {
        this(identifier, null, null);
    }

    /**
     * @return the {@code note_type} metadata value, defaulting to {@code footnote}
     */
    public String noteType() {
        return Metadata.getString(metadata, FootnoteDefinition.NOTE_TYPE, FootnoteDefinition.DEFAULT_NOTE_TYPE);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFootnoteReference(this);
    }
}
