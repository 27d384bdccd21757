package com.all2md.core.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Body of a footnote or endnote.
 *
 * @param identifier identifier matched by {@link FootnoteReference#identifier()}
 * @param content block content of the note
 * @param metadata metadata; {@code note_type} distinguishes footnotes from endnotes
 * @param sourceLocation origin in the source document, or null
 */
public record FootnoteDefinition(
    String identifier,
    List<Block> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public static final String NOTE_TYPE = "note_type";
    public static final String DEFAULT_NOTE_TYPE = "footnote";

    public FootnoteDefinition {
        Objects.requireNonNull(identifier, "identifier must not be null");
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public FootnoteDefinition(String identifier, List<Block> content) {
        this(identifier, content, null, null);
    }

    /**
     * @return the {@code note_type} metadata value, defaulting to {@code footnote}
     */
    public String noteType() {
        return Metadata.getString(metadata, NOTE_TYPE, DEFAULT_NOTE_TYPE);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFootnoteDefinition(this);
    }
}
