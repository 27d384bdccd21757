package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Subscript inline content.
 *
 * @param content inline content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Subscript(
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Subscript {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Subscript(List<Inline> content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }
}
