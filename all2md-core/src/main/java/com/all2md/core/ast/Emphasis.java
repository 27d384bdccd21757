package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Emphasized (italic) inline content.
 *
 * @param content inline content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Emphasis(
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Emphasis {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Emphasis(List<Inline> content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEmphasis(this);
    }
}
