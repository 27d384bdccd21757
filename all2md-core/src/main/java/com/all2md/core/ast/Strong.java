package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Strongly emphasized (bold) inline content.
 *
 * @param content inline content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Strong(
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Strong {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Strong(List<Inline> content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStrong(this);
    }
}
