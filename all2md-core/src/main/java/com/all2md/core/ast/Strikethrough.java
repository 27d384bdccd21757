package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Struck-through inline content.
 *
 * @param content inline content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Strikethrough(
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Strikethrough {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Strikethrough(List<Inline> content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStrikethrough(this);
    }
}
