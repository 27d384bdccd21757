package com.all2md.core.ast;

import java.util.Map;

/**
 * Line break inside inline content.
 *
 * @param soft true for a soft wrap, false for a hard break
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record LineBreak(
    boolean soft,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public LineBreak {
        metadata = Metadata.copyOf(metadata);
    }

    public LineBreak(boolean soft) {
        this(soft, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLineBreak(this);
    }
}
