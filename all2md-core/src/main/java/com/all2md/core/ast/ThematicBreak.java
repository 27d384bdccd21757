package com.all2md.core.ast;

import java.util.Map;

/**
 * Horizontal rule between blocks.
 *
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record ThematicBreak(
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public ThematicBreak {
        metadata = Metadata.copyOf(metadata);
    }

    public ThematicBreak() {
        this(null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThematicBreak(this);
    }
}
