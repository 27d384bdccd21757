package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Quoted container of block content.
 *
 * @param children nested blocks
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record BlockQuote(
    List<Block> children,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public BlockQuote {
        children = children == null ? List.of() : List.copyOf(children);
        metadata = Metadata.copyOf(metadata);
    }

    public BlockQuote(List<Block> children) {
        this(children, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlockQuote(this);
    }
}
