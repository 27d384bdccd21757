package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Root of a document tree.
 *
 * <p>Document-level metadata carries front matter such as title, author and date.
 *
 * @param children block-level children in document order
 * @param metadata document metadata
 * @param sourceLocation origin of the document, or null
 */
public record Document(
    List<Block> children,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Node {
    /**
     * Compact constructor with validation.
     */
    public Document {
        children = children == null ? List.of() : List.copyOf(children);
        metadata = Metadata.copyOf(metadata);
    }

    public Document(List<Block> children) {
        this(children, null, null);
    }

    public Document(List<Block> children, Map<String, Object> metadata) {
        this(children, metadata, null);
    }

    /**
     * @param newChildren replacement children
     * @return copy of this document with the given children and the same metadata
     */
    public Document withChildren(List<? extends Block> newChildren) {
        return new Document(List.copyOf(newChildren), metadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDocument(this);
    }
}
