package com.all2md.core.ast;

import java.util.Map;

/**
 * Common contract of every element in a document tree.
 *
 * <p>All variants are immutable records. Child lists and metadata maps are defensively
 * copied on construction, so a tree never shares mutable state with the values it was
 * built from and untouched subtrees may be shared safely between trees.
 *
 * <p>Children of any variant are read and replaced through {@link NodeChildren}; variant
 * specific behaviour is reached through {@link #accept(NodeVisitor)}.
 */
public interface Node {

    /**
     * Format-specific extension values, in insertion order. Never null.
     *
     * @return unmodifiable metadata map
     */
    Map<String, Object> metadata();

    /**
     * Where this node came from in the source document.
     *
     * @return source location, or null when unknown
     */
    SourceLocation sourceLocation();

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor visitor to call
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Variant name used by the serialized form ({@code Heading}, {@code List}, {@code HTMLBlock}, ...).
     *
     * @return variant name
     */
    default String nodeType() {
        return NodeTypes.nameOf(this);
    }
}
