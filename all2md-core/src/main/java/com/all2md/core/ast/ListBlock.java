package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Ordered or unordered list. Serialized under the variant name {@code List}.
 *
 * @param ordered whether items are numbered
 * @param items list items
 * @param start first number of an ordered list
 * @param tight whether items are rendered without blank lines between them
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record ListBlock(
    boolean ordered,
    List<ListItem> items,
    int start,
    boolean tight,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public ListBlock {
        items = items == null ? List.of() : List.copyOf(items);
        metadata = Metadata.copyOf(metadata);
    }

    public ListBlock(boolean ordered, List<ListItem> items) {
        this(ordered, items, 1, true, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitListBlock(this);
    }
}
