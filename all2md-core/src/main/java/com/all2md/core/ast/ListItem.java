package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Item of a {@link ListBlock}.
 *
 * @param children block content of the item, including nested lists
 * @param taskStatus checkbox state for task lists, or null for plain items
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record ListItem(
    List<Block> children,
    TaskStatus taskStatus,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Node {

    public ListItem {
        children = children == null ? List.of() : List.copyOf(children);
        metadata = Metadata.copyOf(metadata);
    }

    public ListItem(List<Block> children) {
        this(children, null, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitListItem(this);
    }
}
