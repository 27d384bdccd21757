package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * List of terms and their descriptions.
 *
 * @param items term/description groups in order
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record DefinitionList(
    List<DefinitionItem> items,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public DefinitionList {
        items = items == null ? List.of() : List.copyOf(items);
        metadata = Metadata.copyOf(metadata);
    }

    public DefinitionList(List<DefinitionItem> items) {
        this(items, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDefinitionList(this);
    }
}
