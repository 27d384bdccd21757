package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Description of a definition list term.
 *
 * @param content block content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record DefinitionDescription(
    List<Block> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Node {

    public DefinitionDescription {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public DefinitionDescription(List<Block> content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDefinitionDescription(this);
    }
}
