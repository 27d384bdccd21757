package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Term of a definition list.
 *
 * @param content inline content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record DefinitionTerm(
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Node {

    public DefinitionTerm {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public DefinitionTerm(List<Inline> content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDefinitionTerm(this);
    }
}
