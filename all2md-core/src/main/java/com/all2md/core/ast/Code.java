package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Inline code span.
 *
 * @param content literal code
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Code(
    String content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Code {
        Objects.requireNonNull(content, "content must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public Code(String content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCode(this);
    }
}
