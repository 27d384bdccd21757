package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Literal text run.
 *
 * @param content the text
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Text(
    String content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Text {
        Objects.requireNonNull(content, "content must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public Text(String content) {
        this(content, null, null);
    }

    public Text withContent(String newContent) {
        return new Text(newContent, metadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
