package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Raw HTML passed through as a block. Serialized under the variant name {@code HTMLBlock}.
 *
 * @param content raw HTML
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record HtmlBlock(
    String content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public HtmlBlock {
        Objects.requireNonNull(content, "content must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public HtmlBlock(String content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHtmlBlock(this);
    }
}
