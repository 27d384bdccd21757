package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Raw inline HTML. Serialized under the variant name {@code HTMLInline}.
 *
 * @param content raw HTML
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record HtmlInline(
    String content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public HtmlInline {
        Objects.requireNonNull(content, "content must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public HtmlInline(String content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHtmlInline(this);
    }
}
