package com.all2md.core.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hyperlink.
 *
 * @param url link target
 * @param content link text
 * @param title optional title, or null
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Link(
    String url,
    List<Inline> content,
    String title,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Link {
        Objects.requireNonNull(url, "url must not be null");
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Link(String url, List<Inline> content) {
        this(url, content, null, null, null);
    }

    public Link withUrl(String newUrl) {
        return new Link(newUrl, content, title, metadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLink(this);
    }
}
