package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Inline annotation; metadata keys follow {@link Comment}.
 *
 * @param content comment text
 * @param metadata comment metadata
 * @param sourceLocation origin in the source document, or null
 */
public record CommentInline(
    String content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public CommentInline {
        Objects.requireNonNull(content, "content must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public CommentInline(String content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCommentInline(this);
    }
}
