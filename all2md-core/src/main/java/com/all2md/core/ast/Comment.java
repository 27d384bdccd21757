package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Block-level annotation such as a review comment.
 *
 * <p>Author, date and kind live in metadata under {@code author}, {@code date} and
 * {@code comment_type}.
 *
 * @param content comment text
 * @param metadata comment metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Comment(
    String content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public static final String AUTHOR = "author";
    public static final String DATE = "date";
    public static final String COMMENT_TYPE = "comment_type";

    public Comment {
        Objects.requireNonNull(content, "content must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public Comment(String content) {
        this(content, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
