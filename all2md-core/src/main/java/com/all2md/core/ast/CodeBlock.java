package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Fenced or indented block of literal code.
 *
 * @param content raw code text
 * @param language language tag, or null
 * @param fenceChar fence character, normally {@code `} or {@code ~}
 * @param fenceLength number of fence characters, at least 1
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record CodeBlock(
    String content,
    String language,
    char fenceChar,
    int fenceLength,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public static final char DEFAULT_FENCE_CHAR = '`';
    public static final int DEFAULT_FENCE_LENGTH = 3;

    /**
     * Compact constructor with validation.
     */
    public CodeBlock {
        Objects.requireNonNull(content, "content must not be null");
        if (fenceLength < 1) {
            throw new IllegalArgumentException("fenceLength must be at least 1, got " + fenceLength);
        }
        metadata = Metadata.copyOf(metadata);
    }

    public CodeBlock(String content, String language) {
        this(content, language, DEFAULT_FENCE_CHAR, DEFAULT_FENCE_LENGTH, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
