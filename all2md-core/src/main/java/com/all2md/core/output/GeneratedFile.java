package com.all2md.core.output;

import java.util.Objects;

/**
 * A file produced by a command, not yet written anywhere.
 *
 * @param relativePath path relative to the output directory (e.g., "002-introduction.md")
 * @param content file content
 * @param contentType media type, e.g. "text/markdown"
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
