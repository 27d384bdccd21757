package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Position of a node in its source document.
 *
 * @param format source format tag (e.g. "markdown", "docx", "pdf")
 * @param page 1-based page number, or null
 * @param line 1-based line number, or null
 * @param column 1-based column number, or null
 * @param elementId id of the originating element in the source, or null
 * @param metadata extra format-specific location data
 */
public record SourceLocation(
    String format,
    Integer page,
    Integer line,
    Integer column,
    String elementId,
    Map<String, Object> metadata
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        Objects.requireNonNull(format, "format must not be null");
        metadata = Metadata.copyOf(metadata);
    }

    public SourceLocation(String format, Integer line, Integer column) {
        this(format, null, line, column, null, null);
    }
}
