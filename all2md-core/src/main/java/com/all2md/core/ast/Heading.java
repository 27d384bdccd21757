package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Section heading.
 *
 * @param level heading level, 1 (highest) to 6
 * @param content inline content
 * @param metadata format-specific metadata (the {@code id} key holds an anchor slug when assigned)
 * @param sourceLocation origin in the source document, or null
 */
public record Heading(
    int level,
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 6;
    public static final String ID_KEY = "id";

    /**
     * Compact constructor with validation.
     */
    public Heading {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Heading(int level, List<Inline> content) {
        this(level, content, null, null);
    }

    public Heading(int level, String text) {
        this(level, List.of(new Text(text)), null, null);
    }

    public Heading withLevel(int newLevel) {
        return new Heading(newLevel, content, metadata, sourceLocation);
    }

    public Heading withMetadata(Map<String, Object> newMetadata) {
        return new Heading(level, content, newMetadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}
