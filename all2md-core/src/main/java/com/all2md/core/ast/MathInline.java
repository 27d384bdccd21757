package com.all2md.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inline math.
 *
 * @param content math source in the primary notation
 * @param notation notation of {@code content}
 * @param representations alternative renderings keyed by notation value
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record MathInline(
    String content,
    MathNotation notation,
    Map<String, String> representations,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public MathInline {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(notation, "notation must not be null");
        representations = representations == null || representations.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(representations));
        metadata = Metadata.copyOf(metadata);
    }

    public MathInline(String content, MathNotation notation) {
        this(content, notation, null, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMathInline(this);
    }
}
