package com.all2md.core.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Inline image.
 *
 * <p>Provenance such as {@code watermark} or {@code source_data} is kept in metadata.
 *
 * @param url image location, possibly a {@code data:} URI
 * @param altText alternative text, never null
 * @param title optional title, or null
 * @param width width in pixels, or null
 * @param height height in pixels, or null
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Image(
    String url,
    String altText,
    String title,
    Integer width,
    Integer height,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Inline {

    public Image {
        Objects.requireNonNull(url, "url must not be null");
        if (altText == null) {
            altText = "";
        }
        metadata = Metadata.copyOf(metadata);
    }

    public Image(String url, String altText) {
        this(url, altText, null, null, null, null, null);
    }

    public Image withUrl(String newUrl) {
        return new Image(newUrl, altText, title, width, height, metadata, sourceLocation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitImage(this);
    }
}
