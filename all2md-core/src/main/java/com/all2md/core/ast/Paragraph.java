package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Paragraph of inline content.
 *
 * @param content inline content
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Paragraph(
    List<Inline> content,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    public Paragraph {
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public Paragraph(List<Inline> content) {
        this(content, null, null);
    }

    public Paragraph(String text) {
        this(List.of(new Text(text)), null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
