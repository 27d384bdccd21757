package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Cell of a {@link TableRow}.
 *
 * <p>Spans are carried by the model; renderers are free to flatten them.
 *
 * @param content inline content
 * @param colspan number of columns spanned, at least 1
 * @param rowspan number of rows spanned, at least 1
 * @param alignment cell alignment override, or null to inherit the column's
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record TableCell(
    List<Inline> content,
    int colspan,
    int rowspan,
    Alignment alignment,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public TableCell {
        if (colspan < 1 || rowspan < 1) {
            throw new IllegalArgumentException(
                "colspan and rowspan must be at least 1, got " + colspan + "/" + rowspan);
        }
        if (alignment == Alignment.NONE) {
            alignment = null;
        }
        content = content == null ? List.of() : List.copyOf(content);
        metadata = Metadata.copyOf(metadata);
    }

    public TableCell(List<Inline> content) {
        this(content, 1, 1, null, null, null);
    }

    public TableCell(String text) {
        this(List.of(new Text(text)));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableCell(this);
    }
}
