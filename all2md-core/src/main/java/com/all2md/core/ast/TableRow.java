package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Row of a {@link Table}.
 *
 * @param cells cells in column order
 * @param isHeader whether this is a header row
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record TableRow(
    List<TableCell> cells,
    boolean isHeader,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Node {

    public TableRow {
        cells = cells == null ? List.of() : List.copyOf(cells);
        metadata = Metadata.copyOf(metadata);
    }

    public TableRow(List<TableCell> cells, boolean isHeader) {
        this(cells, isHeader, null, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableRow(this);
    }
}
