package com.all2md.core.ast;

import java.util.List;
import java.util.Map;

/**
 * Table with an optional header row.
 *
 * <p>A header passed in without its {@code isHeader} flag set is normalized to a header row.
 * Alignments are per column and, when present, should match the header's cell count;
 * {@link com.all2md.core.visitor.ValidatingVisitor} reports mismatches.
 *
 * @param header header row, or null
 * @param rows body rows
 * @param alignments per-column alignment, may be empty
 * @param caption caption text, or null
 * @param metadata format-specific metadata
 * @param sourceLocation origin in the source document, or null
 */
public record Table(
    TableRow header,
    List<TableRow> rows,
    List<Alignment> alignments,
    String caption,
    Map<String, Object> metadata,
    SourceLocation sourceLocation
) implements Block {

    /**
     * Compact constructor with validation.
     */
    public Table {
        if (header != null && !header.isHeader()) {
            header = new TableRow(header.cells(), true, header.metadata(), header.sourceLocation());
        }
        rows = rows == null ? List.of() : List.copyOf(rows);
        alignments = alignments == null ? List.of() : List.copyOf(alignments);
        metadata = Metadata.copyOf(metadata);
    }

    public Table(TableRow header, List<TableRow> rows) {
        this(header, rows, null, null, null, null);
    }

    /**
     * @return number of columns: the header's cell count, else the widest body row
     */
    public int columnCount() {
        if (header != null) {
            return header.cells().size();
        }
        return rows.stream().mapToInt(row -> row.cells().size()).max().orElse(0);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
