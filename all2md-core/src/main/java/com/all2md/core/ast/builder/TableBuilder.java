package com.all2md.core.ast.builder;

import com.all2md.core.ast.Alignment;
import com.all2md.core.ast.Inline;
import com.all2md.core.ast.Table;
import com.all2md.core.ast.TableCell;
import com.all2md.core.ast.TableRow;
import com.all2md.core.ast.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Incremental builder for {@link Table} nodes.
 *
 * <p>With {@code hasHeader} set, the first row added becomes the header. Alignments are
 * padded with {@link Alignment#NONE} to the column count when the table is built.
 */
public class TableBuilder {

    private final boolean hasHeader;
    private TableRow header;
    private final List<TableRow> rows = new ArrayList<>();
    private final List<Alignment> alignments = new ArrayList<>();
    private String caption;

    public TableBuilder() {
        this(false);
    }

    public TableBuilder(boolean hasHeader) {
        this.hasHeader = hasHeader;
    }

    /**
     * Adds a row of plain-text cells.
     *
     * @param cells cell texts
     * @return this builder
     */
    public TableBuilder addRow(String... cells) {
        List<List<Inline>> content = new ArrayList<>();
        for (String cell : cells) {
            content.add(List.of(new Text(cell)));
        }
        return addRow(content, false);
    }

    /**
     * Adds a row of cells with inline content.
     *
     * @param cells inline content per cell
     * @param isHeader whether the row is the header row
     * @return this builder
     */
    public TableBuilder addRow(List<List<Inline>> cells, boolean isHeader) {
        boolean header = isHeader || (hasHeader && this.header == null);
        List<TableCell> tableCells = cells.stream().map(TableCell::new).toList();
        TableRow row = new TableRow(tableCells, header);
        if (header) {
            this.header = row;
        } else {
            rows.add(row);
        }
        return this;
    }

    public TableBuilder caption(String caption) {
        this.caption = caption;
        return this;
    }

    /**
     * Sets the alignment of one column.
     *
     * @param columnIndex zero-based column index
     * @param alignment column alignment
     * @return this builder
     */
    public TableBuilder columnAlignment(int columnIndex, Alignment alignment) {
        while (alignments.size() <= columnIndex) {
            alignments.add(Alignment.NONE);
        }
        alignments.set(columnIndex, alignment == null ? Alignment.NONE : alignment);
        return this;
    }

    public Table build() {
        Table draft = new Table(header, rows);
        List<Alignment> padded = new ArrayList<>(alignments);
        if (!padded.isEmpty() || header != null) {
            while (padded.size() < draft.columnCount()) {
                padded.add(Alignment.NONE);
            }
        }
        return new Table(header, rows, padded, caption, null, null);
    }
}
