package com.all2md.core.ast.builder;

import com.all2md.core.ast.Alignment;
import com.all2md.core.ast.Table;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TableBuilder}.
 */
class TableBuilderTest {

    @Test
    void build_withHeader_usesFirstRowAsHeader() {
        Table table = new TableBuilder(true)
            .addRow("Name", "Age", "City")
            .addRow("Ada", "36", "London")
            .caption("People")
            .build();

        assertThat(table.header()).isNotNull();
        assertThat(table.header().isHeader()).isTrue();
        assertThat(table.rows()).hasSize(1);
        assertThat(table.caption()).isEqualTo("People");
        assertThat(table.columnCount()).isEqualTo(3);
    }

    @Test
    void build_withPartialAlignments_padsWithNone() {
        Table table = new TableBuilder(true)
            .addRow("a", "b", "c")
            .columnAlignment(1, Alignment.RIGHT)
            .build();

        assertThat(table.alignments()).containsExactly(Alignment.NONE, Alignment.RIGHT, Alignment.NONE);
    }

    @Test
    void build_withoutHeader_keepsAllRowsInBody() {
        Table table = new TableBuilder(false).addRow("a").addRow("b").build();

        assertThat(table.header()).isNull();
        assertThat(table.rows()).hasSize(2);
        assertThat(table.alignments()).isEmpty();
    }
}
