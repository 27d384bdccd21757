package com.all2md.core.ast.builder;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListBuilder}.
 */
class ListBuilderTest {

    private static List<Block> item(String text) {
        return List.of(new Paragraph(text));
    }

    @Test
    void build_withNestedLevels_nestsUnderLastItem() {
        List<ListBlock> lists = new ListBuilder()
            .addItem(1, false, item("Item 1"))
            .addItem(2, false, item("Nested"))
            .addItem(1, false, item("Item 2"))
            .build();

        assertThat(lists).hasSize(1);
        ListBlock list = lists.get(0);
        assertThat(list.items()).hasSize(2);
        assertThat(list.items().get(0).children()).hasSize(2);
        assertThat(list.items().get(0).children().get(1)).isInstanceOf(ListBlock.class);
    }

    @Test
    void build_withSkippedLevel_insertsPlaceholderItem() {
        List<ListBlock> lists = new ListBuilder()
            .addItem(1, true, item("Top"))
            .addItem(3, true, item("Deep"))
            .build();

        ListBlock level2 = (ListBlock) lists.get(0).items().get(0).children().get(1);
        ListItem placeholder = level2.items().get(0);
        assertThat(placeholder.children()).hasSize(1).allMatch(ListBlock.class::isInstance);
    }

    @Test
    void build_withKindSwitchAtSameLevel_startsSiblingList() {
        List<ListBlock> lists = new ListBuilder()
            .addItem(1, false, item("bullet"))
            .addItem(1, true, item("number"))
            .build();

        assertThat(lists).extracting(ListBlock::ordered).containsExactly(false, true);
    }

    @Test
    void addItem_withTaskStatus_keepsIt() {
        List<ListBlock> lists = new ListBuilder()
            .addItem(1, false, item("done"), TaskStatus.CHECKED)
            .build();

        assertThat(lists.get(0).items().get(0).taskStatus()).isEqualTo(TaskStatus.CHECKED);
    }

    @Test
    void addItem_withLevelBelowOne_throwsException() {
        assertThatThrownBy(() -> new ListBuilder().addItem(0, false, item("x")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Level must be >= 1");
    }

    @Test
    void buildDocument_wrapsLists() {
        assertThat(new ListBuilder().addItem(1, false, item("x")).buildDocument().children()).hasSize(1);
    }
}
