package com.all2md.core.ast.builder;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.TaskStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds nested lists from a flat sequence of (level, item) entries, as produced by
 * formats that store list depth as an attribute of each paragraph.
 *
 * <p>Deeper levels nest under the last item of the enclosing list; skipped levels get
 * an empty placeholder item. Switching between ordered and unordered at the same level
 * starts a sibling list.
 *
 * <pre>{@code
 * ListBuilder builder = new ListBuilder();
 * builder.addItem(1, false, List.of(new Paragraph("Item 1")));
 * builder.addItem(2, false, List.of(new Paragraph("Nested")));
 * builder.addItem(1, false, List.of(new Paragraph("Item 2")));
 * List<ListBlock> lists = builder.build();
 * }</pre>
 */
public class ListBuilder {

    private final List<DraftList> roots = new ArrayList<>();
    private final Deque<DraftList> stack = new ArrayDeque<>();

    public ListBuilder addItem(int level, boolean ordered, List<Block> content) {
        return addItem(level, ordered, content, null);
    }

    /**
     * Adds an item at the given nesting level.
     *
     * @param level nesting level, 1 for top level
     * @param ordered whether the list at this level is ordered
     * @param content block content of the item
     * @param taskStatus checkbox state, or null
     * @return this builder
     * @throws IllegalArgumentException if level is less than 1
     */
    public ListBuilder addItem(int level, boolean ordered, List<Block> content, TaskStatus taskStatus) {
        if (level < 1) {
            throw new IllegalArgumentException("Level must be >= 1, got " + level);
        }
        while (!stack.isEmpty() && stack.peek().level > level) {
            stack.pop();
        }

        if (!stack.isEmpty() && stack.peek().level == level && stack.peek().ordered != ordered) {
            stack.pop();
            attach(new DraftList(ordered, level));
        }

        int currentLevel = stack.isEmpty() ? 0 : stack.peek().level;
        while (currentLevel < level) {
            currentLevel++;
            attach(new DraftList(ordered, currentLevel));
        }

        stack.peek().items.add(new DraftItem(content, taskStatus));
        return this;
    }

    /**
     * @return top-level lists in the order they were started
     */
    public List<ListBlock> build() {
        return roots.stream().map(DraftList::freeze).toList();
    }

    /**
     * @return document whose children are the built lists
     */
    public Document buildDocument() {
        return new Document(new ArrayList<>(build()));
    }

    private void attach(DraftList list) {
        if (stack.isEmpty()) {
            roots.add(list);
        } else {
            DraftList parent = stack.peek();
            if (parent.items.isEmpty()) {
                parent.items.add(new DraftItem(List.of(), null));
            }
            parent.items.get(parent.items.size() - 1).nested.add(list);
        }
        stack.push(list);
    }

    private static final class DraftList {
        private final boolean ordered;
        private final int level;
        private final List<DraftItem> items = new ArrayList<>();

        private DraftList(boolean ordered, int level) {
            this.ordered = ordered;
            this.level = level;
        }

        private ListBlock freeze() {
            return new ListBlock(ordered, items.stream().map(DraftItem::freeze).toList());
        }
    }

    private static final class DraftItem {
        private final List<Block> content;
        private final TaskStatus taskStatus;
        private final List<DraftList> nested = new ArrayList<>();

        private DraftItem(List<Block> content, TaskStatus taskStatus) {
            this.content = List.copyOf(content);
            this.taskStatus = taskStatus;
        }

        private ListItem freeze() {
            List<Block> children = new ArrayList<>(content);
            nested.forEach(list -> children.add(list.freeze()));
            return new ListItem(children, taskStatus, null, null);
        }
    }
}
