package com.all2md.core.visitor;

import com.all2md.core.ast.Node;
import com.all2md.core.ast.NodeChildren;
import com.all2md.core.ast.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Read-only visitor that gathers nodes matching a predicate.
 *
 * <p>Traversal is pre-order depth-first: a node is tested before its children, and each
 * child subtree is finished before the next sibling is entered. The root itself is tested.
 */
public class NodeCollector implements NodeVisitor<Void> {

    private final Predicate<? super Node> predicate;
    private final List<Node> collected = new ArrayList<>();

    public NodeCollector(Predicate<? super Node> predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
    }

    /**
     * Collects every node of the given variant under {@code root}, in document order.
     *
     * @param root tree to search
     * @param type variant to collect
     * @param <T> variant type
     * @return matching nodes, not copied
     */
    public static <T extends Node> List<T> collect(Node root, Class<T> type) {
        return collect(root, type::isInstance).stream().map(type::cast).toList();
    }

    /**
     * Collects every node under {@code root} accepted by {@code predicate}, in document order.
     *
     * @param root tree to search
     * @param predicate node filter
     * @return matching nodes, not copied
     */
    public static List<Node> collect(Node root, Predicate<? super Node> predicate) {
        NodeCollector collector = new NodeCollector(predicate);
        root.accept(collector);
        return collector.getCollected();
    }

    @Override
    public Void visitDefault(Node node) {
        if (predicate.test(node)) {
            collected.add(node);
        }
        for (Node child : NodeChildren.get(node)) {
            child.accept(this);
        }
        return null;
    }

    public List<Node> getCollected() {
        return List.copyOf(collected);
    }
}
