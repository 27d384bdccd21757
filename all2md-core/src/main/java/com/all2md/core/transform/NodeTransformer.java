package com.all2md.core.transform;

import com.all2md.core.ast.Document;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.NodeChildren;
import com.all2md.core.ast.NodeVisitor;
import com.all2md.core.ast.StructuralException;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for tree rewriting visitors.
 *
 * <p>The default visit rebuilds each container from its transformed children and returns
 * leaves unchanged. Subclasses override individual {@code visitX} methods and either
 * return a replacement node or {@code null} to delete the node from its parent. Inputs are
 * never mutated; untouched leaves are shared between the input and output trees, which is
 * safe because nodes are immutable.
 *
 * <pre>{@code
 * class Uppercase extends NodeTransformer {
 *     @Override
 *     public Node visitText(Text node) {
 *         return node.withContent(node.content().toUpperCase());
 *     }
 * }
 * Document shouted = new Uppercase().transformDocument(doc);
 * }</pre>
 */
public class NodeTransformer implements NodeVisitor<Node> {

    /**
     * Transforms a tree rooted at {@code node}.
     *
     * @param node root to transform
     * @return transformed root, or null if the root itself was deleted
     */
    public Node transform(Node node) {
        return node.accept(this);
    }

    /**
     * Transforms a document; the result must still be a document.
     *
     * @param document document to transform
     * @return transformed document
     * @throws StructuralException if the transformer deleted or replaced the root
     */
    public Document transformDocument(Document document) {
        Node result = transform(document);
        if (result instanceof Document transformed) {
            return transformed;
        }
        throw new StructuralException("Transformer " + getClass().getSimpleName()
            + " must return a Document for the root, got " + (result == null ? "null" : result.nodeType()));
    }

    @Override
    public Node visitDefault(Node node) {
        if (!NodeChildren.isContainer(node)) {
            return node;
        }
        return NodeChildren.replace(node, transformChildren(NodeChildren.get(node)));
    }

    /**
     * Transforms each child and splices the results in order.
     *
     * @param children children to transform
     * @return flattened replacement children
     */
    protected List<Node> transformChildren(List<? extends Node> children) {
        List<Node> result = new ArrayList<>(children.size());
        for (Node child : children) {
            result.addAll(transformChild(child));
        }
        return result;
    }

    /**
     * Transforms a single child into zero, one or many replacement nodes.
     *
     * <p>The default dispatches to the child's {@code visitX} method, treating {@code null}
     * as deletion. Override to splice several nodes in place of one.
     *
     * @param child child to transform
     * @return replacement nodes
     */
    protected List<Node> transformChild(Node child) {
        Node result = child.accept(this);
        return result == null ? List.of() : List.of(result);
    }
}
