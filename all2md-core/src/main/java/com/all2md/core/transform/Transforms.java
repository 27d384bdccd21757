package com.all2md.core.transform;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Code;
import com.all2md.core.ast.CodeBlock;
import com.all2md.core.ast.Comment;
import com.all2md.core.ast.CommentInline;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.FootnoteReference;
import com.all2md.core.ast.HtmlBlock;
import com.all2md.core.ast.HtmlInline;
import com.all2md.core.ast.Image;
import com.all2md.core.ast.LineBreak;
import com.all2md.core.ast.MathBlock;
import com.all2md.core.ast.MathInline;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.Text;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.visitor.NodeCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Pure tree operations: clone, filter, extract, rewrite and merge.
 *
 * <p>None of these methods mutate their input.
 */
public final class Transforms {

    private static final Logger log = LoggerFactory.getLogger(Transforms.class);

    private Transforms() {
    }

    /**
     * Deep copy of a tree. Every node and metadata map in the result is a new instance.
     *
     * @param node tree to copy
     * @param <N> node type
     * @return independent copy equal to {@code node}
     */
    @SuppressWarnings("unchecked")
    public static <N extends Node> N cloneNode(N node) {
        return (N) new DeepCopier().transform(node);
    }

    /**
     * Removes every descendant for which {@code keep} is false. The root is always kept.
     *
     * <p>Removing a node drops its whole subtree. Containers emptied this way, such as a
     * table without rows, are kept as degenerate nodes.
     *
     * @param tree tree to filter
     * @param keep predicate selecting nodes to keep
     * @param <N> root type
     * @return filtered copy
     */
    @SuppressWarnings("unchecked")
    public static <N extends Node> N filterNodes(N tree, Predicate<? super Node> keep) {
        Objects.requireNonNull(keep, "keep must not be null");
        NodeTransformer filter = new NodeTransformer() {
            @Override
            protected List<Node> transformChild(Node child) {
                return keep.test(child) ? super.transformChild(child) : List.of();
            }
        };
        return (N) filter.transform(tree);
    }

    /**
     * Returns the nodes of a variant in document order, without copying.
     *
     * @param tree tree to search
     * @param type variant to extract
     * @param <T> variant type
     * @return matching nodes
     */
    public static <T extends Node> List<T> extractNodes(Node tree, Class<T> type) {
        return NodeCollector.collect(tree, type);
    }

    /**
     * Returns the nodes accepted by {@code predicate} in document order, without copying.
     *
     * @param tree tree to search
     * @param predicate node filter
     * @return matching nodes
     */
    public static List<Node> extractNodes(Node tree, Predicate<? super Node> predicate) {
        return NodeCollector.collect(tree, predicate);
    }

    /**
     * Rewrites every descendant of {@code document} with {@code fn}.
     *
     * <p>Children are rewritten first, then {@code fn} receives the rebuilt node and returns
     * its replacements: an empty list deletes the node, one node replaces it, several nodes
     * are spliced in its place. The function never sees its own output again.
     *
     * @param document document to rewrite; the root itself is not passed to {@code fn}
     * @param fn per-node rewrite
     * @return rewritten document
     */
    public static Document transformNodes(Document document, Function<? super Node, ? extends List<? extends Node>> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        NodeTransformer rewriter = new NodeTransformer() {
            @Override
            protected List<Node> transformChild(Node child) {
                Node rebuilt = child.accept(this);
                List<? extends Node> replacements = fn.apply(rebuilt);
                return replacements == null ? List.of() : List.copyOf(replacements);
            }
        };
        return rewriter.transformDocument(document);
    }

    /**
     * Applies a transformer to a document.
     *
     * @param document document to transform
     * @param transformer transformer to apply
     * @return transformed document
     */
    public static Document transformNodes(Document document, NodeTransformer transformer) {
        return transformer.transformDocument(document);
    }

    public static Document mergeDocuments(List<Document> documents) {
        return mergeDocuments(documents, null, MetadataMerger.lastWriteWins());
    }

    public static Document mergeDocuments(List<Document> documents, Block separator) {
        return mergeDocuments(documents, separator, MetadataMerger.lastWriteWins());
    }

    /**
     * Concatenates documents in order.
     *
     * @param documents documents to merge
     * @param separator block inserted between consecutive documents, or null
     * @param merger metadata merge strategy
     * @return merged document
     */
    public static Document mergeDocuments(List<Document> documents, Block separator, MetadataMerger merger) {
        Objects.requireNonNull(merger, "merger must not be null");
        List<Block> children = new ArrayList<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            if (i > 0 && separator != null) {
                children.add(separator);
            }
            Document document = documents.get(i);
            children.addAll(document.children());
            metadata = merger.merge(metadata, document.metadata());
        }
        log.debug("Merged {} document(s) into {} block(s)", documents.size(), children.size());
        return new Document(children, metadata);
    }

    /**
     * Rebuilds leaves as well as containers so that no node instance is shared.
     */
    private static final class DeepCopier extends NodeTransformer {

        @Override
        public Node visitCodeBlock(CodeBlock n) {
            return new CodeBlock(n.content(), n.language(), n.fenceChar(), n.fenceLength(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitThematicBreak(ThematicBreak n) {
            return new ThematicBreak(n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitHtmlBlock(HtmlBlock n) {
            return new HtmlBlock(n.content(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitComment(Comment n) {
            return new Comment(n.content(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitMathBlock(MathBlock n) {
            return new MathBlock(n.content(), n.notation(), n.representations(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitText(Text n) {
            return new Text(n.content(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitCode(Code n) {
            return new Code(n.content(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitImage(Image n) {
            return new Image(n.url(), n.altText(), n.title(), n.width(), n.height(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitLineBreak(LineBreak n) {
            return new LineBreak(n.soft(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitHtmlInline(HtmlInline n) {
            return new HtmlInline(n.content(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitCommentInline(CommentInline n) {
            return new CommentInline(n.content(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitFootnoteReference(FootnoteReference n) {
            return new FootnoteReference(n.identifier(), n.metadata(), n.sourceLocation());
        }

        @Override
        public Node visitMathInline(MathInline n) {
            return new MathInline(n.content(), n.notation(), n.representations(), n.metadata(), n.sourceLocation());
        }
    }
}
