package com.all2md.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Uniform access to the direct children of any node.
 *
 * <p>All traversal and rewriting in the core is built on {@link #get(Node)} and
 * {@link #replace(Node, List)}. The child order returned by {@code get} defines the
 * document order used by every traversal:
 * <ul>
 *   <li>{@link Table}: header row (if any), then body rows</li>
 *   <li>{@link DefinitionList}: each term followed by its descriptions; on replacement,
 *       descriptions without a preceding term are grouped under an empty term</li>
 *   <li>leaf variants ({@link Text}, {@link CodeBlock}, {@link ThematicBreak}, ...): empty</li>
 * </ul>
 */
public final class NodeChildren {

    private static final NodeVisitor<List<Node>> READER = new ChildReader();

    private NodeChildren() {
    }

    /**
     * Returns the direct children of a node.
     *
     * @param node node to inspect
     * @return unmodifiable ordered children, empty for leaf variants
     */
    public static List<Node> get(Node node) {
        return node.accept(READER);
    }

    /**
     * Returns a copy of {@code node} whose direct children are {@code children}.
     *
     * <p>All other fields, metadata and source location are carried over. The child list
     * may differ in length from the original.
     *
     * @param node node to rebuild
     * @param children new ordered children
     * @param <N> node type
     * @return rebuilt node of the same variant
     * @throws UnsupportedNodeKindException if {@code node} is a leaf and {@code children} is not
     *         empty, or if a child's kind is not allowed in {@code node}
     */
    @SuppressWarnings("unchecked")
    public static <N extends Node> N replace(N node, List<? extends Node> children) {
        return (N) node.accept(new ChildReplacer(List.copyOf(children)));
    }

    /**
     * @param node node to inspect
     * @return true if the variant can hold children at all
     */
    public static boolean isContainer(Node node) {
        return !(node instanceof Text
            || node instanceof Code
            || node instanceof CodeBlock
            || node instanceof ThematicBreak
            || node instanceof HtmlBlock
            || node instanceof HtmlInline
            || node instanceof Comment
            || node instanceof CommentInline
            || node instanceof LineBreak
            || node instanceof Image
            || node instanceof FootnoteReference
            || node instanceof MathBlock
            || node instanceof MathInline);
    }

    private static List<Node> view(List<? extends Node> children) {
        return Collections.unmodifiableList(children);
    }

    private static <T extends Node> List<T> require(List<? extends Node> children, Class<T> kind, Node parent) {
        List<T> result = new ArrayList<>(children.size());
        for (Node child : children) {
            if (!kind.isInstance(child)) {
                throw new UnsupportedNodeKindException(parent.nodeType(),
                    "cannot contain " + child.nodeType() + " (expected " + kind.getSimpleName() + ")");
            }
            result.add(kind.cast(child));
        }
        return result;
    }

    private static final class ChildReader implements NodeVisitor<List<Node>> {

        @Override
        public List<Node> visitDefault(Node node) {
            return List.of();
        }

        @Override
        public List<Node> visitDocument(Document node) {
            return view(node.children());
        }

        @Override
        public List<Node> visitHeading(Heading node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitParagraph(Paragraph node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitBlockQuote(BlockQuote node) {
            return view(node.children());
        }

        @Override
        public List<Node> visitListBlock(ListBlock node) {
            return view(node.items());
        }

        @Override
        public List<Node> visitListItem(ListItem node) {
            return view(node.children());
        }

        @Override
        public List<Node> visitTable(Table node) {
            if (node.header() == null) {
                return view(node.rows());
            }
            List<Node> children = new ArrayList<>(node.rows().size() + 1);
            children.add(node.header());
            children.addAll(node.rows());
            return Collections.unmodifiableList(children);
        }

        @Override
        public List<Node> visitTableRow(TableRow node) {
            return view(node.cells());
        }

        @Override
        public List<Node> visitTableCell(TableCell node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitFootnoteDefinition(FootnoteDefinition node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitDefinitionList(DefinitionList node) {
            List<Node> children = new ArrayList<>();
            for (DefinitionItem item : node.items()) {
                children.add(item.term());
                children.addAll(item.descriptions());
            }
            return Collections.unmodifiableList(children);
        }

        @Override
        public List<Node> visitDefinitionTerm(DefinitionTerm node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitDefinitionDescription(DefinitionDescription node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitEmphasis(Emphasis node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitStrong(Strong node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitLink(Link node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitStrikethrough(Strikethrough node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitUnderline(Underline node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitSuperscript(Superscript node) {
            return view(node.content());
        }

        @Override
        public List<Node> visitSubscript(Subscript node) {
            return view(node.content());
        }
    }

    private static final class ChildReplacer implements NodeVisitor<Node> {

        private final List<Node> children;

        private ChildReplacer(List<Node> children) {
            this.children = children;
        }

        @Override
        public Node visitDefault(Node node) {
            if (!children.isEmpty()) {
                throw new UnsupportedNodeKindException(node.nodeType(), "variant cannot hold children");
            }
            return node;
        }

        @Override
        public Node visitDocument(Document node) {
            return new Document(require(children, Block.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitHeading(Heading node) {
            return new Heading(node.level(), require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitParagraph(Paragraph node) {
            return new Paragraph(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitBlockQuote(BlockQuote node) {
            return new BlockQuote(require(children, Block.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitListBlock(ListBlock node) {
            return new ListBlock(node.ordered(), require(children, ListItem.class, node), node.start(), node.tight(),
                node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitListItem(ListItem node) {
            return new ListItem(require(children, Block.class, node), node.taskStatus(), node.metadata(),
                node.sourceLocation());
        }

        @Override
        public Node visitTable(Table node) {
            List<TableRow> rows = require(children, TableRow.class, node);
            TableRow header = null;
            if (node.header() != null && !rows.isEmpty() && rows.get(0).isHeader()) {
                header = rows.get(0);
                rows = rows.subList(1, rows.size());
            }
            return new Table(header, rows, node.alignments(), node.caption(), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitTableRow(TableRow node) {
            return new TableRow(require(children, TableCell.class, node), node.isHeader(), node.metadata(),
                node.sourceLocation());
        }

        @Override
        public Node visitTableCell(TableCell node) {
            return new TableCell(require(children, Inline.class, node), node.colspan(), node.rowspan(),
                node.alignment(), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitFootnoteDefinition(FootnoteDefinition node) {
            return new FootnoteDefinition(node.identifier(), require(children, Block.class, node), node.metadata(),
                node.sourceLocation());
        }

        @Override
        public Node visitDefinitionList(DefinitionList node) {
            List<DefinitionItem> items = new ArrayList<>();
            DefinitionTerm term = null;
            List<DefinitionDescription> descriptions = new ArrayList<>();
            for (Node child : children) {
                if (child instanceof DefinitionTerm next) {
                    if (term != null) {
                        items.add(new DefinitionItem(term, descriptions));
                    }
                    term = next;
                    descriptions = new ArrayList<>();
                } else if (child instanceof DefinitionDescription description) {
                    if (term == null) {
                        // descriptions whose term was removed keep an empty term
                        term = new DefinitionTerm(List.of());
                    }
                    descriptions.add(description);
                } else {
                    throw new UnsupportedNodeKindException(node.nodeType(),
                        "cannot contain " + child.nodeType() + " (expected DefinitionTerm or DefinitionDescription)");
                }
            }
            if (term != null) {
                items.add(new DefinitionItem(term, descriptions));
            }
            return new DefinitionList(items, node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitDefinitionTerm(DefinitionTerm node) {
            return new DefinitionTerm(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitDefinitionDescription(DefinitionDescription node) {
            return new DefinitionDescription(require(children, Block.class, node), node.metadata(),
                node.sourceLocation());
        }

        @Override
        public Node visitEmphasis(Emphasis node) {
            return new Emphasis(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitStrong(Strong node) {
            return new Strong(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitLink(Link node) {
            return new Link(node.url(), require(children, Inline.class, node), node.title(), node.metadata(),
                node.sourceLocation());
        }

        @Override
        public Node visitStrikethrough(Strikethrough node) {
            return new Strikethrough(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitUnderline(Underline node) {
            return new Underline(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitSuperscript(Superscript node) {
            return new Superscript(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }

        @Override
        public Node visitSubscript(Subscript node) {
            return new Subscript(require(children, Inline.class, node), node.metadata(), node.sourceLocation());
        }
    }
}
