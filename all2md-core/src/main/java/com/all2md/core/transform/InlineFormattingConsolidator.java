package com.all2md.core.transform;

import com.all2md.core.ast.Emphasis;
import com.all2md.core.ast.Inline;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.Strong;
import com.all2md.core.ast.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Repairs inline formatting that a converter split into fragments, as text extracted from PDF
 * spans often is.
 *
 * <p>In every inline sequence, bottom-up:
 * <ol>
 *   <li>adjacent {@link Strong} nodes are merged, as are adjacent {@link Emphasis} nodes</li>
 *   <li>leading and trailing whitespace moves outside the formatting, so {@code **text **}
 *       becomes {@code **text**} followed by a space</li>
 *   <li>formatting left empty is dropped and whitespace-only formatting becomes plain text</li>
 *   <li>adjacent {@link Text} nodes are joined and empty ones removed</li>
 * </ol>
 * Formatting that nests other formatting, such as {@code ***both***}, is left as it is. Links
 * are never merged across.
 */
public class InlineFormattingConsolidator extends NodeTransformer {

    @Override
    protected List<Node> transformChildren(List<? extends Node> children) {
        List<Node> transformed = super.transformChildren(children);
        for (Node child : transformed) {
            if (!(child instanceof Inline)) {
                return transformed;
            }
        }
        return mergeText(normalizeWhitespace(mergeAdjacentFormatting(transformed)));
    }

    private List<Node> mergeAdjacentFormatting(List<Node> nodes) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            Node previous = result.isEmpty() ? null : result.get(result.size() - 1);
            if (isPlainFormatting(node) && isPlainFormatting(previous) && previous.getClass() == node.getClass()) {
                List<Node> content = new ArrayList<>(content(previous));
                content.addAll(content(node));
                result.set(result.size() - 1, withContent(previous, mergeText(content)));
            } else {
                result.add(node);
            }
        }
        return result;
    }

    private List<Node> normalizeWhitespace(List<Node> nodes) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (!isPlainFormatting(node)) {
                result.add(node);
                continue;
            }
            List<Inline> content = content(node);
            String text = textOnly(content);
            if (text != null && text.isEmpty()) {
                continue;
            }
            if (text != null && text.isBlank()) {
                result.add(new Text(text, node.metadata(), node.sourceLocation()));
                continue;
            }

            List<Node> trimmed = new ArrayList<>(content);
            String leading = "";
            String trailing = "";
            if (trimmed.get(0) instanceof Text first) {
                String stripped = first.content().stripLeading();
                leading = first.content().substring(0, first.content().length() - stripped.length());
                trimmed.set(0, first.withContent(stripped));
            }
            int last = trimmed.size() - 1;
            if (trimmed.get(last) instanceof Text end) {
                String stripped = end.content().stripTrailing();
                trailing = end.content().substring(stripped.length());
                trimmed.set(last, end.withContent(stripped));
            }
            if (!leading.isEmpty()) {
                result.add(new Text(leading));
            }
            result.add(leading.isEmpty() && trailing.isEmpty() ? node : withContent(node, mergeText(trimmed)));
            if (!trailing.isEmpty()) {
                result.add(new Text(trailing));
            }
        }
        return result;
    }

    private static List<Node> mergeText(List<Node> nodes) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (node instanceof Text text) {
                if (text.content().isEmpty()) {
                    continue;
                }
                if (!result.isEmpty() && result.get(result.size() - 1) instanceof Text previous) {
                    result.set(result.size() - 1, previous.withContent(previous.content() + text.content()));
                    continue;
                }
            }
            result.add(node);
        }
        return result;
    }

    /**
     * @return true for a Strong or Emphasis node whose content holds no further Strong or Emphasis
     */
    private static boolean isPlainFormatting(Node node) {
        if (!(node instanceof Strong) && !(node instanceof Emphasis)) {
            return false;
        }
        for (Inline child : content(node)) {
            if (child instanceof Strong || child instanceof Emphasis) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the concatenated text when {@code content} is only Text nodes, otherwise null
     */
    private static String textOnly(List<Inline> content) {
        StringBuilder text = new StringBuilder();
        for (Inline child : content) {
            if (!(child instanceof Text t)) {
                return null;
            }
            text.append(t.content());
        }
        return text.toString();
    }

    private static List<Inline> content(Node formatting) {
        return formatting instanceof Strong strong ? strong.content() : ((Emphasis) formatting).content();
    }

    private static Node withContent(Node formatting, List<Node> content) {
        List<Inline> inlines = new ArrayList<>(content.size());
        for (Node node : content) {
            inlines.add((Inline) node);
        }
        if (formatting instanceof Strong strong) {
            return new Strong(inlines, strong.metadata(), strong.sourceLocation());
        }
        Emphasis emphasis = (Emphasis) formatting;
        return new Emphasis(inlines, emphasis.metadata(), emphasis.sourceLocation());
    }
}
