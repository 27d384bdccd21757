package com.all2md.core.ast;

import java.util.List;
import java.util.StringJoiner;

/**
 * Plain-text helpers over node trees.
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * Flattens a node to plain text.
     *
     * <p>Inline content is concatenated as is; sibling blocks are separated by a single space.
     * Images, raw HTML and comments contribute no text.
     *
     * @param node node to flatten
     * @return plain text, never null
     */
    public static String extractText(Node node) {
        return textOf(node, " ");
    }

    /**
     * Flattens a sequence of nodes, separating non-empty entries with {@code joiner}.
     *
     * @param nodes nodes to flatten
     * @param joiner separator between entries
     * @return plain text, never null
     */
    public static String extractText(List<? extends Node> nodes, String joiner) {
        StringJoiner result = new StringJoiner(joiner);
        for (Node node : nodes) {
            String text = textOf(node, joiner);
            if (!text.isEmpty()) {
                result.add(text);
            }
        }
        return result.toString();
    }

    /**
     * Counts whitespace-separated words in the flattened text of {@code nodes}.
     *
     * @param nodes nodes to count
     * @return word count
     */
    public static int wordCount(List<? extends Node> nodes) {
        String text = extractText(nodes, " ").strip();
        return text.isEmpty() ? 0 : text.split("\\s+").length;
    }

    private static String textOf(Node node, String joiner) {
        if (node instanceof Text text) {
            return text.content();
        }
        if (node instanceof Code code) {
            return code.content();
        }
        if (node instanceof MathInline math) {
            return math.content();
        }
        if (node instanceof CodeBlock codeBlock) {
            return codeBlock.content();
        }
        if (node instanceof LineBreak) {
            return " ";
        }
        List<Node> children = NodeChildren.get(node);
        if (node instanceof Inline || node instanceof Heading || node instanceof Paragraph
            || node instanceof TableCell || node instanceof DefinitionTerm) {
            StringBuilder text = new StringBuilder();
            for (Node child : children) {
                text.append(textOf(child, joiner));
            }
            return text.toString();
        }
        return extractText(children, joiner);
    }
}
