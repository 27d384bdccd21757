package com.all2md.core.ast;

/**
 * Variant names shared by the serialized form and diagnostics.
 */
public final class NodeTypes {

    public static final String LIST = "List";
    public static final String HTML_BLOCK = "HTMLBlock";
    public static final String HTML_INLINE = "HTMLInline";

    private NodeTypes() {
    }

    /**
     * Returns the variant name of a node.
     *
     * <p>Matches the Java record name except for {@link ListBlock}, {@link HtmlBlock}
     * and {@link HtmlInline}, which keep their historical names.
     *
     * @param node node to name
     * @return variant name
     */
    public static String nameOf(Node node) {
        if (node instanceof ListBlock) {
            return LIST;
        }
        if (node instanceof HtmlBlock) {
            return HTML_BLOCK;
        }
        if (node instanceof HtmlInline) {
            return HTML_INLINE;
        }
        return node.getClass().getSimpleName();
    }
}
