package com.all2md.core.ast;

/**
 * Visitor over every node variant.
 *
 * <p>Each {@code visitX} method defaults to {@link #visitDefault(Node)}, so an implementation
 * only overrides the variants it cares about. Renderers, validators, collectors and
 * transformers are all built on this interface.
 *
 * @param <R> result type of a visit
 */
public interface NodeVisitor<R> {

    /**
     * Fallback for every variant without a dedicated override.
     *
     * @param node visited node
     * @return visit result
     */
    R visitDefault(Node node);

    default R visitDocument(Document node) {
        return visitDefault(node);
    }

    default R visitHeading(Heading node) {
        return visitDefault(node);
    }

    default R visitParagraph(Paragraph node) {
        return visitDefault(node);
    }

    default R visitCodeBlock(CodeBlock node) {
        return visitDefault(node);
    }

    default R visitBlockQuote(BlockQuote node) {
        return visitDefault(node);
    }

    default R visitListBlock(ListBlock node) {
        return visitDefault(node);
    }

    default R visitListItem(ListItem node) {
        return visitDefault(node);
    }

    default R visitTable(Table node) {
        return visitDefault(node);
    }

    default R visitTableRow(TableRow node) {
        return visitDefault(node);
    }

    default R visitTableCell(TableCell node) {
        return visitDefault(node);
    }

    default R visitThematicBreak(ThematicBreak node) {
        return visitDefault(node);
    }

    default R visitHtmlBlock(HtmlBlock node) {
        return visitDefault(node);
    }

    default R visitComment(Comment node) {
        return visitDefault(node);
    }

    default R visitFootnoteDefinition(FootnoteDefinition node) {
        return visitDefault(node);
    }

    default R visitDefinitionList(DefinitionList node) {
        return visitDefault(node);
    }

    default R visitDefinitionTerm(DefinitionTerm node) {
        return visitDefault(node);
    }

    default R visitDefinitionDescription(DefinitionDescription node) {
        return visitDefault(node);
    }

    default R visitMathBlock(MathBlock node) {
        return visitDefault(node);
    }

    default R visitText(Text node) {
        return visitDefault(node);
    }

    default R visitEmphasis(Emphasis node) {
        return visitDefault(node);
    }

    default R visitStrong(Strong node) {
        return visitDefault(node);
    }

    default R visitCode(Code node) {
        return visitDefault(node);
    }

    default R visitLink(Link node) {
        return visitDefault(node);
    }

    default R visitImage(Image node) {
        return visitDefault(node);
    }

    default R visitLineBreak(LineBreak node) {
        return visitDefault(node);
    }

    default R visitStrikethrough(Strikethrough node) {
        return visitDefault(node);
    }

    default R visitUnderline(Underline node) {
        return visitDefault(node);
    }

    default R visitSuperscript(Superscript node) {
        return visitDefault(node);
    }

    default R visitSubscript(Subscript node) {
        return visitDefault(node);
    }

    default R visitHtmlInline(HtmlInline node) {
        return visitDefault(node);
    }

    default R visitCommentInline(CommentInline node) {
        return visitDefault(node);
    }

    default R visitFootnoteReference(FootnoteReference node) {
        return visitDefault(node);
    }

    default R visitMathInline(MathInline node) {
        return visitDefault(node);
    }
}
