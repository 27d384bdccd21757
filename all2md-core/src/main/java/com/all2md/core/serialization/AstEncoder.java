package com.all2md.core.serialization;

import com.all2md.core.ast.Alignment;
import com.all2md.core.ast.BlockQuote;
import com.all2md.core.ast.Code;
import com.all2md.core.ast.CodeBlock;
import com.all2md.core.ast.Comment;
import com.all2md.core.ast.CommentInline;
import com.all2md.core.ast.DefinitionDescription;
import com.all2md.core.ast.DefinitionItem;
import com.all2md.core.ast.DefinitionList;
import com.all2md.core.ast.DefinitionTerm;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Emphasis;
import com.all2md.core.ast.FootnoteDefinition;
import com.all2md.core.ast.FootnoteReference;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.HtmlBlock;
import com.all2md.core.ast.HtmlInline;
import com.all2md.core.ast.Image;
import com.all2md.core.ast.LineBreak;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.MathBlock;
import com.all2md.core.ast.MathInline;
import com.all2md.core.ast.MathNotation;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.NodeVisitor;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.SourceLocation;
import com.all2md.core.ast.Strikethrough;
import com.all2md.core.ast.Strong;
import com.all2md.core.ast.Subscript;
import com.all2md.core.ast.Superscript;
import com.all2md.core.ast.Table;
import com.all2md.core.ast.TableCell;
import com.all2md.core.ast.TableRow;
import com.all2md.core.ast.Text;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.ast.Underline;
import com.all2md.core.ast.UnsupportedNodeKindException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes nodes into the ordered map form: the {@code type} discriminator, then the variant's
 * fields, then {@code metadata} and, when present, {@code source_location}. Optional fields
 * are omitted when null; empty alignment and representation collections are omitted too.
 */
class AstEncoder implements NodeVisitor<Map<String, Object>> {

    @Override
    public Map<String, Object> visitDefault(Node node) {
        throw new UnsupportedNodeKindException(node.nodeType(), "No encoding for node type " + node.nodeType());
    }

    @Override
    public Map<String, Object> visitDocument(Document node) {
        Map<String, Object> map = start(node);
        map.put("children", encodeAll(node.children()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitHeading(Heading node) {
        Map<String, Object> map = start(node);
        map.put("level", node.level());
        map.put("content", encodeAll(node.content()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitParagraph(Paragraph node) {
        Map<String, Object> map = start(node);
        map.put("content", encodeAll(node.content()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitCodeBlock(CodeBlock node) {
        Map<String, Object> map = start(node);
        map.put("content", node.content());
        putIfPresent(map, "language", node.language());
        map.put("fence_char", String.valueOf(node.fenceChar()));
        map.put("fence_length", node.fenceLength());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitBlockQuote(BlockQuote node) {
        Map<String, Object> map = start(node);
        map.put("children", encodeAll(node.children()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitListBlock(ListBlock node) {
        Map<String, Object> map = start(node);
        map.put("ordered", node.ordered());
        map.put("items", encodeAll(node.items()));
        map.put("start", node.start());
        map.put("tight", node.tight());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitListItem(ListItem node) {
        Map<String, Object> map = start(node);
        map.put("children", encodeAll(node.children()));
        if (node.taskStatus() != null) {
            map.put("task_status", node.taskStatus().value());
        }
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitTable(Table node) {
        Map<String, Object> map = start(node);
        if (node.header() != null) {
            map.put("header", node.header().accept(this));
        }
        map.put("rows", encodeAll(node.rows()));
        if (!node.alignments().isEmpty()) {
            List<String> alignments = new ArrayList<>(node.alignments().size());
            for (Alignment alignment : node.alignments()) {
                alignments.add(alignment == null ? null : alignment.value());
            }
            map.put("alignments", alignments);
        }
        putIfPresent(map, "caption", node.caption());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitTableRow(TableRow node) {
        Map<String, Object> map = start(node);
        map.put("cells", encodeAll(node.cells()));
        map.put("is_header", node.isHeader());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitTableCell(TableCell node) {
        Map<String, Object> map = start(node);
        map.put("content", encodeAll(node.content()));
        map.put("colspan", node.colspan());
        map.put("rowspan", node.rowspan());
        if (node.alignment() != null) {
            map.put("alignment", node.alignment().value());
        }
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitThematicBreak(ThematicBreak node) {
        return finish(start(node), node);
    }

    @Override
    public Map<String, Object> visitHtmlBlock(HtmlBlock node) {
        return contentOnly(node, node.content());
    }

    @Override
    public Map<String, Object> visitComment(Comment node) {
        return contentOnly(node, node.content());
    }

    @Override
    public Map<String, Object> visitFootnoteDefinition(FootnoteDefinition node) {
        Map<String, Object> map = start(node);
        map.put("identifier", node.identifier());
        map.put("content", encodeAll(node.content()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitDefinitionList(DefinitionList node) {
        Map<String, Object> map = start(node);
        List<Map<String, Object>> items = new ArrayList<>(node.items().size());
        for (DefinitionItem item : node.items()) {
            Map<String, Object> encoded = new LinkedHashMap<>();
            encoded.put("term", item.term().accept(this));
            encoded.put("descriptions", encodeAll(item.descriptions()));
            items.add(encoded);
        }
        map.put("items", items);
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitDefinitionTerm(DefinitionTerm node) {
        Map<String, Object> map = start(node);
        map.put("content", encodeAll(node.content()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitDefinitionDescription(DefinitionDescription node) {
        Map<String, Object> map = start(node);
        map.put("content", encodeAll(node.content()));
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitMathBlock(MathBlock node) {
        return math(node, node.content(), node.notation(), node.representations());
    }

    @Override
    public Map<String, Object> visitText(Text node) {
        return contentOnly(node, node.content());
    }

    @Override
    public Map<String, Object> visitEmphasis(Emphasis node) {
        return inlineContainer(node, node.content());
    }

    @Override
    public Map<String, Object> visitStrong(Strong node) {
        return inlineContainer(node, node.content());
    }

    @Override
    public Map<String, Object> visitCode(Code node) {
        return contentOnly(node, node.content());
    }

    @Override
    public Map<String, Object> visitLink(Link node) {
        Map<String, Object> map = start(node);
        map.put("url", node.url());
        map.put("content", encodeAll(node.content()));
        putIfPresent(map, "title", node.title());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitImage(Image node) {
        Map<String, Object> map = start(node);
        map.put("url", node.url());
        map.put("alt_text", node.altText());
        putIfPresent(map, "title", node.title());
        putIfPresent(map, "width", node.width());
        putIfPresent(map, "height", node.height());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitLineBreak(LineBreak node) {
        Map<String, Object> map = start(node);
        map.put("soft", node.soft());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitStrikethrough(Strikethrough node) {
        return inlineContainer(node, node.content());
    }

    @Override
    public Map<String, Object> visitUnderline(Underline node) {
        return inlineContainer(node, node.content());
    }

    @Override
    public Map<String, Object> visitSuperscript(Superscript node) {
        return inlineContainer(node, node.content());
    }

    @Override
    public Map<String, Object> visitSubscript(Subscript node) {
        return inlineContainer(node, node.content());
    }

    @Override
    public Map<String, Object> visitHtmlInline(HtmlInline node) {
        return contentOnly(node, node.content());
    }

    @Override
    public Map<String, Object> visitCommentInline(CommentInline node) {
        return contentOnly(node, node.content());
    }

    @Override
    public Map<String, Object> visitFootnoteReference(FootnoteReference node) {
        Map<String, Object> map = start(node);
        map.put("identifier", node.identifier());
        return finish(map, node);
    }

    @Override
    public Map<String, Object> visitMathInline(MathInline node) {
        return math(node, node.content(), node.notation(), node.representations());
    }

    static Map<String, Object> encodeSourceLocation(SourceLocation location) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("format", location.format());
        putIfPresent(map, "page", location.page());
        putIfPresent(map, "line", location.line());
        putIfPresent(map, "column", location.column());
        putIfPresent(map, "element_id", location.elementId());
        if (!location.metadata().isEmpty()) {
            map.put("metadata", new LinkedHashMap<>(location.metadata()));
        }
        return map;
    }

    private List<Map<String, Object>> encodeAll(List<? extends Node> nodes) {
        List<Map<String, Object>> encoded = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            encoded.add(node.accept(this));
        }
        return encoded;
    }

    private Map<String, Object> contentOnly(Node node, String content) {
        Map<String, Object> map = start(node);
        map.put("content", content);
        return finish(map, node);
    }

    private Map<String, Object> inlineContainer(Node node, List<? extends Node> content) {
        Map<String, Object> map = start(node);
        map.put("content", encodeAll(content));
        return finish(map, node);
    }

    private Map<String, Object> math(Node node, String content, MathNotation notation, Map<String, String> representations) {
        Map<String, Object> map = start(node);
        map.put("content", content);
        map.put("notation", notation.value());
        if (!representations.isEmpty()) {
            map.put("representations", new LinkedHashMap<>(representations));
        }
        return finish(map, node);
    }

    private static Map<String, Object> start(Node node) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(AstSerializer.TYPE_KEY, node.nodeType());
        return map;
    }

    private static Map<String, Object> finish(Map<String, Object> map, Node node) {
        map.put("metadata", new LinkedHashMap<>(node.metadata()));
        if (node.sourceLocation() != null) {
            map.put("source_location", encodeSourceLocation(node.sourceLocation()));
        }
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
