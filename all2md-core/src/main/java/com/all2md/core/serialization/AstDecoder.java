package com.all2md.core.serialization;

import com.all2md.core.ast.Alignment;
import com.all2md.core.ast.Block;
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
import com.all2md.core.ast.Inline;
import com.all2md.core.ast.LineBreak;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.MathBlock;
import com.all2md.core.ast.MathInline;
import com.all2md.core.ast.MathNotation;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.NodeTypes;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.SourceLocation;
import com.all2md.core.ast.Strikethrough;
import com.all2md.core.ast.Strong;
import com.all2md.core.ast.Subscript;
import com.all2md.core.ast.Superscript;
import com.all2md.core.ast.Table;
import com.all2md.core.ast.TableCell;
import com.all2md.core.ast.TableRow;
import com.all2md.core.ast.TaskStatus;
import com.all2md.core.ast.Text;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.ast.Underline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the ordered map form back into nodes.
 *
 * <p>The discriminator key is configurable so the same decoder reads the current format
 * ({@code type}) and the legacy one ({@code node_type}). Every failure is reported as a
 * {@link MalformedAstException} naming the path of the offending node.
 */
class AstDecoder {

    private final String typeKey;

    AstDecoder(String typeKey) {
        this.typeKey = typeKey;
    }

    Node decode(Map<String, Object> data, String path) {
        Fields fields = new Fields(data, path);
        String type = fields.requireString(typeKey);
        try {
            return decodeVariant(type, fields);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MalformedAstException("Invalid " + type + " at " + path + ": " + e.getMessage(), e);
        }
    }

    private Node decodeVariant(String type, Fields f) {
        Map<String, Object> metadata = f.metadata();
        SourceLocation location = f.sourceLocation();
        return switch (type) {
            case "Document" -> new Document(blocks(f, "children"), metadata, location);
            case "Heading" -> new Heading(f.requireInt("level"), inlines(f, "content"), metadata, location);
            case "Paragraph" -> new Paragraph(inlines(f, "content"), metadata, location);
            case "CodeBlock" -> new CodeBlock(f.requireString("content"), f.optString("language"),
                f.optChar("fence_char", CodeBlock.DEFAULT_FENCE_CHAR),
                f.optInt("fence_length", CodeBlock.DEFAULT_FENCE_LENGTH), metadata, location);
            case "BlockQuote" -> new BlockQuote(blocks(f, "children"), metadata, location);
            case NodeTypes.LIST -> new ListBlock(f.requireBoolean("ordered"), children(f, "items", ListItem.class),
                f.optInt("start", 1), f.optBoolean("tight", true), metadata, location);
            case "ListItem" -> new ListItem(blocks(f, "children"), taskStatus(f.optString("task_status")),
                metadata, location);
            case "Table" -> new Table(f.optMap("header") == null ? null : child(f, "header", TableRow.class),
                children(f, "rows", TableRow.class), alignments(f), f.optString("caption"), metadata, location);
            case "TableRow" -> new TableRow(children(f, "cells", TableCell.class), f.optBoolean("is_header", false),
                metadata, location);
            case "TableCell" -> new TableCell(inlines(f, "content"), f.optInt("colspan", 1), f.optInt("rowspan", 1),
                Alignment.fromValue(f.optString("alignment")), metadata, location);
            case "ThematicBreak" -> new ThematicBreak(metadata, location);
            case NodeTypes.HTML_BLOCK -> new HtmlBlock(f.requireString("content"), metadata, location);
            case "Comment" -> new Comment(f.requireString("content"), metadata, location);
            case "FootnoteDefinition" -> new FootnoteDefinition(f.requireString("identifier"), blocks(f, "content"),
                metadata, location);
            case "DefinitionList" -> new DefinitionList(definitionItems(f), metadata, location);
            case "DefinitionTerm" -> new DefinitionTerm(inlines(f, "content"), metadata, location);
            case "DefinitionDescription" -> new DefinitionDescription(blocks(f, "content"), metadata, location);
            case "MathBlock" -> new MathBlock(f.optString("content", ""), notation(f), f.stringMap("representations"),
                metadata, location);
            case "Text" -> new Text(f.requireString("content"), metadata, location);
            case "Emphasis" -> new Emphasis(inlines(f, "content"), metadata, location);
            case "Strong" -> new Strong(inlines(f, "content"), metadata, location);
            case "Code" -> new Code(f.requireString("content"), metadata, location);
            case "Link" -> new Link(f.requireString("url"), inlines(f, "content"), f.optString("title"),
                metadata, location);
            case "Image" -> new Image(f.requireString("url"), f.optString("alt_text", ""), f.optString("title"),
                f.optInteger("width"), f.optInteger("height"), metadata, location);
            case "LineBreak" -> new LineBreak(f.optBoolean("soft", false), metadata, location);
            case "Strikethrough" -> new Strikethrough(inlines(f, "content"), metadata, location);
            case "Underline" -> new Underline(inlines(f, "content"), metadata, location);
            case "Superscript" -> new Superscript(inlines(f, "content"), metadata, location);
            case "Subscript" -> new Subscript(inlines(f, "content"), metadata, location);
            case NodeTypes.HTML_INLINE -> new HtmlInline(f.requireString("content"), metadata, location);
            case "CommentInline" -> new CommentInline(f.requireString("content"), metadata, location);
            case "FootnoteReference" -> new FootnoteReference(f.requireString("identifier"), metadata, location);
            case "MathInline" -> new MathInline(f.optString("content", ""), notation(f), f.stringMap("representations"),
                metadata, location);
            default -> throw new MalformedAstException("Unknown node type '" + type + "' at " + f.path);
        };
    }

    private List<Block> blocks(Fields f, String key) {
        return children(f, key, Block.class);
    }

    private List<Inline> inlines(Fields f, String key) {
        return children(f, key, Inline.class);
    }

    private <T> List<T> children(Fields f, String key, Class<T> kind) {
        List<Map<String, Object>> encoded = f.mapList(key);
        List<T> result = new ArrayList<>(encoded.size());
        for (int i = 0; i < encoded.size(); i++) {
            String childPath = f.path + "." + key + "[" + i + "]";
            result.add(expect(decode(encoded.get(i), childPath), kind, childPath));
        }
        return result;
    }

    private <T> T child(Fields f, String key, Class<T> kind) {
        String childPath = f.path + "." + key;
        return expect(decode(f.optMap(key), childPath), kind, childPath);
    }

    private static <T> T expect(Node node, Class<T> kind, String path) {
        if (!kind.isInstance(node)) {
            throw new MalformedAstException("Expected " + kind.getSimpleName() + " at " + path
                + ", got " + node.nodeType());
        }
        return kind.cast(node);
    }

    private List<DefinitionItem> definitionItems(Fields f) {
        List<Map<String, Object>> encoded = f.mapList("items");
        List<DefinitionItem> items = new ArrayList<>(encoded.size());
        for (int i = 0; i < encoded.size(); i++) {
            Fields item = new Fields(encoded.get(i), f.path + ".items[" + i + "]");
            DefinitionTerm term = expect(decode(item.requireMap("term"), item.path + ".term"),
                DefinitionTerm.class, item.path + ".term");
            items.add(new DefinitionItem(term, children(item, "descriptions", DefinitionDescription.class)));
        }
        return items;
    }

    private static List<Alignment> alignments(Fields f) {
        List<?> raw = f.optList("alignments");
        if (raw == null) {
            return List.of();
        }
        List<Alignment> result = new ArrayList<>(raw.size());
        for (Object value : raw) {
            if (value != null && !(value instanceof String)) {
                throw new MalformedAstException("Alignment must be a string or null at " + f.path + ", got " + value);
            }
            result.add(Alignment.fromValue((String) value));
        }
        return result;
    }

    private static TaskStatus taskStatus(String value) {
        return value == null ? null : TaskStatus.fromValue(value);
    }

    private static MathNotation notation(Fields f) {
        return MathNotation.fromValue(f.optString("notation", MathNotation.LATEX.value()));
    }

    /**
     * Typed access to the fields of one encoded node.
     */
    static final class Fields {

        private final Map<String, Object> data;
        private final String path;

        Fields(Map<String, Object> data, String path) {
            if (data == null) {
                throw new MalformedAstException("Expected an object at " + path + ", got null");
            }
            this.data = data;
            this.path = path;
        }

        String requireString(String key) {
            Object value = require(key);
            if (value instanceof String s) {
                return s;
            }
            throw wrongType(key, "a string", value);
        }

        String optString(String key) {
            return optString(key, null);
        }

        String optString(String key, String fallback) {
            Object value = data.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof String s) {
                return s;
            }
            throw wrongType(key, "a string", value);
        }

        char optChar(String key, char fallback) {
            String value = optString(key);
            if (value == null) {
                return fallback;
            }
            if (value.length() != 1) {
                throw wrongType(key, "a single character", value);
            }
            return value.charAt(0);
        }

        int requireInt(String key) {
            return toInt(key, require(key));
        }

        int optInt(String key, int fallback) {
            Object value = data.get(key);
            return value == null ? fallback : toInt(key, value);
        }

        Integer optInteger(String key) {
            Object value = data.get(key);
            return value == null ? null : toInt(key, value);
        }

        boolean requireBoolean(String key) {
            Object value = require(key);
            if (value instanceof Boolean b) {
                return b;
            }
            throw wrongType(key, "a boolean", value);
        }

        boolean optBoolean(String key, boolean fallback) {
            Object value = data.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof Boolean b) {
                return b;
            }
            throw wrongType(key, "a boolean", value);
        }

        Map<String, Object> requireMap(String key) {
            Map<String, Object> value = optMap(key);
            if (value == null) {
                throw new MalformedAstException("Missing field '" + key + "' at " + path);
            }
            return value;
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> optMap(String key) {
            Object value = data.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            throw wrongType(key, "an object", value);
        }

        List<?> optList(String key) {
            Object value = data.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof List<?> list) {
                return list;
            }
            throw wrongType(key, "an array", value);
        }

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> mapList(String key) {
            List<?> list = optList(key);
            if (list == null) {
                return List.of();
            }
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof Map)) {
                    throw new MalformedAstException("Expected an object at " + path + "." + key + "[" + i + "]");
                }
            }
            return (List<Map<String, Object>>) list;
        }

        Map<String, String> stringMap(String key) {
            Map<String, Object> raw = optMap(key);
            if (raw == null) {
                return Map.of();
            }
            Map<String, String> result = new LinkedHashMap<>();
            raw.forEach((k, v) -> {
                if (!(v instanceof String s)) {
                    throw wrongType(key + "." + k, "a string", v);
                }
                result.put(k, s);
            });
            return result;
        }

        Map<String, Object> metadata() {
            Map<String, Object> metadata = optMap("metadata");
            return metadata == null ? Map.of() : metadata;
        }

        SourceLocation sourceLocation() {
            Map<String, Object> raw = optMap("source_location");
            if (raw == null) {
                return null;
            }
            Fields loc = new Fields(raw, path + ".source_location");
            return new SourceLocation(loc.requireString("format"), loc.optInteger("page"), loc.optInteger("line"),
                loc.optInteger("column"), loc.optString("element_id"), loc.metadata());
        }

        private Object require(String key) {
            Object value = data.get(key);
            if (value == null) {
                throw new MalformedAstException("Missing field '" + key + "' at " + path);
            }
            return value;
        }

        private int toInt(String key, Object value) {
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                long l = ((Number) value).longValue();
                if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                    return (int) l;
                }
            }
            throw wrongType(key, "an integer", value);
        }

        private MalformedAstException wrongType(String key, String expected, Object value) {
            return new MalformedAstException("Field '" + key + "' at " + path + " must be " + expected
                + ", got " + (value == null ? "null" : value.getClass().getSimpleName()));
        }
    }
}
