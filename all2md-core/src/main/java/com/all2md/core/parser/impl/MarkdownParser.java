package com.all2md.core.parser.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.all2md.core.ast.Alignment;
import com.all2md.core.ast.Block;
import com.all2md.core.ast.BlockQuote;
import com.all2md.core.ast.Code;
import com.all2md.core.ast.CodeBlock;
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
import com.all2md.core.ast.Nodes;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.Strikethrough;
import com.all2md.core.ast.Strong;
import com.all2md.core.ast.Table;
import com.all2md.core.ast.TableCell;
import com.all2md.core.ast.TableRow;
import com.all2md.core.ast.TaskStatus;
import com.all2md.core.ast.Text;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.parser.DocumentParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.ImageRef;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.TextBase;
import com.vladsch.flexmark.ext.footnotes.Footnote;
import com.vladsch.flexmark.ext.footnotes.FootnoteBlock;
import com.vladsch.flexmark.ext.footnotes.FootnoteExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListItem;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableBody;
import com.vladsch.flexmark.ext.tables.TableCaption;
import com.vladsch.flexmark.ext.tables.TableHead;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * Parses CommonMark/GFM Markdown with flexmark-java and maps the flexmark tree onto the
 * all2md node model.
 *
 * <h2>Supported Syntax</h2>
 * <ul>
 *   <li>CommonMark blocks and inlines, including reference-style links</li>
 *   <li>GFM tables, strikethrough and task list items</li>
 *   <li>Footnotes ({@code [^id]} references and {@code [^id]: ...} definitions)</li>
 *   <li>YAML front matter, which becomes document metadata</li>
 * </ul>
 *
 * <p>Flexmark nodes without a counterpart in the node model are kept as plain text so no
 * source content is lost.
 */
public class MarkdownParser implements DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(MarkdownParser.class);

    private static final Pattern FRONT_MATTER =
        Pattern.compile("\\A---[ \\t]*\\r?\\n(.*?)\\r?\\n(?:---|\\.\\.\\.)[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Parser parser;

    public MarkdownParser() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                TaskListExtension.create(),
                FootnoteExtension.create()
            ));
        this.parser = Parser.builder(options).build();
    }

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("md", "markdown");
    }

    @Override
    public Document parse(String source) {
        Map<String, Object> metadata = Map.of();
        String body = source;

        Matcher matcher = FRONT_MATTER.matcher(source);
        if (matcher.find()) {
            Map<String, Object> frontMatter = readFrontMatter(matcher.group(1));
            if (frontMatter != null) {
                metadata = frontMatter;
                body = source.substring(matcher.end());
            }
        }

        com.vladsch.flexmark.util.ast.Document root = parser.parse(body);
        Converter converter = new Converter(root);
        List<Block> blocks = converter.blocks(root);
        log.debug("Parsed markdown into {} top-level blocks", blocks.size());
        return new Document(blocks, metadata);
    }

    private Map<String, Object> readFrontMatter(String yaml) {
        if (yaml.isBlank()) {
            return Map.of();
        }
        try {
            return YAML_MAPPER.readValue(yaml, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring front matter that is not a YAML mapping: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Walks one flexmark tree. Reference definitions are resolved against the tree's own
     * reference repository.
     */
    private static final class Converter {

        private final com.vladsch.flexmark.util.ast.Document root;

        Converter(com.vladsch.flexmark.util.ast.Document root) {
            this.root = root;
        }

        List<Block> blocks(com.vladsch.flexmark.util.ast.Node parent) {
            List<Block> blocks = new ArrayList<>();
            com.vladsch.flexmark.util.ast.Node child = parent.getFirstChild();
            while (child != null) {
                Block block = block(child);
                if (block != null) {
                    blocks.add(block);
                }
                child = child.getNext();
            }
            return blocks;
        }

        private Block block(com.vladsch.flexmark.util.ast.Node node) {
            if (node instanceof com.vladsch.flexmark.ast.Heading heading) {
                return new Heading(heading.getLevel(), inlines(heading));
            }
            if (node instanceof com.vladsch.flexmark.ast.Paragraph) {
                return new Paragraph(inlines(node));
            }
            if (node instanceof FencedCodeBlock fenced) {
                return fencedCode(fenced);
            }
            if (node instanceof IndentedCodeBlock indented) {
                return new CodeBlock(stripTrailingNewline(indented.getContentChars().toString()), null);
            }
            if (node instanceof com.vladsch.flexmark.ast.BlockQuote) {
                return new BlockQuote(blocks(node));
            }
            if (node instanceof BulletList list) {
                return new ListBlock(false, items(list), 1, list.isTight(), null, null);
            }
            if (node instanceof OrderedList list) {
                return new ListBlock(true, items(list), list.getStartNumber(), list.isTight(), null, null);
            }
            if (node instanceof com.vladsch.flexmark.ast.ThematicBreak) {
                return new ThematicBreak();
            }
            if (node instanceof com.vladsch.flexmark.ast.HtmlBlock || node instanceof HtmlCommentBlock) {
                return new HtmlBlock(stripTrailingNewline(node.getChars().toString()));
            }
            if (node instanceof TableBlock table) {
                return table(table);
            }
            if (node instanceof FootnoteBlock footnote) {
                return new FootnoteDefinition(footnote.getText().toString(), blocks(footnote));
            }
            if (node instanceof Reference) {
                // resolved at each use site
                return null;
            }
            log.debug("No node mapping for flexmark block {}; keeping its text", node.getNodeName());
            String text = stripTrailingNewline(node.getChars().toString());
            return text.isBlank() ? null : new Paragraph(text);
        }

        private CodeBlock fencedCode(FencedCodeBlock fenced) {
            String info = fenced.getInfo().toString().trim();
            String language = info.isEmpty() ? null : info.split("\\s+", 2)[0];
            String marker = fenced.getOpeningMarker().toString();
            char fenceChar = marker.isEmpty() ? CodeBlock.DEFAULT_FENCE_CHAR : marker.charAt(0);
            int fenceLength = Math.max(marker.length(), 1);
            String content = stripTrailingNewline(fenced.getContentChars().toString());
            return new CodeBlock(content, language, fenceChar, fenceLength, null, null);
        }

        private List<ListItem> items(com.vladsch.flexmark.ast.ListBlock list) {
            List<ListItem> items = new ArrayList<>();
            com.vladsch.flexmark.util.ast.Node child = list.getFirstChild();
            while (child != null) {
                if (child instanceof com.vladsch.flexmark.ast.ListItem item) {
                    TaskStatus status = null;
                    if (item instanceof TaskListItem task) {
                        status = task.isItemDoneMarker() ? TaskStatus.CHECKED : TaskStatus.UNCHECKED;
                    }
                    items.add(new ListItem(blocks(item), status, null, null));
                }
                child = child.getNext();
            }
            return items;
        }

        private Table table(TableBlock block) {
            TableRow header = null;
            List<TableRow> rows = new ArrayList<>();
            List<Alignment> alignments = new ArrayList<>();
            String caption = null;

            com.vladsch.flexmark.util.ast.Node section = block.getFirstChild();
            while (section != null) {
                if (section instanceof TableHead) {
                    List<TableRow> headRows = rows(section, true);
                    if (!headRows.isEmpty()) {
                        header = headRows.get(0);
                        for (TableCell cell : header.cells()) {
                            alignments.add(cell.alignment() == null ? Alignment.NONE : cell.alignment());
                        }
                        rows.addAll(headRows.subList(1, headRows.size()));
                    }
                } else if (section instanceof TableBody) {
                    rows.addAll(rows(section, false));
                } else if (section instanceof TableCaption tableCaption) {
                    caption = Nodes.extractText(inlines(tableCaption), "");
                }
                section = section.getNext();
            }
            return new Table(header, rows, alignments, caption, null, null);
        }

        private List<TableRow> rows(com.vladsch.flexmark.util.ast.Node section, boolean isHeader) {
            List<TableRow> rows = new ArrayList<>();
            com.vladsch.flexmark.util.ast.Node row = section.getFirstChild();
            while (row != null) {
                if (row instanceof com.vladsch.flexmark.ext.tables.TableRow) {
                    List<TableCell> cells = new ArrayList<>();
                    com.vladsch.flexmark.util.ast.Node cell = row.getFirstChild();
                    while (cell != null) {
                        if (cell instanceof com.vladsch.flexmark.ext.tables.TableCell tableCell) {
                            cells.add(new TableCell(inlines(tableCell), Math.max(tableCell.getSpan(), 1), 1,
                                alignment(tableCell.getAlignment()), null, null));
                        }
                        cell = cell.getNext();
                    }
                    rows.add(new TableRow(cells, isHeader));
                }
                row = row.getNext();
            }
            return rows;
        }

        private static Alignment alignment(com.vladsch.flexmark.ext.tables.TableCell.Alignment alignment) {
            if (alignment == null) {
                return null;
            }
            return switch (alignment) {
                case LEFT -> Alignment.LEFT;
                case CENTER -> Alignment.CENTER;
                case RIGHT -> Alignment.RIGHT;
                default -> null;
            };
        }

        List<Inline> inlines(com.vladsch.flexmark.util.ast.Node parent) {
            List<Inline> inlines = new ArrayList<>();
            com.vladsch.flexmark.util.ast.Node child = parent.getFirstChild();
            while (child != null) {
                inline(child, inlines);
                child = child.getNext();
            }
            return mergeText(inlines);
        }

        private void inline(com.vladsch.flexmark.util.ast.Node node, List<Inline> out) {
            if (node instanceof com.vladsch.flexmark.ast.Text || node instanceof HtmlEntity) {
                out.add(new Text(node.getChars().unescape().toString()));
            } else if (node instanceof TextBase) {
                com.vladsch.flexmark.util.ast.Node child = node.getFirstChild();
                while (child != null) {
                    inline(child, out);
                    child = child.getNext();
                }
            } else if (node instanceof com.vladsch.flexmark.ast.Emphasis) {
                out.add(new Emphasis(inlines(node)));
            } else if (node instanceof StrongEmphasis) {
                out.add(new Strong(inlines(node)));
            } else if (node instanceof com.vladsch.flexmark.ast.Code code) {
                out.add(new Code(code.getText().toString()));
            } else if (node instanceof com.vladsch.flexmark.ast.Link link) {
                out.add(new Link(link.getUrl().unescape().toString(), inlines(link), optional(link.getTitle()), null, null));
            } else if (node instanceof com.vladsch.flexmark.ast.Image image) {
                out.add(new Image(image.getUrl().unescape().toString(), image.getText().unescape().toString(),
                    optional(image.getTitle()), null, null, null, null));
            } else if (node instanceof AutoLink autoLink) {
                String url = autoLink.getUrl().toString();
                out.add(new Link(url, List.of(new Text(url))));
            } else if (node instanceof MailLink mailLink) {
                String address = mailLink.getText().toString();
                out.add(new Link("mailto:" + address, List.of(new Text(address))));
            } else if (node instanceof LinkRef linkRef) {
                linkRef(linkRef, out);
            } else if (node instanceof ImageRef imageRef) {
                imageRef(imageRef, out);
            } else if (node instanceof SoftLineBreak) {
                out.add(new LineBreak(true));
            } else if (node instanceof HardLineBreak) {
                out.add(new LineBreak(false));
            } else if (node instanceof com.vladsch.flexmark.ast.HtmlInline || node instanceof HtmlInlineComment) {
                out.add(new HtmlInline(node.getChars().toString()));
            } else if (node instanceof com.vladsch.flexmark.ext.gfm.strikethrough.Strikethrough) {
                out.add(new Strikethrough(inlines(node)));
            } else if (node instanceof Footnote footnote) {
                out.add(new FootnoteReference(footnote.getText().toString()));
            } else {
                log.debug("No node mapping for flexmark inline {}; keeping its text", node.getNodeName());
                out.add(new Text(node.getChars().toString()));
            }
        }

        private void linkRef(LinkRef linkRef, List<Inline> out) {
            Reference reference = linkRef.isDefined() ? linkRef.getReferenceNode(root) : null;
            if (reference == null) {
                out.add(new Text(linkRef.getChars().toString()));
                return;
            }
            List<Inline> content = linkRef.getFirstChild() == null
                ? List.of(new Text(linkRef.getReference().toString()))
                : inlines(linkRef);
            out.add(new Link(reference.getUrl().unescape().toString(), content, optional(reference.getTitle()), null, null));
        }

        private void imageRef(ImageRef imageRef, List<Inline> out) {
            Reference reference = imageRef.isDefined() ? imageRef.getReferenceNode(root) : null;
            if (reference == null) {
                out.add(new Text(imageRef.getChars().toString()));
                return;
            }
            out.add(new Image(reference.getUrl().unescape().toString(), imageRef.getText().unescape().toString(),
                optional(reference.getTitle()), null, null, null, null));
        }
    }

    private static List<Inline> mergeText(List<Inline> inlines) {
        List<Inline> merged = new ArrayList<>(inlines.size());
        for (Inline inline : inlines) {
            int last = merged.size() - 1;
            if (inline instanceof Text text && last >= 0 && merged.get(last) instanceof Text previous) {
                merged.set(last, new Text(previous.content() + text.content()));
            } else {
                merged.add(inline);
            }
        }
        return merged;
    }

    private static String optional(BasedSequence sequence) {
        if (sequence == null || sequence.isEmpty()) {
            return null;
        }
        return sequence.unescape().toString();
    }

    private static String stripTrailingNewline(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
