package com.all2md.core.renderer.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import com.all2md.core.ast.NodeVisitor;
import com.all2md.core.ast.Paragraph;
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
import com.all2md.core.ast.UnsupportedNodeKindException;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.footnote.FootnoteCollector;
import com.all2md.core.renderer.DocumentRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Renders a document as CommonMark with GFM tables, strikethrough, task lists and footnotes.
 *
 * <p>Each block is rendered to a string and container blocks (quotes, list items, footnote
 * definitions) prefix the lines of their children. Blocks are separated by a blank line.
 *
 * <h2>Footnotes</h2>
 * <p>Definitions are pre-registered with a {@link FootnoteCollector}, references are emitted
 * as {@code [^id]} using the collector's canonical identifier, and all stored definitions are
 * appended after the body in note-type priority order. A reference without a definition is
 * written as a bare marker and logged at DEBUG.
 *
 * <h2>Spans</h2>
 * <p>Pipe tables cannot express merged cells; a cell with {@code colspan > 1} is followed by
 * empty cells and {@code rowspan} is ignored.
 */
public class MarkdownRenderer implements DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(MarkdownRenderer.class);

    private static final String BLANK_LINE = "\n\n";
    private static final String NEWLINE = "\n";
    private static final String SPECIAL_CHARS = "\\`*_{}[]#";
    private static final int MIN_FENCE_LENGTH = 3;
    private static final String FOOTNOTE_INDENT = "    ";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String render(Document document, All2MdConfig config) {
        All2MdConfig.FootnoteConfig footnotes = config.footnotes();
        FootnoteCollector collector = new FootnoteCollector(footnotes.autoNumberStart(), footnotes.fallbackPrefix())
            .collectDefinitions(document);
        MarkdownVisitor visitor = new MarkdownVisitor(config.markdown(), collector);

        StringBuilder out = new StringBuilder();
        if (config.markdown().frontMatter() && !document.metadata().isEmpty()) {
            out.append(frontMatter(document.metadata())).append(BLANK_LINE);
        }
        out.append(document.accept(visitor));

        String notes = collector.iterDefinitions(footnotes.notePriority())
            .map(visitor::footnoteDefinition)
            .collect(Collectors.joining(NEWLINE));
        if (!notes.isEmpty()) {
            if (out.length() > 0) {
                out.append(BLANK_LINE);
            }
            out.append(notes);
        }

        String result = out.toString().stripTrailing();
        return result.isEmpty() ? result : result + NEWLINE;
    }

    private static String frontMatter(Map<String, Object> metadata) {
        try {
            return "---\n" + YAML_MAPPER.writeValueAsString(metadata) + "---";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Document metadata cannot be written as YAML", e);
        }
    }

    /**
     * Stateful visitor for one render call. Blocks return their text without a trailing
     * newline; inlines return their inline Markdown.
     */
    private static final class MarkdownVisitor implements NodeVisitor<String> {

        private final All2MdConfig.MarkdownConfig options;
        private final FootnoteCollector collector;
        private int listDepth;

        MarkdownVisitor(All2MdConfig.MarkdownConfig options, FootnoteCollector collector) {
            this.options = options;
            this.collector = collector;
        }

        @Override
        public String visitDefault(Node node) {
            throw new UnsupportedNodeKindException(node.nodeType(), "No Markdown rendering for " + node.nodeType());
        }

        @Override
        public String visitDocument(Document node) {
            return blocks(node.children(), BLANK_LINE);
        }

        @Override
        public String visitHeading(Heading node) {
            return "#".repeat(node.level()) + " " + inlines(node.content()).replace(NEWLINE, " ");
        }

        @Override
        public String visitParagraph(Paragraph node) {
            return inlines(node.content());
        }

        @Override
        public String visitCodeBlock(CodeBlock node) {
            char fenceChar = node.fenceChar() == '~' ? '~' : '`';
            int length = Math.max(Math.max(node.fenceLength(), MIN_FENCE_LENGTH), longestRun(node.content(), fenceChar) + 1);
            String fence = String.valueOf(fenceChar).repeat(length);
            String language = node.language() == null ? "" : node.language();
            String content = node.content().endsWith(NEWLINE) ? node.content() : node.content() + NEWLINE;
            return fence + language + NEWLINE + content + fence;
        }

        @Override
        public String visitBlockQuote(BlockQuote node) {
            return prefixLines(blocks(node.children(), BLANK_LINE), "> ", "> ");
        }

        @Override
        public String visitListBlock(ListBlock node) {
            listDepth++;
            try {
                List<String> items = new ArrayList<>();
                String bullets = options.bulletSymbols();
                for (int i = 0; i < node.items().size(); i++) {
                    String marker = node.ordered()
                        ? (node.start() + i) + ". "
                        : bullets.charAt((listDepth - 1) % bullets.length()) + " ";
                    items.add(listItem(node.items().get(i), marker, node.tight()));
                }
                return String.join(node.tight() ? NEWLINE : BLANK_LINE, items);
            } finally {
                listDepth--;
            }
        }

        @Override
        public String visitListItem(ListItem node) {
            return listItem(node, "- ", true);
        }

        private String listItem(ListItem item, String marker, boolean tight) {
            String checkbox = "";
            if (item.taskStatus() != null) {
                checkbox = item.taskStatus() == TaskStatus.CHECKED ? "[x] " : "[ ] ";
            }
            String body = blocks(item.children(), tight ? NEWLINE : BLANK_LINE);
            if (body.isEmpty()) {
                return (marker + checkbox).stripTrailing();
            }
            return prefixLines(checkbox + body, marker, " ".repeat(marker.length()));
        }

        @Override
        public String visitTable(Table node) {
            int columns = Math.max(node.columnCount(),
                node.rows().stream().mapToInt(MarkdownVisitor::width).max().orElse(0));
            if (columns == 0) {
                return node.caption() == null ? "" : node.caption();
            }
            List<String> lines = new ArrayList<>();
            lines.add(row(node.header(), columns));
            lines.add(separator(node.alignments(), columns));
            for (TableRow row : node.rows()) {
                lines.add(row(row, columns));
            }
            if (node.caption() != null && !node.caption().isBlank()) {
                lines.add("[" + node.caption() + "]");
            }
            return String.join(NEWLINE, lines);
        }

        @Override
        public String visitTableRow(TableRow node) {
            return row(node, width(node));
        }

        @Override
        public String visitTableCell(TableCell node) {
            return inlines(node.content()).replace(NEWLINE, " ").replace("|", "\\|");
        }

        private String row(TableRow row, int columns) {
            List<String> cells = new ArrayList<>();
            if (row != null) {
                for (TableCell cell : row.cells()) {
                    cells.add(visitTableCell(cell));
                    for (int extra = 1; extra < cell.colspan(); extra++) {
                        cells.add("");
                    }
                }
            }
            while (cells.size() < columns) {
                cells.add("");
            }
            return "| " + String.join(" | ", cells) + " |";
        }

        private static int width(TableRow row) {
            return row.cells().stream().mapToInt(TableCell::colspan).sum();
        }

        private static String separator(List<Alignment> alignments, int columns) {
            List<String> cells = new ArrayList<>(columns);
            for (int i = 0; i < columns; i++) {
                Alignment alignment = i < alignments.size() ? alignments.get(i) : null;
                if (alignment == Alignment.LEFT) {
                    cells.add(":---");
                } else if (alignment == Alignment.CENTER) {
                    cells.add(":---:");
                } else if (alignment == Alignment.RIGHT) {
                    cells.add("---:");
                } else {
                    cells.add("---");
                }
            }
            return "| " + String.join(" | ", cells) + " |";
        }

        @Override
        public String visitThematicBreak(ThematicBreak node) {
            return "---";
        }

        @Override
        public String visitHtmlBlock(HtmlBlock node) {
            return node.content();
        }

        @Override
        public String visitComment(Comment node) {
            return "<!-- " + node.content() + " -->";
        }

        @Override
        public String visitFootnoteDefinition(FootnoteDefinition node) {
            // emitted after the body from the collector
            return "";
        }

        String footnoteDefinition(FootnoteDefinition node) {
            String body = blocks(node.content(), BLANK_LINE);
            return prefixLines(body, "[^" + node.identifier() + "]: ", FOOTNOTE_INDENT);
        }

        @Override
        public String visitDefinitionList(DefinitionList node) {
            List<String> items = new ArrayList<>();
            for (DefinitionItem item : node.items()) {
                StringBuilder text = new StringBuilder(visitDefinitionTerm(item.term()));
                for (DefinitionDescription description : item.descriptions()) {
                    text.append(NEWLINE).append(visitDefinitionDescription(description));
                }
                items.add(text.toString());
            }
            return String.join(BLANK_LINE, items);
        }

        @Override
        public String visitDefinitionTerm(DefinitionTerm node) {
            return inlines(node.content());
        }

        @Override
        public String visitDefinitionDescription(DefinitionDescription node) {
            return prefixLines(blocks(node.content(), BLANK_LINE), ": ", "  ");
        }

        @Override
        public String visitMathBlock(MathBlock node) {
            if (node.notation() == MathNotation.LATEX) {
                return "$$\n" + node.content().strip() + "\n$$";
            }
            String latex = node.representations().get(MathNotation.LATEX.value());
            return latex != null ? "$$\n" + latex.strip() + "\n$$" : node.content();
        }

        @Override
        public String visitText(Text node) {
            return options.escapeSpecial() ? escape(node.content()) : node.content();
        }

        @Override
        public String visitEmphasis(Emphasis node) {
            return "*" + inlines(node.content()) + "*";
        }

        @Override
        public String visitStrong(Strong node) {
            return "**" + inlines(node.content()) + "**";
        }

        @Override
        public String visitStrikethrough(Strikethrough node) {
            return "~~" + inlines(node.content()) + "~~";
        }

        @Override
        public String visitUnderline(Underline node) {
            return "<u>" + inlines(node.content()) + "</u>";
        }

        @Override
        public String visitSuperscript(Superscript node) {
            return "<sup>" + inlines(node.content()) + "</sup>";
        }

        @Override
        public String visitSubscript(Subscript node) {
            return "<sub>" + inlines(node.content()) + "</sub>";
        }

        @Override
        public String visitCode(Code node) {
            String ticks = "`".repeat(longestRun(node.content(), '`') + 1);
            String content = node.content();
            if (content.startsWith("`") || content.endsWith("`")) {
                content = " " + content + " ";
            }
            return ticks + content + ticks;
        }

        @Override
        public String visitLink(Link node) {
            return "[" + inlines(node.content()) + "](" + destination(node.url()) + title(node.title()) + ")";
        }

        @Override
        public String visitImage(Image node) {
            String alt = options.escapeSpecial() ? escape(node.altText()) : node.altText();
            return "![" + alt + "](" + destination(node.url()) + title(node.title()) + ")";
        }

        @Override
        public String visitLineBreak(LineBreak node) {
            return node.soft() ? NEWLINE : "\\" + NEWLINE;
        }

        @Override
        public String visitHtmlInline(HtmlInline node) {
            return node.content();
        }

        @Override
        public String visitCommentInline(CommentInline node) {
            return "<!-- " + node.content() + " -->";
        }

        @Override
        public String visitMathInline(MathInline node) {
            if (node.notation() == MathNotation.LATEX) {
                return "$" + node.content() + "$";
            }
            String latex = node.representations().get(MathNotation.LATEX.value());
            return latex != null ? "$" + latex + "$" : node.content();
        }

        @Override
        public String visitFootnoteReference(FootnoteReference node) {
            String noteType = node.noteType();
            String canonical = collector.registerReference(node.identifier(), noteType);
            if (!collector.hasDefinition(canonical, noteType)) {
                log.debug("Footnote reference '{}' ({}) has no definition; rendering bare marker", canonical, noteType);
            }
            return "[^" + canonical + "]";
        }

        private String blocks(List<? extends Block> blocks, String separator) {
            List<String> rendered = new ArrayList<>(blocks.size());
            for (Block block : blocks) {
                String text = block.accept(this);
                if (!text.isEmpty()) {
                    rendered.add(text);
                }
            }
            return String.join(separator, rendered);
        }

        private String inlines(List<? extends Inline> inlines) {
            StringBuilder text = new StringBuilder();
            for (Inline inline : inlines) {
                text.append(inline.accept(this));
            }
            return text.toString();
        }
    }

    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL_CHARS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Prefixes the first line with {@code first} and every other non-empty line with
     * {@code rest}. Blank lines stay blank, except inside block quotes where {@code rest}
     * carries the quote marker.
     */
    static String prefixLines(String text, String first, String rest) {
        String[] lines = text.split(NEWLINE, -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append(NEWLINE);
            }
            String prefix = i == 0 ? first : rest;
            if (lines[i].isEmpty()) {
                out.append(prefix.stripTrailing().startsWith(">") ? prefix.stripTrailing() : "");
            } else {
                out.append(prefix).append(lines[i]);
            }
        }
        return out.toString();
    }

    private static int longestRun(String text, char c) {
        int longest = 0;
        int current = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }

    private static String destination(String url) {
        if (url.isEmpty() || url.chars().anyMatch(ch -> ch == ' ' || ch == '(' || ch == ')')) {
            return "<" + url.replace("<", "%3C").replace(">", "%3E") + ">";
        }
        return url;
    }

    private static String title(String title) {
        if (title == null || title.isEmpty()) {
            return "";
        }
        return " \"" + title.replace("\"", "\\\"") + "\"";
    }
}
