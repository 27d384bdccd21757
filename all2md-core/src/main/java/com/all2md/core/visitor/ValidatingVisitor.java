package com.all2md.core.visitor;

import com.all2md.core.ast.CodeBlock;
import com.all2md.core.ast.FootnoteDefinition;
import com.all2md.core.ast.FootnoteReference;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.HtmlBlock;
import com.all2md.core.ast.HtmlInline;
import com.all2md.core.ast.Image;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.NodeChildren;
import com.all2md.core.ast.NodeVisitor;
import com.all2md.core.ast.Nodes;
import com.all2md.core.ast.Table;
import com.all2md.core.ast.TableCell;
import com.all2md.core.ast.TableRow;
import com.all2md.core.util.UrlSafety;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only visitor that reports structural problems as {@link ValidationFinding}s.
 *
 * <p>Checks cover empty headings, code fences, list numbering, table shape, link and image
 * URLs, raw HTML and footnote integrity. The visitor never throws for a finding; callers
 * decide whether findings are fatal.
 *
 * <pre>{@code
 * List<ValidationFinding> findings = new ValidatingVisitor(false).validate(doc);
 * boolean ok = findings.stream().noneMatch(ValidationFinding::isError);
 * }</pre>
 */
public class ValidatingVisitor implements NodeVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(ValidatingVisitor.class);

    private final boolean allowRawHtml;
    private final List<ValidationFinding> findings = new ArrayList<>();
    private final Deque<String> path = new ArrayDeque<>();
    private final Set<String> definitions = new HashSet<>();
    private final Map<String, String> firstReferencePaths = new LinkedHashMap<>();

    public ValidatingVisitor() {
        this(false);
    }

    /**
     * @param allowRawHtml whether {@code HTMLBlock}/{@code HTMLInline} nodes are acceptable
     */
    public ValidatingVisitor(boolean allowRawHtml) {
        this.allowRawHtml = allowRawHtml;
    }

    /**
     * Validates a tree and returns every finding in document order, followed by
     * dangling footnote references.
     *
     * @param root tree to validate
     * @return findings, empty when the tree is clean
     */
    public List<ValidationFinding> validate(Node root) {
        findings.clear();
        path.clear();
        definitions.clear();
        firstReferencePaths.clear();

        path.addLast(root.nodeType());
        root.accept(this);
        path.removeLast();

        firstReferencePaths.forEach((key, where) -> {
            if (!definitions.contains(key)) {
                warn(where, "Footnote reference '" + key.substring(key.indexOf(':') + 1) + "' has no definition");
            }
        });
        log.debug("Validation finished with {} finding(s)", findings.size());
        return List.copyOf(findings);
    }

    public List<ValidationFinding> getFindings() {
        return List.copyOf(findings);
    }

    @Override
    public Void visitDefault(Node node) {
        List<Node> children = NodeChildren.get(node);
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            path.addLast(child.nodeType() + "[" + i + "]");
            child.accept(this);
            path.removeLast();
        }
        return null;
    }

    @Override
    public Void visitHeading(Heading node) {
        if (Nodes.extractText(node).isBlank()) {
            warn("Heading has no text content");
        }
        return visitDefault(node);
    }

    @Override
    public Void visitCodeBlock(CodeBlock node) {
        if (node.fenceChar() != '`' && node.fenceChar() != '~') {
            error("Code block fence character must be ` or ~, got '" + node.fenceChar() + "'");
        }
        if (node.fenceLength() < 3) {
            warn("Code block fence length should be at least 3, got " + node.fenceLength());
        }
        return null;
    }

    @Override
    public Void visitListBlock(ListBlock node) {
        if (node.items().isEmpty()) {
            warn("List has no items");
        }
        if (node.ordered() && node.start() < 0) {
            error("Ordered list start must not be negative, got " + node.start());
        }
        return visitDefault(node);
    }

    @Override
    public Void visitTable(Table node) {
        if (node.header() == null && node.rows().isEmpty()) {
            warn("Table has no rows");
        }
        int columns = node.columnCount();
        if (!node.alignments().isEmpty() && node.alignments().size() != columns) {
            error("Table has " + node.alignments().size() + " alignment(s) for " + columns + " column(s)");
        }
        for (int i = 0; i < node.rows().size(); i++) {
            int width = width(node.rows().get(i));
            if (width > 0 && width != columns) {
                warn("Row " + i + " spans " + width + " column(s), expected " + columns);
            }
        }
        return visitDefault(node);
    }

    @Override
    public Void visitTableRow(TableRow node) {
        if (node.cells().isEmpty()) {
            error("Table row has no cells");
        }
        return visitDefault(node);
    }

    @Override
    public Void visitLink(Link node) {
        if (node.url().isBlank()) {
            error("Link has an empty URL");
        }
        UrlSafety.check(node.url(), false).ifPresent(problem -> error("Link " + problem));
        return visitDefault(node);
    }

    @Override
    public Void visitImage(Image node) {
        if (node.url().isBlank()) {
            error("Image has an empty URL");
        }
        UrlSafety.check(node.url(), true).ifPresent(problem -> error("Image " + problem));
        if (node.width() != null && node.width() <= 0) {
            error("Image width must be positive, got " + node.width());
        }
        if (node.height() != null && node.height() <= 0) {
            error("Image height must be positive, got " + node.height());
        }
        return null;
    }

    @Override
    public Void visitHtmlBlock(HtmlBlock node) {
        if (!allowRawHtml) {
            error("Raw HTML block is not allowed");
        }
        return null;
    }

    @Override
    public Void visitHtmlInline(HtmlInline node) {
        if (!allowRawHtml) {
            error("Raw inline HTML is not allowed");
        }
        return null;
    }

    @Override
    public Void visitFootnoteDefinition(FootnoteDefinition node) {
        String key = node.noteType() + ":" + node.identifier();
        if (!definitions.add(key)) {
            warn("Duplicate " + node.noteType() + " definition '" + node.identifier() + "'");
        }
        return visitDefault(node);
    }

    @Override
    public Void visitFootnoteReference(FootnoteReference node) {
        firstReferencePaths.putIfAbsent(node.noteType() + ":" + node.identifier(), currentPath());
        return null;
    }

    private static int width(TableRow row) {
        return row.cells().stream().mapToInt(TableCell::colspan).sum();
    }

    private String currentPath() {
        return String.join("/", path);
    }

    private void error(String message) {
        findings.add(new ValidationFinding(Severity.ERROR, currentPath(), message));
    }

    private void warn(String message) {
        warn(currentPath(), message);
    }

    private void warn(String where, String message) {
        findings.add(new ValidationFinding(Severity.WARNING, where, message));
    }
}
