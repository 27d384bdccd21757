package com.all2md.core.section;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Inline;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.Nodes;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.Text;
import com.all2md.core.ast.ThematicBreak;
import com.all2md.core.util.Slugs;
import com.all2md.core.visitor.NodeCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Section queries and edits over a document's top-level children.
 *
 * <p>A section is a heading plus every following sibling up to the next heading of the same or
 * higher rank, so sections nest: in {@code H1 A, P, H2 B, P, H1 C} section A spans B.
 * Content before the first heading forms the preamble.
 *
 * <p>Every edit returns a new document that keeps the original's metadata; the input is never
 * modified.
 */
public final class Sections {

    public static final String DEFAULT_TOC_TITLE = "Table of Contents";

    /** Prefix of a multi-section spec that lists 1-based section ranges, e.g. {@code #:1-3,5}. */
    public static final String RANGE_PREFIX = "#:";

    private static final Logger log = LoggerFactory.getLogger(Sections.class);

    private Sections() {
    }

    /**
     * Returns the preamble (if non-empty) followed by one section per heading, in document order.
     *
     * @param document document to read
     * @return sections, possibly overlapping
     */
    public static List<Section> getAllSections(Document document) {
        List<Block> children = document.children();
        List<Section> sections = new ArrayList<>();
        int first = firstHeadingIndex(children);
        if (first > 0) {
            sections.add(new Section(null, children.subList(0, first), 0, 0, first));
        }
        for (int i = Math.max(first, 0); i < children.size(); i++) {
            if (children.get(i) instanceof Heading) {
                sections.add(sectionAt(children, i));
            }
        }
        return sections;
    }

    /**
     * Returns one section per heading whose level lies in {@code [minLevel, maxLevel]}. The
     * preamble is not included.
     *
     * @param document document to read
     * @param minLevel highest rank to include
     * @param maxLevel lowest rank to include
     * @return sections in document order
     */
    public static List<Section> getAllSections(Document document, int minLevel, int maxLevel) {
        if (minLevel < Heading.MIN_LEVEL || maxLevel > Heading.MAX_LEVEL || minLevel > maxLevel) {
            throw new IllegalArgumentException("Invalid level range: min=" + minLevel + ", max=" + maxLevel
                + "; levels must satisfy 1 <= min <= max <= 6");
        }
        List<Block> children = document.children();
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof Heading heading && heading.level() >= minLevel && heading.level() <= maxLevel) {
                sections.add(sectionAt(children, i));
            }
        }
        return sections;
    }

    /**
     * Returns the sections not nested inside an earlier section: the first heading's section,
     * then the section starting where that one ends, and so on. The preamble is not included.
     *
     * @param document document to read
     * @return non-overlapping sections covering everything after the preamble
     */
    public static List<Section> getTopLevelSections(Document document) {
        List<Block> children = document.children();
        List<Section> sections = new ArrayList<>();
        int index = firstHeadingIndex(children);
        if (index < 0) {
            return sections;
        }
        while (index < children.size()) {
            Section section = sectionAt(children, index);
            sections.add(section);
            index = section.endIndex();
        }
        return sections;
    }

    public static List<Block> getPreamble(Document document) {
        int first = firstHeadingIndex(document.children());
        return first < 0 ? document.children() : document.children().subList(0, first);
    }

    public static Optional<Section> findSectionByHeading(Document document, String text) {
        return findSectionByHeading(document, text, true);
    }

    /**
     * Finds the first section whose flattened heading text equals {@code text}, ignoring
     * surrounding whitespace.
     *
     * @param document document to search
     * @param text heading text
     * @param caseInsensitive whether to ignore case
     * @return matching section
     */
    public static Optional<Section> findSectionByHeading(Document document, String text, boolean caseInsensitive) {
        String wanted = normalize(text, caseInsensitive);
        return getAllSections(document).stream()
            .filter(section -> !section.isPreamble())
            .filter(section -> normalize(section.headingText(), caseInsensitive).equals(wanted))
            .findFirst();
    }

    public static List<Section> findSections(Document document, Predicate<? super Section> predicate) {
        return getAllSections(document).stream().filter(predicate).toList();
    }

    /**
     * Finds every section whose heading text matches {@code pattern}, in document order.
     *
     * <p>{@code *} matches any run of characters and {@code ?} a single character. Without
     * wildcards the whole heading text must match. Surrounding whitespace is ignored on both
     * sides.
     *
     * @param document document to search
     * @param pattern heading text or wildcard pattern
     * @param caseSensitive whether case must match
     * @return matching sections, never the preamble
     */
    public static List<Section> querySections(Document document, String pattern, boolean caseSensitive) {
        Pattern regex = wildcardPattern(pattern, caseSensitive);
        return getAllSections(document).stream()
            .filter(section -> !section.isPreamble())
            .filter(section -> regex.matcher(section.headingText().strip()).matches())
            .toList();
    }

    /**
     * Whether {@code spec} can select more than one section, see
     * {@link #extractSections(Document, String, boolean, Block)}.
     */
    public static boolean isMultiSectionSpec(String spec) {
        if (spec == null) {
            return false;
        }
        String trimmed = spec.strip();
        return trimmed.startsWith(RANGE_PREFIX) || trimmed.indexOf('*') >= 0 || trimmed.indexOf('?') >= 0;
    }

    public static Document extractSections(Document document, String spec) {
        return extractSections(document, spec, false, new ThematicBreak());
    }

    /**
     * Extracts several sections into one document that keeps the original's metadata.
     *
     * <p>{@code spec} is either {@value #RANGE_PREFIX} followed by 1-based ranges as accepted by
     * {@link #parseSectionRanges(String, int)}, numbering headed sections in document order, or a
     * heading pattern as accepted by {@link #querySections(Document, String, boolean)}. Selected
     * sections are copied heading first, in document order, with {@code separator} between them.
     * A section nested inside one already copied is not repeated.
     *
     * @param document document to read
     * @param spec range list or heading pattern
     * @param caseSensitive whether heading patterns must match case
     * @param separator block placed between sections, or null for none
     * @return the combined document
     * @throws IllegalArgumentException if the document has no headings, the ranges select nothing
     *                                  or cannot be parsed
     * @throws SectionNotFoundException if no heading matches the pattern
     */
    public static Document extractSections(Document document, String spec, boolean caseSensitive, Block separator) {
        List<Section> headed = getAllSections(document).stream().filter(section -> !section.isPreamble()).toList();
        if (headed.isEmpty()) {
            throw new IllegalArgumentException("Document contains no sections (headings)");
        }
        String trimmed = spec == null ? "" : spec.strip();
        List<Section> selected;
        if (trimmed.startsWith(RANGE_PREFIX)) {
            String ranges = trimmed.substring(RANGE_PREFIX.length());
            selected = parseSectionRanges(ranges, headed.size()).stream().map(headed::get).toList();
            if (selected.isEmpty()) {
                throw new IllegalArgumentException("No sections in range '" + ranges + "' (document has "
                    + headed.size() + " section(s))");
            }
        } else {
            selected = querySections(document, trimmed, caseSensitive);
            if (selected.isEmpty()) {
                throw new SectionNotFoundException(SectionTarget.heading(trimmed), headed.size());
            }
        }

        List<Block> children = new ArrayList<>();
        int copiedUntil = 0;
        int copied = 0;
        for (Section section : selected) {
            if (section.startIndex() < copiedUntil) {
                continue;
            }
            if (copied > 0 && separator != null) {
                children.add(separator);
            }
            children.addAll(section.nodes());
            copiedUntil = section.endIndex();
            copied++;
        }
        log.debug("Extracted {} section(s) matching '{}'", copied, trimmed);
        return new Document(children, document.metadata());
    }

    /**
     * Returns the section at {@code index} in {@link #getAllSections(Document)}; negative
     * indexes count from the end.
     *
     * @param document document to read
     * @param index section index
     * @return the section, or empty when out of range
     */
    public static Optional<Section> getSectionByIndex(Document document, int index) {
        List<Section> sections = getAllSections(document);
        int resolved = index < 0 ? sections.size() + index : index;
        if (resolved < 0 || resolved >= sections.size()) {
            return Optional.empty();
        }
        return Optional.of(sections.get(resolved));
    }

    /**
     * Resolves a target to a section.
     *
     * @param document document to search
     * @param target section selector
     * @return the section
     * @throws SectionNotFoundException if nothing matches
     */
    public static Section resolve(Document document, SectionTarget target) {
        Optional<Section> section = target.index() != null
            ? getSectionByIndex(document, target.index())
            : findSectionByHeading(document, target.heading());
        return section.orElseThrow(() -> new SectionNotFoundException(target, getAllSections(document).size()));
    }

    /**
     * Finds a heading among the document's children.
     *
     * @param document document to search
     * @param text heading text, compared case-insensitively
     * @param level required level, or null for any
     * @return index and heading of the first match
     */
    public static Optional<HeadingMatch> findHeading(Document document, String text, Integer level) {
        String wanted = normalize(text, true);
        List<Block> children = document.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof Heading heading
                && (level == null || heading.level() == level)
                && normalize(Nodes.extractText(heading), true).equals(wanted)) {
                return Optional.of(new HeadingMatch(i, heading));
            }
        }
        return Optional.empty();
    }

    /**
     * Counts top-level sections, see {@link #getTopLevelSections(Document)}.
     *
     * @param document document to read
     * @return number of top-level sections
     */
    public static int countSections(Document document) {
        return getTopLevelSections(document).size();
    }

    /**
     * Counts the sections whose heading has exactly {@code level}.
     *
     * @param document document to read
     * @param level heading level
     * @return number of sections at that level
     */
    public static int countSections(Document document, int level) {
        return getAllSections(document, level, level).size();
    }

    /**
     * Parses a 1-based section range list such as {@code "1-3,5,8-"} into sorted 0-based
     * indexes. Reversed ranges are swapped and out-of-range numbers are dropped.
     *
     * @param spec comma-separated numbers and ranges
     * @param total number of sections available
     * @return sorted distinct indexes
     * @throws IllegalArgumentException if a number cannot be parsed
     */
    public static List<Integer> parseSectionRanges(String spec, int total) {
        Set<Integer> indexes = new TreeSet<>();
        for (String rawPart : spec.split(",")) {
            String part = rawPart.strip();
            if (part.isEmpty()) {
                continue;
            }
            int dash = part.indexOf('-');
            int start;
            int end;
            if (dash >= 0) {
                String from = part.substring(0, dash).strip();
                String to = part.substring(dash + 1).strip();
                start = from.isEmpty() ? 0 : Integer.parseInt(from) - 1;
                end = to.isEmpty() ? total - 1 : Integer.parseInt(to) - 1;
                if (start > end) {
                    int swap = start;
                    start = end;
                    end = swap;
                }
            } else {
                start = Integer.parseInt(part) - 1;
                end = start;
            }
            for (int i = Math.max(start, 0); i <= end && i < total; i++) {
                indexes.add(i);
            }
        }
        return List.copyOf(indexes);
    }

    /**
     * Inserts blocks immediately before the target section's heading.
     */
    public static Document addSectionBefore(Document document, SectionTarget target, List<? extends Block> blocks) {
        Section section = resolve(document, target);
        return splice(document, section.startIndex(), section.startIndex(), blocks);
    }

    /**
     * Inserts blocks immediately after the target section's last block, i.e. after any nested
     * subsections.
     */
    public static Document addSectionAfter(Document document, SectionTarget target, List<? extends Block> blocks) {
        Section section = resolve(document, target);
        return splice(document, section.endIndex(), section.endIndex(), blocks);
    }

    /**
     * Removes the target section's heading and its whole span.
     */
    public static Document removeSection(Document document, SectionTarget target) {
        Section section = resolve(document, target);
        return splice(document, section.startIndex(), section.endIndex(), List.of());
    }

    /**
     * Replaces the target section's whole span, heading included, with {@code blocks}. To keep
     * the heading, start {@code blocks} with it.
     */
    public static Document replaceSection(Document document, SectionTarget target, List<? extends Block> blocks) {
        Section section = resolve(document, target);
        return splice(document, section.startIndex(), section.endIndex(), blocks);
    }

    /**
     * Inserts blocks inside the target section.
     *
     * @param document document to edit
     * @param target section selector
     * @param blocks blocks to insert
     * @param position {@code START}/{@code AFTER_HEADING} for directly after the heading,
     *                 {@code END} for after the section's last block
     * @return edited document
     */
    public static Document insertIntoSection(Document document, SectionTarget target, List<? extends Block> blocks,
                                             InsertPosition position) {
        Section section = resolve(document, target);
        int at = switch (position) {
            case START, AFTER_HEADING -> section.isPreamble() ? section.startIndex() : section.startIndex() + 1;
            case END -> section.endIndex();
        };
        return splice(document, at, at, blocks);
    }

    /**
     * Returns the target section as a standalone document with the original's metadata.
     */
    public static Document extractSection(Document document, SectionTarget target) {
        return resolve(document, target).toDocument(document.metadata());
    }

    /**
     * Splits a document into the preamble (if non-empty) and one document per top-level section.
     *
     * @param document document to split
     * @return documents in order, each carrying the original's metadata
     */
    public static List<Document> splitBySections(Document document) {
        List<Document> documents = new ArrayList<>();
        List<Block> preamble = getPreamble(document);
        if (!preamble.isEmpty()) {
            documents.add(new Document(preamble, document.metadata()));
        }
        for (Section section : getTopLevelSections(document)) {
            documents.add(section.toDocument(document.metadata()));
        }
        return documents;
    }

    public static ListBlock generateToc(Document document, int maxDepth) {
        return generateToc(document, maxDepth, false);
    }

    /**
     * Builds a bullet list with one link per heading up to {@code maxDepth}.
     *
     * <p>Links target the heading's {@code id} metadata when present, otherwise a slug unique
     * within the document. Unless {@code flat}, items nest by heading level and a level jump
     * such as H1 followed by H3 gets an intermediate item without a link.
     *
     * @param document document to read
     * @param maxDepth deepest heading level to include, 1 to 6
     * @param flat list every heading at one level
     * @return the list, empty when the document has no matching headings
     */
    public static ListBlock generateToc(Document document, int maxDepth, boolean flat) {
        List<Section> sections = getAllSections(document, Heading.MIN_LEVEL, validDepth(maxDepth));
        if (sections.isEmpty()) {
            return new ListBlock(false, List.of());
        }
        Map<Integer, String> anchors = headingAnchors(document);
        if (flat) {
            TocList list = new TocList();
            for (Section section : sections) {
                list.addItem(tocLink(section, anchors));
            }
            return list.build();
        }
        int baseLevel = sections.stream().mapToInt(Section::level).min().orElse(Heading.MIN_LEVEL);

        TocList root = new TocList();
        Deque<TocList> stack = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        stack.push(root);
        levels.push(baseLevel);
        for (Section section : sections) {
            int level = section.level();
            while (levels.peek() > level) {
                stack.pop();
                levels.pop();
            }
            while (levels.peek() < level) {
                TocList current = stack.peek();
                TocItem parent = current.items.isEmpty() ? current.addItem(null) : current.items.get(current.items.size() - 1);
                if (parent.children == null) {
                    parent.children = new TocList();
                }
                stack.push(parent.children);
                levels.push(levels.peek() + 1);
            }
            stack.peek().addItem(tocLink(section, anchors));
        }
        log.debug("Generated table of contents for {} heading(s)", sections.size());
        return root.build();
    }

    public static Document insertToc(Document document, TocPosition position, int maxDepth) {
        return insertToc(document, position, maxDepth, DEFAULT_TOC_TITLE);
    }

    /**
     * Inserts a table of contents, optionally preceded by a title heading.
     *
     * <p>At {@code START} the title is a level 1 heading; after the first heading it is one level
     * below that heading. A document without headings is returned unchanged.
     *
     * @param document document to edit
     * @param position where to insert
     * @param maxDepth deepest heading level to include
     * @param title title heading text, or null for no title
     * @return edited document
     */
    public static Document insertToc(Document document, TocPosition position, int maxDepth, String title) {
        return insertToc(document, position, maxDepth, title, false);
    }

    /**
     * As {@link #insertToc(Document, TocPosition, int, String)}, optionally with a flat list.
     */
    public static Document insertToc(Document document, TocPosition position, int maxDepth, String title,
                                     boolean flat) {
        ListBlock toc = generateToc(document, maxDepth, flat);
        if (toc.items().isEmpty()) {
            return document;
        }
        int at = 0;
        int titleLevel = Heading.MIN_LEVEL;
        if (position == TocPosition.AFTER_FIRST_HEADING) {
            int first = firstHeadingIndex(document.children());
            Heading heading = (Heading) document.children().get(first);
            at = first + 1;
            titleLevel = Math.min(heading.level() + 1, Heading.MAX_LEVEL);
        }
        List<Block> inserted = new ArrayList<>();
        if (title != null && !title.isBlank()) {
            inserted.add(new Heading(titleLevel, title));
        }
        inserted.add(toc);
        return splice(document, at, at, inserted);
    }

    private static Section sectionAt(List<Block> children, int index) {
        Heading heading = (Heading) children.get(index);
        int end = index + 1;
        while (end < children.size() && !(children.get(end) instanceof Heading next && next.level() <= heading.level())) {
            end++;
        }
        return new Section(heading, children.subList(index + 1, end), heading.level(), index, end);
    }

    private static int firstHeadingIndex(List<Block> children) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof Heading) {
                return i;
            }
        }
        return -1;
    }

    private static Document splice(Document document, int from, int to, List<? extends Block> blocks) {
        List<Block> children = new ArrayList<>(document.children().subList(0, from));
        children.addAll(blocks);
        children.addAll(document.children().subList(to, document.children().size()));
        return new Document(children, document.metadata(), document.sourceLocation());
    }

    private static String normalize(String text, boolean caseInsensitive) {
        String stripped = text == null ? "" : text.strip();
        return caseInsensitive ? stripped.toLowerCase(Locale.ROOT) : stripped;
    }

    private static Link tocLink(Section section, Map<Integer, String> anchors) {
        return new Link("#" + anchors.get(section.startIndex()), List.of(new Text(section.headingText())));
    }

    private static Pattern wildcardPattern(String pattern, boolean caseSensitive) {
        String trimmed = pattern == null ? "" : pattern.strip();
        StringBuilder regex = new StringBuilder(trimmed.length() + 8);
        int literalStart = 0;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '*' || c == '?') {
                if (i > literalStart) {
                    regex.append(Pattern.quote(trimmed.substring(literalStart, i)));
                }
                regex.append(c == '*' ? ".*" : ".");
                literalStart = i + 1;
            }
        }
        if (literalStart < trimmed.length()) {
            regex.append(Pattern.quote(trimmed.substring(literalStart)));
        }
        int flags = Pattern.DOTALL | (caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return Pattern.compile(regex.toString(), flags);
    }

    private static int validDepth(int maxDepth) {
        if (maxDepth < Heading.MIN_LEVEL || maxDepth > Heading.MAX_LEVEL) {
            throw new IllegalArgumentException("maxDepth must be between 1 and 6, got " + maxDepth);
        }
        return maxDepth;
    }

    /**
     * Anchor id of every top-level heading, keyed by child index and assigned in document order
     * the same way {@code HeadingIdTransformer} does. Explicit ids are reserved before any slug
     * is generated, and nested headings still consume slugs.
     */
    private static Map<Integer, String> headingAnchors(Document document) {
        Set<String> seen = new HashSet<>();
        for (Heading heading : NodeCollector.collect(document, Heading.class)) {
            if (explicitId(heading) != null) {
                seen.add(explicitId(heading));
            }
        }
        Map<Integer, String> anchors = new HashMap<>();
        List<Block> children = document.children();
        for (int i = 0; i < children.size(); i++) {
            Block child = children.get(i);
            for (Heading heading : NodeCollector.collect(child, Heading.class)) {
                String id = explicitId(heading);
                String anchor = id != null ? id : Slugs.slugify(Nodes.extractText(heading), seen);
                if (heading == child) {
                    anchors.put(i, anchor);
                }
            }
        }
        return anchors;
    }

    private static String explicitId(Heading heading) {
        return heading.metadata().get(Heading.ID_KEY) instanceof String id && !id.isEmpty() ? id : null;
    }

    /** Mutable list used while nesting TOC entries. */
    private static final class TocList {
        private final List<TocItem> items = new ArrayList<>();

        private TocItem addItem(Link link) {
            TocItem item = new TocItem(link);
            items.add(item);
            return item;
        }

        private ListBlock build() {
            List<ListItem> built = new ArrayList<>(items.size());
            for (TocItem item : items) {
                built.add(item.build());
            }
            return new ListBlock(false, built);
        }
    }

    private static final class TocItem {
        private final Link link;
        private TocList children;

        private TocItem(Link link) {
            this.link = link;
        }

        private ListItem build() {
            List<Block> blocks = new ArrayList<>(2);
            if (link != null) {
                blocks.add(new Paragraph(List.<Inline>of(link)));
            }
            if (children != null) {
                blocks.add(children.build());
            }
            return new ListItem(blocks);
        }
    }
}
