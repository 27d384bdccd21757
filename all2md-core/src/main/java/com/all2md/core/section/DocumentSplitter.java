package com.all2md.core.section;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Nodes;
import com.all2md.core.ast.ThematicBreak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into standalone pieces at section boundaries or thematic breaks.
 *
 * <p>Every piece keeps the original document's metadata. When a strategy finds nothing to split
 * on, the whole document is returned as a single piece.
 */
public final class DocumentSplitter {

    public static final String PREAMBLE_TITLE = "Preamble";

    private static final Logger log = LoggerFactory.getLogger(DocumentSplitter.class);
    private static final Pattern HEADING_SPEC = Pattern.compile("h([1-6])");
    private static final Pattern COUNT_SPEC = Pattern.compile("(words|parts)\\s*[:=]\\s*(\\d+)");

    private DocumentSplitter() {
    }

    /**
     * Splits according to a textual strategy.
     *
     * @param document document to split
     * @param spec {@code h1}..{@code h6}, {@code break}, {@code words:N} or {@code parts:N}
     * @return pieces in order
     * @throws IllegalArgumentException if the strategy is not recognized
     */
    public static List<SplitResult> split(Document document, String spec) {
        String normalized = spec == null ? "" : spec.strip().toLowerCase(Locale.ROOT);
        Matcher heading = HEADING_SPEC.matcher(normalized);
        if (heading.matches()) {
            return splitByHeadingLevel(document, Integer.parseInt(heading.group(1)));
        }
        if (normalized.equals("break")) {
            return splitByBreak(document);
        }
        Matcher count = COUNT_SPEC.matcher(normalized);
        if (count.matches()) {
            int value = Integer.parseInt(count.group(2));
            return count.group(1).equals("words") ? splitByWordCount(document, value) : splitIntoParts(document, value);
        }
        throw new IllegalArgumentException("Invalid split strategy '" + spec + "'. Expected h1-h6, break, words:N or parts:N");
    }

    /**
     * Starts a new piece at every heading of {@code level}; each piece ends at the next heading
     * of the same or higher rank. Content before the first heading becomes a "Preamble" piece.
     * Blocks under a higher-ranked heading that precede the first {@code level} heading belong
     * to no piece.
     *
     * @param document document to split
     * @param level heading level, 1 to 6
     * @return pieces in order
     */
    public static List<SplitResult> splitByHeadingLevel(Document document, int level) {
        if (level < Heading.MIN_LEVEL || level > Heading.MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        List<SplitResult> results = new ArrayList<>();
        List<Block> preamble = Sections.getPreamble(document);
        if (!preamble.isEmpty()) {
            results.add(piece(document, preamble, results.size() + 1, PREAMBLE_TITLE));
        }
        for (Section section : Sections.getAllSections(document, level, level)) {
            results.add(piece(document, section.nodes(), results.size() + 1, section.headingText()));
        }
        return orWhole(document, results, null);
    }

    /**
     * Starts a new piece after every thematic break. Breaks themselves are dropped.
     *
     * @param document document to split
     * @return pieces titled "Part N"
     */
    public static List<SplitResult> splitByBreak(Document document) {
        List<SplitResult> results = new ArrayList<>();
        List<Block> current = new ArrayList<>();
        for (Block block : document.children()) {
            if (block instanceof ThematicBreak) {
                if (!current.isEmpty()) {
                    results.add(piece(document, current, results.size() + 1, "Part " + (results.size() + 1)));
                    current = new ArrayList<>();
                }
            } else {
                current.add(block);
            }
        }
        if (!current.isEmpty()) {
            results.add(piece(document, current, results.size() + 1, "Part " + (results.size() + 1)));
        }
        return orWhole(document, results, "Part 1");
    }

    /**
     * Groups top-level sections into pieces of roughly {@code targetWords} words. A piece is
     * closed before a section that would push it past the target, so sections are never cut.
     *
     * @param document document to split
     * @param targetWords target words per piece, at least 1
     * @return pieces titled after their first section
     */
    public static List<SplitResult> splitByWordCount(Document document, int targetWords) {
        if (targetWords < 1) {
            throw new IllegalArgumentException("targetWords must be at least 1, got " + targetWords);
        }
        List<Section> sections = Sections.getTopLevelSections(document);
        if (sections.isEmpty()) {
            return orWhole(document, List.of(), null);
        }
        List<SplitResult> results = new ArrayList<>();
        List<Block> current = new ArrayList<>(Sections.getPreamble(document));
        int words = Nodes.wordCount(current);
        String title = current.isEmpty() ? null : PREAMBLE_TITLE;
        for (Section section : sections) {
            List<Block> nodes = section.nodes();
            int sectionWords = Nodes.wordCount(nodes);
            if (!current.isEmpty() && words + sectionWords > targetWords) {
                results.add(new SplitResult(new Document(current, document.metadata(), document.sourceLocation()),
                    results.size() + 1, title, words));
                current = new ArrayList<>();
                words = 0;
                title = null;
            }
            current.addAll(nodes);
            words += sectionWords;
            if (title == null) {
                title = section.headingText();
            }
        }
        results.add(new SplitResult(new Document(current, document.metadata(), document.sourceLocation()),
            results.size() + 1, title, words));
        log.debug("Split {} word(s) into {} piece(s) of about {} word(s)", Nodes.wordCount(document.children()),
            results.size(), targetWords);
        return results;
    }

    /**
     * Splits into at most {@code parts} pieces of similar word count, at section boundaries.
     * A piece is closed once it reaches the average share of words.
     *
     * @param document document to split
     * @param parts desired number of pieces, at least 1
     * @return pieces in order; fewer than {@code parts} when sections are too large
     */
    public static List<SplitResult> splitIntoParts(Document document, int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("parts must be at least 1, got " + parts);
        }
        List<Section> sections = Sections.getTopLevelSections(document);
        int totalWords = Nodes.wordCount(document.children());
        if (totalWords == 0 || sections.isEmpty()) {
            return orWhole(document, List.of(), null);
        }
        int share = Math.max(1, (totalWords + parts - 1) / parts);
        List<SplitResult> results = new ArrayList<>();
        List<Block> current = new ArrayList<>(Sections.getPreamble(document));
        int words = Nodes.wordCount(current);
        String title = current.isEmpty() ? null : PREAMBLE_TITLE;
        for (Section section : sections) {
            if (!current.isEmpty() && words >= share && results.size() < parts - 1) {
                results.add(new SplitResult(new Document(current, document.metadata(), document.sourceLocation()),
                    results.size() + 1, title, words));
                current = new ArrayList<>();
                words = 0;
                title = null;
            }
            current.addAll(section.nodes());
            words += Nodes.wordCount(section.nodes());
            if (title == null) {
                title = section.headingText();
            }
        }
        results.add(new SplitResult(new Document(current, document.metadata(), document.sourceLocation()),
            results.size() + 1, title, words));
        log.debug("Split {} word(s) into {} of {} requested part(s)", totalWords, results.size(), parts);
        return results;
    }

    private static SplitResult piece(Document source, List<Block> blocks, int index, String title) {
        Document document = new Document(blocks, source.metadata(), source.sourceLocation());
        return new SplitResult(document, index, title, Nodes.wordCount(blocks));
    }

    private static List<SplitResult> orWhole(Document document, List<SplitResult> results, String title) {
        if (!results.isEmpty()) {
            return results;
        }
        log.debug("Nothing to split on, returning the whole document");
        return List.of(new SplitResult(document, 1, title, Nodes.wordCount(document.children())));
    }
}
