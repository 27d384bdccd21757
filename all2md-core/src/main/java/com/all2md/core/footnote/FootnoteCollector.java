package com.all2md.core.footnote;

import com.all2md.core.ast.Block;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.FootnoteDefinition;
import com.all2md.core.visitor.NodeCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Assigns canonical identifiers to footnote references and definitions during one render pass.
 *
 * <p>Identifiers are scoped per note type, so footnotes and endnotes are numbered
 * independently. For each note type:
 * <ul>
 *   <li>a {@code null} raw identifier gets the next auto number; numbers are never reused</li>
 *   <li>the same raw identifier always maps to the same canonical identifier</li>
 *   <li>raw identifiers are reduced to {@code [0-9A-Za-z_-]}; an empty result becomes the
 *       fallback prefix</li>
 *   <li>different raw identifiers that reduce to the same string get {@code -2}, {@code -3}, ...</li>
 * </ul>
 *
 * <p>Instances are stateful and not thread-safe. Create one per render pass.
 */
public class FootnoteCollector {

    public static final String FOOTNOTE = "footnote";
    public static final String ENDNOTE = "endnote";

    private static final Logger log = LoggerFactory.getLogger(FootnoteCollector.class);
    private static final Pattern DISALLOWED = Pattern.compile("[^0-9A-Za-z_-]+");

    private final int autoNumberStart;
    private final String fallbackPrefix;
    private final Map<String, NoteState> states = new LinkedHashMap<>();

    public FootnoteCollector() {
        this(1, "note");
    }

    /**
     * @param autoNumberStart first number handed out for {@code null} raw identifiers
     * @param fallbackPrefix identifier used when sanitizing leaves nothing
     */
    public FootnoteCollector(int autoNumberStart, String fallbackPrefix) {
        Objects.requireNonNull(fallbackPrefix, "fallbackPrefix must not be null");
        if (fallbackPrefix.isEmpty() || DISALLOWED.matcher(fallbackPrefix).find()) {
            throw new IllegalArgumentException("fallbackPrefix must be non-empty and match [0-9A-Za-z_-]+: " + fallbackPrefix);
        }
        this.autoNumberStart = autoNumberStart;
        this.fallbackPrefix = fallbackPrefix;
    }

    public String registerReference(String rawIdentifier) {
        return registerReference(rawIdentifier, FOOTNOTE);
    }

    /**
     * Registers a reference and returns its canonical identifier.
     *
     * @param rawIdentifier identifier as written in the source, or null for auto numbering
     * @param noteType note type, e.g. {@link #FOOTNOTE}
     * @return canonical identifier
     */
    public String registerReference(String rawIdentifier, String noteType) {
        NoteState state = state(noteType);
        String canonical = state.canonicalize(rawIdentifier);
        state.referenceCounts.merge(canonical, 1, Integer::sum);
        return canonical;
    }

    public String registerDefinition(String rawIdentifier, List<Block> content) {
        return registerDefinition(rawIdentifier, content, FOOTNOTE);
    }

    /**
     * Registers a definition and returns its canonical identifier.
     *
     * <p>Empty content registers the identifier without storing a definition. When an
     * identifier is defined twice the first definition wins.
     *
     * @param rawIdentifier identifier as written in the source, or null for auto numbering
     * @param content body of the note
     * @param noteType note type, e.g. {@link #FOOTNOTE}
     * @return canonical identifier
     */
    public String registerDefinition(String rawIdentifier, List<Block> content, String noteType) {
        NoteState state = state(noteType);
        String canonical = state.canonicalize(rawIdentifier);
        if (content == null || content.isEmpty()) {
            log.debug("Definition '{}' ({}) has no content, not stored", canonical, noteType);
            return canonical;
        }
        if (state.definitions.containsKey(canonical)) {
            log.debug("Duplicate definition '{}' ({}) ignored", canonical, noteType);
            return canonical;
        }
        state.definitions.put(canonical, List.copyOf(content));
        return canonical;
    }

    /**
     * Registers every {@link FootnoteDefinition} found in a document, in document order.
     *
     * @param document document to scan
     * @return this collector
     */
    public FootnoteCollector collectDefinitions(Document document) {
        List<FootnoteDefinition> definitions = NodeCollector.collect(document, FootnoteDefinition.class);
        for (FootnoteDefinition definition : definitions) {
            registerDefinition(definition.identifier(), definition.content(), definition.noteType());
        }
        log.debug("Collected {} footnote definition(s)", definitions.size());
        return this;
    }

    public Stream<FootnoteDefinition> iterDefinitions() {
        return iterDefinitions(List.of(FOOTNOTE, ENDNOTE));
    }

    /**
     * Streams stored definitions, grouped by note type in priority order and then in
     * first-registration order. Note types missing from {@code noteTypePriority} follow in
     * the order they were first seen. Identifiers registered without content are skipped.
     *
     * @param noteTypePriority preferred note type order
     * @return lazily evaluated definitions; call again to restart
     */
    public Stream<FootnoteDefinition> iterDefinitions(List<String> noteTypePriority) {
        Set<String> order = new LinkedHashSet<>(noteTypePriority);
        order.addAll(states.keySet());
        return order.stream()
            .filter(states::containsKey)
            .flatMap(noteType -> states.get(noteType).definitionsOf(noteType));
    }

    public Optional<FootnoteDefinition> definitionFor(String canonicalIdentifier, String noteType) {
        NoteState state = states.get(noteType);
        if (state == null || !state.definitions.containsKey(canonicalIdentifier)) {
            return Optional.empty();
        }
        return Optional.of(toDefinition(canonicalIdentifier, state.definitions.get(canonicalIdentifier), noteType));
    }

    public boolean hasDefinition(String canonicalIdentifier, String noteType) {
        NoteState state = states.get(noteType);
        return state != null && state.definitions.containsKey(canonicalIdentifier);
    }

    public int referenceCount(String canonicalIdentifier, String noteType) {
        NoteState state = states.get(noteType);
        return state == null ? 0 : state.referenceCounts.getOrDefault(canonicalIdentifier, 0);
    }

    private NoteState state(String noteType) {
        String type = noteType == null || noteType.isEmpty() ? FOOTNOTE : noteType;
        return states.computeIfAbsent(type, t -> new NoteState(autoNumberStart));
    }

    private String sanitize(String raw) {
        String cleaned = DISALLOWED.matcher(raw).replaceAll("-");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '-') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '-') {
            end--;
        }
        cleaned = cleaned.substring(start, end);
        return cleaned.isEmpty() ? fallbackPrefix : cleaned;
    }

    private static FootnoteDefinition toDefinition(String identifier, List<Block> content, String noteType) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FootnoteDefinition.NOTE_TYPE, noteType);
        return new FootnoteDefinition(identifier, content, metadata, null);
    }

    /**
     * Identifier state for one note type.
     */
    private final class NoteState {

        private int nextNumber;
        private final Map<String, String> canonicalByRaw = new HashMap<>();
        private final Set<String> allocated = new LinkedHashSet<>();
        private final Map<String, List<Block>> definitions = new HashMap<>();
        private final Map<String, Integer> referenceCounts = new HashMap<>();

        private NoteState(int start) {
            this.nextNumber = start;
        }

        private String canonicalize(String raw) {
            if (raw == null) {
                String candidate = String.valueOf(nextNumber++);
                while (allocated.contains(candidate)) {
                    candidate = String.valueOf(nextNumber++);
                }
                allocated.add(candidate);
                return candidate;
            }
            String known = canonicalByRaw.get(raw);
            if (known != null) {
                return known;
            }
            String base = sanitize(raw);
            String candidate = base;
            int suffix = 2;
            while (allocated.contains(candidate)) {
                candidate = base + "-" + suffix++;
            }
            allocated.add(candidate);
            canonicalByRaw.put(raw, candidate);
            return candidate;
        }

        private Stream<FootnoteDefinition> definitionsOf(String noteType) {
            List<String> ids = new ArrayList<>(allocated);
            return ids.stream()
                .filter(definitions::containsKey)
                .map(id -> toDefinition(id, definitions.get(id), noteType));
        }
    }
}
