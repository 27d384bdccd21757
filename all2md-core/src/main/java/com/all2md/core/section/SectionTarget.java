package com.all2md.core.section;

import java.util.Objects;

/**
 * Selects one section either by index or by heading text.
 *
 * <p>Selectors of the form {@code #N} address the N-th entry of
 * {@link Sections#getAllSections(com.all2md.core.ast.Document)}, counting from 0; negative
 * indexes count from the end. Any other selector is matched case-insensitively against
 * heading text.
 *
 * @param index section index, or null when selecting by heading
 * @param heading heading text, or null when selecting by index
 */
public record SectionTarget(Integer index, String heading) {

    public SectionTarget {
        if ((index == null) == (heading == null)) {
            throw new IllegalArgumentException("Exactly one of index or heading must be set");
        }
    }

    public static SectionTarget index(int index) {
        return new SectionTarget(index, null);
    }

    public static SectionTarget heading(String text) {
        return new SectionTarget(null, Objects.requireNonNull(text, "text must not be null"));
    }

    /**
     * Parses a command line selector.
     *
     * @param selector {@code #N} or heading text
     * @return target
     * @throws IllegalArgumentException if the selector is blank or {@code #} is not followed by an integer
     */
    public static SectionTarget parse(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("Section selector must not be empty");
        }
        String trimmed = selector.strip();
        if (trimmed.startsWith("#")) {
            String number = trimmed.substring(1).strip();
            try {
                return index(Integer.parseInt(number));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid section index '" + number + "' in selector: " + selector, e);
            }
        }
        return heading(trimmed);
    }

    @Override
    public String toString() {
        return index != null ? "#" + index : "'" + heading + "'";
    }
}
