package com.all2md.core.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heading text to anchor slug conversion.
 *
 * <p>Slugs are ASCII, lowercase and stable for a given input. Passing the same {@code seen}
 * set to every call for one document makes the returned slugs unique within it:
 * {@code Overview}, {@code Overview}, {@code Overview} become {@code overview},
 * {@code overview-2}, {@code overview-3}.
 */
public final class Slugs {

    public static final String DEFAULT_SLUG = "section";
    public static final String DEFAULT_SEPARATOR = "-";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE_OR_UNDERSCORE = Pattern.compile("[\\s_]+");

    private Slugs() {
    }

    public static String slugify(String text) {
        return slugify(text, null, 0, DEFAULT_SEPARATOR);
    }

    public static String slugify(String text, Set<String> seen) {
        return slugify(text, seen, 0, DEFAULT_SEPARATOR);
    }

    /**
     * Converts text to a slug.
     *
     * @param text source text, null is treated as empty
     * @param seen slugs already used in this document, updated with the result; may be null
     * @param maxLength maximum length before de-duplication, or 0 for no limit
     * @param separator word separator, must not be empty
     * @return the slug
     */
    public static String slugify(String text, Set<String> seen, int maxLength, String separator) {
        Objects.requireNonNull(separator, "separator must not be null");
        if (separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        String slug = text == null ? "" : Normalizer.normalize(text, Normalizer.Form.NFKD);
        slug = COMBINING_MARKS.matcher(slug).replaceAll("").toLowerCase(Locale.ROOT);
        slug = WHITESPACE_OR_UNDERSCORE.matcher(slug).replaceAll(separator);
        slug = keepAllowed(slug, separator);
        slug = collapse(slug, separator);
        slug = trim(slug, separator);
        if (slug.isEmpty()) {
            slug = DEFAULT_SLUG;
        }
        if (maxLength > 0 && slug.length() > maxLength) {
            slug = trim(slug.substring(0, maxLength), separator);
            if (slug.isEmpty()) {
                slug = DEFAULT_SLUG;
            }
        }
        if (seen == null) {
            return slug;
        }
        String candidate = slug;
        int suffix = 2;
        while (seen.contains(candidate)) {
            candidate = slug + separator + suffix++;
        }
        seen.add(candidate);
        return candidate;
    }

    private static String keepAllowed(String text, String separator) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || separator.indexOf(c) >= 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String collapse(String text, String separator) {
        String doubled = separator + separator;
        String result = text;
        while (result.contains(doubled)) {
            result = result.replace(doubled, separator);
        }
        return result;
    }

    private static String trim(String text, String separator) {
        String result = text;
        while (result.startsWith(separator)) {
            result = result.substring(separator.length());
        }
        while (result.endsWith(separator)) {
            result = result.substring(0, result.length() - separator.length());
        }
        return result;
    }
}
