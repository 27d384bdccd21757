package com.all2md.core.util;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * URL scheme screening shared by link validation and link rewriting.
 *
 * <p>Relative URLs, fragments and the schemes in {@link #SAFE_SCHEMES} pass. Script-capable
 * schemes, {@code file:} and {@code data:} fail, except {@code data:image/...} when image
 * data is explicitly allowed.
 */
public final class UrlSafety {

    public static final Set<String> SAFE_SCHEMES = Set.of("http", "https", "mailto", "ftp", "ftps", "tel", "sms");

    private static final List<String> DANGEROUS_PREFIXES = List.of("javascript:", "vbscript:", "file:", "about:");
    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.\\-]*$");
    private static final Pattern IGNORED = Pattern.compile("[\\s\\p{Cntrl}]+");

    private UrlSafety() {
    }

    /**
     * Checks a URL.
     *
     * @param url URL to check, may be null or blank
     * @param allowImageData whether {@code data:image/...} URIs are acceptable
     * @return description of the problem, or empty when the URL is acceptable
     */
    public static Optional<String> check(String url, boolean allowImageData) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String normalized = IGNORED.matcher(url).replaceAll("").toLowerCase(Locale.ROOT);
        String shown = url.length() > 50 ? url.substring(0, 50) : url;

        if (normalized.startsWith("data:")) {
            if (allowImageData && normalized.startsWith("data:image/")) {
                return Optional.empty();
            }
            return Optional.of("data URI is not allowed here: " + shown);
        }
        for (String prefix : DANGEROUS_PREFIXES) {
            if (normalized.startsWith(prefix)) {
                return Optional.of("URL uses dangerous scheme '" + prefix.substring(0, prefix.length() - 1) + "': " + shown);
            }
        }
        if (isRelative(normalized)) {
            return Optional.empty();
        }
        int colon = normalized.indexOf(':');
        if (colon > 0) {
            String scheme = normalized.substring(0, colon);
            if (SCHEME.matcher(scheme).matches() && !SAFE_SCHEMES.contains(scheme)) {
                return Optional.of("URL has unrecognized scheme '" + scheme + "': " + shown);
            }
        }
        return Optional.empty();
    }

    /**
     * @param url URL to check
     * @param allowImageData whether {@code data:image/...} URIs are acceptable
     * @return true if {@link #check(String, boolean)} finds no problem
     */
    public static boolean isSafe(String url, boolean allowImageData) {
        return check(url, allowImageData).isEmpty();
    }

    private static boolean isRelative(String url) {
        return url.startsWith("/") || url.startsWith("#") || url.startsWith("?") || url.startsWith(".");
    }
}
