package com.all2md.core.ast;

import java.util.Locale;

/**
 * Notation of the primary content of a math node.
 */
public enum MathNotation {
    LATEX,
    MATHML,
    HTML;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MathNotation fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
