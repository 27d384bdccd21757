package com.all2md.core.ast;

import java.util.Locale;

/**
 * Horizontal alignment of a table column or cell.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    /** No explicit alignment; serialized as null. */
    NONE;

    /**
     * @return lowercase wire value, or null for {@link #NONE}
     */
    public String value() {
        return this == NONE ? null : name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value; null maps to {@link #NONE}.
     *
     * @param value "left", "center", "right", "none" or null
     * @return alignment
     * @throws IllegalArgumentException for any other value
     */
    public static Alignment fromValue(String value) {
        if (value == null) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
