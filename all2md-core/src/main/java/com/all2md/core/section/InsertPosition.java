package com.all2md.core.section;

import java.util.Locale;

/**
 * Where {@link Sections#insertIntoSection} places new content.
 */
public enum InsertPosition {
    /** Directly after the heading. */
    START,
    /** After the last block of the section. */
    END,
    /** Same as {@link #START}. */
    AFTER_HEADING;

    public static InsertPosition fromValue(String value) {
        return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
