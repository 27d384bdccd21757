package com.all2md.core.section;

import java.util.Locale;

/**
 * Where {@link Sections#insertToc} places the table of contents.
 */
public enum TocPosition {
    START,
    AFTER_FIRST_HEADING;

    public static TocPosition fromValue(String value) {
        return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
