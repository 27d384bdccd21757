package com.all2md.core.ast;

import java.util.Locale;

/**
 * Checkbox state of a task list item.
 */
public enum TaskStatus {
    CHECKED,
    UNCHECKED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
