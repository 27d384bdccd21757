package com.all2md.core.visitor;

import java.util.Objects;

/**
 * A structural problem found by {@link ValidatingVisitor}.
 *
 * @param severity how serious the problem is
 * @param path location of the offending node, e.g. {@code Document/Table[2]/TableRow[0]}
 * @param message human-readable description
 */
public record ValidationFinding(
    Severity severity,
    String path,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationFinding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + path + ": " + message;
    }
}
