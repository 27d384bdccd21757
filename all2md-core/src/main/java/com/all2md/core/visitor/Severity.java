package com.all2md.core.visitor;

/**
 * Severity of a {@link ValidationFinding}.
 */
public enum Severity {
    /** The tree violates a structural rule and output is likely wrong. */
    ERROR,
    /** The tree is usable but suspicious. */
    WARNING
}
