package com.all2md.core.ast;

/**
 * Marker for inline nodes: text runs and formatting that live inside paragraphs,
 * headings, table cells and other inline containers.
 */
public interface Inline extends Node {
}
