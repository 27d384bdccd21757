package com.all2md.core.ast;

/**
 * Marker for block-level nodes: the only kind allowed directly under a {@link Document}.
 */
public interface Block extends Node {
}
