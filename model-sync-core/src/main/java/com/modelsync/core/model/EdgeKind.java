package com.modelsync.core.model;

/**
 * Origin of a diagram edge.
 */
public enum EdgeKind {
    /** Derived from an AST parent/child relationship */
    CONTAINMENT,
    /** Derived from an AST cross-reference or created on the diagram */
    REFERENCE
}
