package com.modelsync.core.ast;

/**
 * Structural role of an AST field, declared per node type in a language schema.
 *
 * <p>When a grammar schema has no entry for a field the converter falls back to inspecting
 * the runtime value (see {@link #infer(Object)}).
 */
public enum FieldKind {
    /** Plain value: string, number, boolean or a list of them */
    SCALAR,
    /** A single cross-reference to another node */
    REFERENCE,
    /** A list of cross-references */
    REFERENCE_LIST,
    /** A single contained child node */
    CHILD,
    /** A list of contained child nodes */
    CHILD_LIST;

    /**
     * Infers the kind of a field from its value. A list is classified by its first reference
     * or node element; consumers walking a list still check each element's own type.
     *
     * @param value field value, may be null
     * @return inferred kind, {@link #SCALAR} for null or plain values
     */
    public static FieldKind infer(Object value) {
        if (value instanceof ReferenceValue) {
            return REFERENCE;
        }
        if (value instanceof AstNode) {
            return CHILD;
        }
        if (value instanceof java.util.List<?> list) {
            for (Object element : list) {
                if (element instanceof ReferenceValue) {
                    return REFERENCE_LIST;
                }
                if (element instanceof AstNode) {
                    return CHILD_LIST;
                }
            }
        }
        return SCALAR;
    }

    public boolean isReference() {
        return this == REFERENCE || this == REFERENCE_LIST;
    }

    public boolean isContainment() {
        return this == CHILD || this == CHILD_LIST;
    }
}
