package com.modelsync.core.descriptor;

import com.modelsync.core.model.Dimension;

import java.util.Locale;

/**
 * Built-in diagram element types and the heuristics used for AST types that a
 * descriptor maps without naming a diagram type.
 */
public final class ElementTypes {

    public static final String NODE_ENTITY = "node:entity";
    public static final String NODE_PROPERTY = "node:property";
    public static final String NODE_PACKAGE = "node:package";
    public static final String NODE_GENERIC = "node:generic";

    public static final String EDGE_REFERENCE = "edge:reference";
    public static final String EDGE_CONTAINS = "edge:contains";

    public static final Dimension FALLBACK_SIZE = new Dimension(100, 50);

    private ElementTypes() {
    }

    /**
     * Infers a diagram node type from an AST type name.
     *
     * @param astType AST type name
     * @return diagram node type
     */
    public static String inferNodeType(String astType) {
        String lower = astType.toLowerCase(Locale.ROOT);
        if (lower.contains("entity") || lower.contains("class")) {
            return NODE_ENTITY;
        }
        if (lower.contains("property") || lower.contains("attribute") || lower.contains("field")) {
            return NODE_PROPERTY;
        }
        if (lower.contains("package") || lower.contains("module")) {
            return NODE_PACKAGE;
        }
        return NODE_GENERIC;
    }

    /**
     * Default size of a built-in node type.
     */
    public static Dimension defaultSize(String diagramType) {
        return switch (diagramType) {
            case NODE_ENTITY -> new Dimension(150, 80);
            case NODE_PROPERTY -> new Dimension(100, 30);
            case NODE_PACKAGE -> new Dimension(200, 150);
            default -> FALLBACK_SIZE;
        };
    }

    /**
     * Display name for a type tag: {@code node:entity} becomes {@code Entity}.
     */
    public static String displayName(String typeTag) {
        String local = typeTag.contains(":") ? typeTag.substring(typeTag.indexOf(':') + 1) : typeTag;
        if (local.isEmpty()) {
            return typeTag;
        }
        return Character.toUpperCase(local.charAt(0)) + local.substring(1).replace('-', ' ');
    }
}
