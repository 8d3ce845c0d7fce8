package com.modelsync.core.layout;

import java.util.Locale;

/**
 * Layout algorithms, selectable by name.
 */
public enum LayoutAlgorithm {
    /** Row-major packing with ceil(sqrt(n)) columns */
    GRID("grid"),
    /** Forest built from edges, parents centered over their children */
    TREE("tree"),
    /** Same as {@link #TREE} */
    LAYERED("layered"),
    /** Spring embedder with a fixed iteration count */
    FORCE_DIRECTED("force");

    private final String id;

    LayoutAlgorithm(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves an algorithm by name. Accepts the enum name and common aliases.
     *
     * @param name algorithm name, e.g. {@code tree} or {@code force-directed}
     * @return algorithm
     * @throws IllegalArgumentException if the name is unknown
     */
    public static LayoutAlgorithm fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Layout algorithm name must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "grid" -> GRID;
            case "tree", "hierarchical" -> TREE;
            case "layered" -> LAYERED;
            case "force", "force-directed", "spring" -> FORCE_DIRECTED;
            default -> throw new IllegalArgumentException("Unknown layout algorithm: " + name);
        };
    }
}
