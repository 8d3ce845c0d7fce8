package com.modelsync.core.operation;

import com.modelsync.core.model.Point;

import java.util.Map;
import java.util.Objects;

/**
 * Creates a node.
 *
 * @param elementType diagram node type
 * @param location requested position, null for the default location
 * @param containerId element ID of the containing node, null for top level
 * @param args extra arguments; {@code name} sets the requested base name
 */
public record CreateNodeOperation(
    String elementType,
    Point location,
    String containerId,
    Map<String, Object> args
) implements Operation {

    public static final String NAME_ARG = "name";

    public CreateNodeOperation {
        Objects.requireNonNull(elementType, "elementType must not be null");
        args = args != null ? Map.copyOf(args) : Map.of();
    }

    public static CreateNodeOperation of(String elementType, Point location) {
        return new CreateNodeOperation(elementType, location, null, Map.of());
    }

    public static CreateNodeOperation named(String elementType, Point location, String name) {
        return new CreateNodeOperation(elementType, location, null, Map.of(NAME_ARG, name));
    }

    @Override
    public String kind() {
        return CREATE_NODE;
    }
}
