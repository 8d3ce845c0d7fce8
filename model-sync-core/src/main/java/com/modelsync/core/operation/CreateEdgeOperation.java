package com.modelsync.core.operation;

import com.modelsync.core.model.Point;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates an edge between two existing nodes.
 *
 * @param elementType diagram edge type
 * @param sourceId source node element ID
 * @param targetId target node element ID
 * @param sourcePortId source port, descriptor port ID or port element ID, may be null
 * @param targetPortId target port, descriptor port ID or port element ID, may be null
 * @param routingPoints initial routing points
 * @param args extra arguments; {@code label} sets the edge label
 */
public record CreateEdgeOperation(
    String elementType,
    String sourceId,
    String targetId,
    String sourcePortId,
    String targetPortId,
    List<Point> routingPoints,
    Map<String, Object> args
) implements Operation {

    public static final String LABEL_ARG = "label";

    public CreateEdgeOperation {
        Objects.requireNonNull(elementType, "elementType must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        routingPoints = routingPoints != null ? List.copyOf(routingPoints) : List.of();
        args = args != null ? Map.copyOf(args) : Map.of();
    }

    public static CreateEdgeOperation of(String elementType, String sourceId, String targetId) {
        return new CreateEdgeOperation(elementType, sourceId, targetId, null, null, List.of(), Map.of());
    }

    public static CreateEdgeOperation withPorts(String elementType, String sourceId, String sourcePortId,
                                                String targetId, String targetPortId) {
        return new CreateEdgeOperation(elementType, sourceId, targetId, sourcePortId, targetPortId, List.of(), Map.of());
    }

    @Override
    public String kind() {
        return CREATE_EDGE;
    }
}
