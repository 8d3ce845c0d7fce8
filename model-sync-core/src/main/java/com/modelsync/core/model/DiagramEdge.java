package com.modelsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An edge of a diagram snapshot.
 *
 * @param id stable element ID
 * @param type diagram edge type, e.g. {@code edge:reference}
 * @param kind containment or reference
 * @param sourceId source node element ID
 * @param targetId target node element ID
 * @param sourcePortId source port, may be null
 * @param targetPortId target port, may be null
 * @param routingPoints intermediate routing points
 * @param label display label, may be null
 * @param property AST field the edge originates from, may be null
 */
public record DiagramEdge(
    String id,
    String type,
    EdgeKind kind,
    String sourceId,
    String targetId,
    String sourcePortId,
    String targetPortId,
    List<Point> routingPoints,
    String label,
    String property
) {
    public DiagramEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        routingPoints = routingPoints != null ? List.copyOf(routingPoints) : List.of();
    }

    public DiagramEdge withEndpoints(String newSourceId, String newSourcePortId, String newTargetId, String newTargetPortId) {
        return new DiagramEdge(id, type, kind, newSourceId, newTargetId, newSourcePortId, newTargetPortId,
            routingPoints, label, property);
    }

    public DiagramEdge withRoutingPoints(List<Point> points) {
        return new DiagramEdge(id, type, kind, sourceId, targetId, sourcePortId, targetPortId, points, label, property);
    }

    public boolean connects(String elementId) {
        return sourceId.equals(elementId) || targetId.equals(elementId);
    }

    public boolean isSelfLoop() {
        return sourceId.equals(targetId);
    }
}
