package com.modelsync.core.operation;

import java.util.Objects;

/**
 * Moves one or both ends of an edge.
 *
 * @param edgeId edge element ID
 * @param newSourceId new source node, null to keep the current one
 * @param newTargetId new target node, null to keep the current one
 * @param newSourcePortId port on the new source, only used with {@code newSourceId}
 * @param newTargetPortId port on the new target, only used with {@code newTargetId}
 */
public record ReconnectEdgeOperation(
    String edgeId,
    String newSourceId,
    String newTargetId,
    String newSourcePortId,
    String newTargetPortId
) implements Operation {

    public ReconnectEdgeOperation {
        Objects.requireNonNull(edgeId, "edgeId must not be null");
    }

    public static ReconnectEdgeOperation newTarget(String edgeId, String targetId) {
        return new ReconnectEdgeOperation(edgeId, null, targetId, null, null);
    }

    public static ReconnectEdgeOperation newSource(String edgeId, String sourceId) {
        return new ReconnectEdgeOperation(edgeId, sourceId, null, null, null);
    }

    @Override
    public String kind() {
        return RECONNECT_EDGE;
    }
}
