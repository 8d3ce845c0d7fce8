package com.modelsync.core.model;

import java.util.Objects;

/**
 * A connection point on the boundary of a node.
 *
 * @param id element ID of the port, unique within the snapshot
 * @param portId port identifier from the language descriptor, used by connection rules
 * @param nodeId owning node element ID
 * @param label display label, may be null
 * @param side boundary side
 * @param offset fraction along the side, 0..1
 * @param position top-left corner relative to the owning node
 * @param size port size
 * @param style CSS style hint, may be null
 */
public record DiagramPort(
    String id,
    String portId,
    String nodeId,
    String label,
    PortSide side,
    double offset,
    Point position,
    Dimension size,
    String style
) {
    public DiagramPort {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(portId, "portId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(side, "side must not be null");
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(size, "size must not be null");
    }

    public PortDirection direction() {
        return side.direction();
    }
}
