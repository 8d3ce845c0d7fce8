package com.modelsync.core.rules;

import com.modelsync.core.descriptor.PortDefinition;
import com.modelsync.core.model.DiagramPort;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;
import com.modelsync.core.model.PortSide;

import java.util.List;

/**
 * Places ports on the boundary of a node.
 *
 * <p>For a node of size (w, h), offset fraction f and port radius r the port's top-left
 * corner relative to the node is:
 * <pre>
 * top     (w*f - r, -r)
 * bottom  (w*f - r, h - r)
 * left    (-r, h*f - r)
 * right   (w - r, h*f - r)
 * </pre>
 * so the port center sits exactly on the boundary.
 */
public class PortGeometry {

    private final double portSize;

    public PortGeometry(double portSize) {
        if (portSize <= 0) {
            throw new IllegalArgumentException("Port size must be positive: " + portSize);
        }
        this.portSize = portSize;
    }

    public double portSize() {
        return portSize;
    }

    public Point position(Dimension nodeSize, PortSide side, double offset) {
        double f = Math.max(0.0, Math.min(1.0, offset));
        double r = portSize / 2;
        double w = nodeSize.width();
        double h = nodeSize.height();
        return switch (side) {
            case TOP -> new Point(w * f - r, -r);
            case BOTTOM -> new Point(w * f - r, h - r);
            case LEFT -> new Point(-r, h * f - r);
            case RIGHT -> new Point(w - r, h * f - r);
        };
    }

    /**
     * Builds the ports of a node from its descriptor definitions.
     *
     * @param nodeId owning node element ID
     * @param nodeSize node size
     * @param definitions declared ports
     * @return ports with positions relative to the node
     */
    public List<DiagramPort> createPorts(String nodeId, Dimension nodeSize, List<PortDefinition> definitions) {
        Dimension size = new Dimension(portSize, portSize);
        return definitions.stream()
            .map(definition -> new DiagramPort(
                portElementId(nodeId, definition.id()),
                definition.id(),
                nodeId,
                definition.label(),
                definition.side(),
                definition.offset(),
                position(nodeSize, definition.side(), definition.offset()),
                size,
                definition.style()))
            .toList();
    }

    /**
     * Recomputes port positions after the owning node was resized.
     */
    public List<DiagramPort> resize(List<DiagramPort> ports, Dimension nodeSize) {
        return ports.stream()
            .map(port -> new DiagramPort(port.id(), port.portId(), port.nodeId(), port.label(), port.side(),
                port.offset(), position(nodeSize, port.side(), port.offset()), port.size(), port.style()))
            .toList();
    }

    public static String portElementId(String nodeId, String portId) {
        return nodeId + "." + portId;
    }
}
