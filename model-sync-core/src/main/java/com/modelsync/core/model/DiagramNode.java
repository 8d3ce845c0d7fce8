package com.modelsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A node of a diagram snapshot.
 *
 * <p>Snapshots are flat: nesting is expressed by containment edges from the parent node.
 *
 * @param id stable element ID
 * @param type diagram type, e.g. {@code node:entity}
 * @param label display label
 * @param position top-left position
 * @param size node size
 * @param shape shape hint, may be null
 * @param cssClasses style classes
 * @param ports boundary ports
 */
public record DiagramNode(
    String id,
    String type,
    String label,
    Point position,
    Dimension size,
    String shape,
    List<String> cssClasses,
    List<DiagramPort> ports
) {
    public DiagramNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(size, "size must not be null");
        cssClasses = cssClasses != null ? List.copyOf(cssClasses) : List.of();
        ports = ports != null ? List.copyOf(ports) : List.of();
    }

    public DiagramNode withPosition(Point newPosition) {
        return new DiagramNode(id, type, label, newPosition, size, shape, cssClasses, ports);
    }

    public DiagramNode withSize(Dimension newSize) {
        return new DiagramNode(id, type, label, position, newSize, shape, cssClasses, ports);
    }

    public DiagramNode withLabel(String newLabel) {
        return new DiagramNode(id, type, newLabel, position, size, shape, cssClasses, ports);
    }

    public DiagramNode withPorts(List<DiagramPort> newPorts) {
        return new DiagramNode(id, type, label, position, size, shape, cssClasses, newPorts);
    }

    public Point center() {
        return new Point(position.x() + size.width() / 2, position.y() + size.height() / 2);
    }

    public boolean hasPort(String portId) {
        return ports.stream().anyMatch(port -> port.portId().equals(portId) || port.id().equals(portId));
    }
}
