package com.modelsync.core.diagram;

import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;
import com.modelsync.core.model.SourceRange;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Layout state of one open document, keyed by element ID so it survives AST replacement.
 *
 * <p>Lives from document open to document close.
 */
public class DiagramMetadata {

    private final Map<String, Point> positions = new HashMap<>();
    private final Map<String, Dimension> sizes = new HashMap<>();
    private final Map<String, List<Point>> routingPoints = new HashMap<>();
    private final Set<String> collapsed = new HashSet<>();
    private final Map<String, SourceRange> sourceRanges = new HashMap<>();

    public Optional<Point> position(String elementId) {
        return Optional.ofNullable(positions.get(elementId));
    }

    public void setPosition(String elementId, Point position) {
        positions.put(elementId, position);
    }

    public Optional<Dimension> size(String elementId) {
        return Optional.ofNullable(sizes.get(elementId));
    }

    public void setSize(String elementId, Dimension size) {
        sizes.put(elementId, size);
    }

    public List<Point> routingPoints(String elementId) {
        return routingPoints.getOrDefault(elementId, List.of());
    }

    public void setRoutingPoints(String elementId, List<Point> points) {
        if (points == null || points.isEmpty()) {
            routingPoints.remove(elementId);
        } else {
            routingPoints.put(elementId, List.copyOf(points));
        }
    }

    public void clearRoutingPoints(String elementId) {
        routingPoints.remove(elementId);
    }

    public boolean isCollapsed(String elementId) {
        return collapsed.contains(elementId);
    }

    public void setCollapsed(String elementId, boolean isCollapsed) {
        if (isCollapsed) {
            collapsed.add(elementId);
        } else {
            collapsed.remove(elementId);
        }
    }

    public Optional<SourceRange> sourceRange(String elementId) {
        return Optional.ofNullable(sourceRanges.get(elementId));
    }

    public void setSourceRange(String elementId, SourceRange range) {
        sourceRanges.put(elementId, range);
    }

    /**
     * Replaces all source ranges; they are recomputed by every conversion.
     */
    public void replaceSourceRanges(Map<String, SourceRange> ranges) {
        sourceRanges.clear();
        sourceRanges.putAll(ranges);
    }

    public boolean hasPositions() {
        return !positions.isEmpty();
    }

    /**
     * Removes everything stored for an element.
     *
     * @return the removed entries, for {@link #restore(ElementMetadata)}
     */
    public ElementMetadata remove(String elementId) {
        return new ElementMetadata(
            elementId,
            positions.remove(elementId),
            sizes.remove(elementId),
            routingPoints.remove(elementId),
            collapsed.remove(elementId),
            sourceRanges.remove(elementId)
        );
    }

    public void restore(ElementMetadata metadata) {
        String id = metadata.elementId();
        if (metadata.position() != null) {
            positions.put(id, metadata.position());
        }
        if (metadata.size() != null) {
            sizes.put(id, metadata.size());
        }
        if (metadata.routingPoints() != null) {
            routingPoints.put(id, metadata.routingPoints());
        }
        if (metadata.collapsed()) {
            collapsed.add(id);
        }
        if (metadata.sourceRange() != null) {
            sourceRanges.put(id, metadata.sourceRange());
        }
    }

    public void clear() {
        positions.clear();
        sizes.clear();
        routingPoints.clear();
        collapsed.clear();
        sourceRanges.clear();
    }

    /**
     * Everything stored for one element.
     *
     * @param elementId element ID
     * @param position stored position or null
     * @param size stored size or null
     * @param routingPoints stored routing points or null
     * @param collapsed collapsed flag
     * @param sourceRange recorded source range or null
     */
    public record ElementMetadata(
        String elementId,
        Point position,
        Dimension size,
        List<Point> routingPoints,
        boolean collapsed,
        SourceRange sourceRange
    ) {
    }
}
