package com.modelsync.core.operation;

import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;

import java.util.List;
import java.util.Objects;

/**
 * Moves and/or resizes nodes.
 *
 * @param changes bounds changes, one per node
 */
public record ChangeBoundsOperation(List<BoundsChange> changes) implements Operation {

    public ChangeBoundsOperation {
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public static ChangeBoundsOperation move(String elementId, Point position) {
        return new ChangeBoundsOperation(List.of(new BoundsChange(elementId, position, null)));
    }

    public static ChangeBoundsOperation resize(String elementId, Dimension size) {
        return new ChangeBoundsOperation(List.of(new BoundsChange(elementId, null, size)));
    }

    @Override
    public String kind() {
        return CHANGE_BOUNDS;
    }

    /**
     * New bounds of one node. Null components are left unchanged.
     *
     * @param elementId node element ID
     * @param newPosition new position or null
     * @param newSize new size or null
     */
    public record BoundsChange(String elementId, Point newPosition, Dimension newSize) {

        public BoundsChange {
            Objects.requireNonNull(elementId, "elementId must not be null");
        }
    }
}
