package com.modelsync.core.layout;

import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a layout run.
 *
 * @param positions new top-left position per node element ID
 * @param routes straight-line route per edge element ID, from source center to target center
 * @param bounds extent of the laid out nodes plus margin
 */
public record LayoutResult(
    Map<String, Point> positions,
    Map<String, List<Point>> routes,
    Dimension bounds
) {
    public LayoutResult {
        positions = Map.copyOf(Objects.requireNonNull(positions, "positions must not be null"));
        routes = Map.copyOf(Objects.requireNonNull(routes, "routes must not be null"));
        Objects.requireNonNull(bounds, "bounds must not be null");
    }

    public static LayoutResult empty() {
        return new LayoutResult(Map.of(), Map.of(), new Dimension(0, 0));
    }
}
