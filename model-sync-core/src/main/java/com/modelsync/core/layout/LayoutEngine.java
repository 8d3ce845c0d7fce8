package com.modelsync.core.layout;

import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Computes node positions for a diagram.
 *
 * <p>Edges whose endpoints are not among the given nodes are ignored. All algorithms are
 * deterministic: the force-directed layout draws its initial placement from a seeded
 * random source.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LayoutResult result = new LayoutEngine().layout(nodes, edges,
 *     LayoutOptions.defaults().withAlgorithm(LayoutAlgorithm.TREE));
 * }</pre>
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    /** Margin added to the node extents when computing bounds */
    public static final double BOUNDS_MARGIN = 20;

    private static final double MIN_DISTANCE = 0.01;

    /**
     * Lays out the given nodes.
     *
     * @param nodes nodes to position
     * @param edges edges between them
     * @param options layout parameters
     * @return positions, routes and bounds
     */
    public LayoutResult layout(List<DiagramNode> nodes, List<DiagramEdge> edges, LayoutOptions options) {
        if (nodes.isEmpty()) {
            return LayoutResult.empty();
        }

        Map<String, DiagramNode> byId = new LinkedHashMap<>();
        nodes.forEach(node -> byId.put(node.id(), node));
        List<DiagramEdge> internalEdges = edges.stream()
            .filter(edge -> byId.containsKey(edge.sourceId()) && byId.containsKey(edge.targetId()))
            .toList();

        Map<String, Point> positions = switch (options.algorithm()) {
            case GRID -> grid(nodes, options);
            case TREE, LAYERED -> tree(byId, internalEdges, options);
            case FORCE_DIRECTED -> forceDirected(byId, internalEdges, options);
        };

        log.debug("Laid out {} nodes with {} algorithm", nodes.size(), options.algorithm().id());
        return new LayoutResult(positions, routes(byId, internalEdges, positions), bounds(byId, positions));
    }

    // ==================== Grid ====================

    private Map<String, Point> grid(List<DiagramNode> nodes, LayoutOptions options) {
        int columns = (int) Math.ceil(Math.sqrt(nodes.size()));
        double cellWidth = nodes.stream().mapToDouble(node -> node.size().width()).max().orElse(0);
        double cellHeight = nodes.stream().mapToDouble(node -> node.size().height()).max().orElse(0);

        Map<String, Point> positions = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            int column = i % columns;
            int row = i / columns;
            positions.put(nodes.get(i).id(), new Point(
                options.padding() + column * (cellWidth + options.nodeSpacing()),
                options.padding() + row * (cellHeight + options.layerSpacing())));
        }
        return positions;
    }

    // ==================== Tree ====================

    private Map<String, Point> tree(Map<String, DiagramNode> byId, List<DiagramEdge> edges, LayoutOptions options) {
        Map<String, List<String>> successors = new LinkedHashMap<>();
        Set<String> hasIncoming = new HashSet<>();
        Set<String> connected = new HashSet<>();
        byId.keySet().forEach(id -> successors.put(id, new ArrayList<>()));
        for (DiagramEdge edge : edges) {
            if (edge.isSelfLoop()) {
                continue;
            }
            successors.get(edge.sourceId()).add(edge.targetId());
            hasIncoming.add(edge.targetId());
            connected.add(edge.sourceId());
            connected.add(edge.targetId());
        }

        Map<String, List<String>> treeChildren = new HashMap<>();
        Set<String> visited = new HashSet<>();
        List<String> roots = new ArrayList<>();

        for (String id : byId.keySet()) {
            if (connected.contains(id) && !hasIncoming.contains(id)) {
                roots.add(id);
                buildForest(id, successors, treeChildren, visited, new HashSet<>());
            }
        }
        // Nodes only reachable through cycles have no natural root
        for (String id : byId.keySet()) {
            if (connected.contains(id) && !visited.contains(id)) {
                roots.add(id);
                buildForest(id, successors, treeChildren, visited, new HashSet<>());
            }
        }

        Map<String, Double> widths = new HashMap<>();
        Map<String, Point> positions = new LinkedHashMap<>();
        double left = options.padding();
        for (String root : roots) {
            double width = subtreeWidth(root, byId, treeChildren, widths, options);
            place(root, left, options.padding(), byId, treeChildren, widths, positions, options);
            left += width + options.nodeSpacing() * 2;
        }

        double orphanY = options.padding();
        for (String id : positions.keySet()) {
            orphanY = Math.max(orphanY, positions.get(id).y() + byId.get(id).size().height() + options.layerSpacing());
        }
        double orphanX = options.padding();
        for (DiagramNode node : byId.values()) {
            if (!connected.contains(node.id())) {
                positions.put(node.id(), new Point(orphanX, orphanY));
                orphanX += node.size().width() + options.nodeSpacing();
            }
        }
        return positions;
    }

    /**
     * Depth-first forest construction. Edges back to a node on the current path close a
     * cycle and are severed; edges to nodes already placed elsewhere are skipped so every
     * node has one tree parent.
     */
    private void buildForest(String id, Map<String, List<String>> successors, Map<String, List<String>> treeChildren,
                             Set<String> visited, Set<String> onPath) {
        visited.add(id);
        onPath.add(id);
        List<String> children = treeChildren.computeIfAbsent(id, key -> new ArrayList<>());
        for (String successor : successors.get(id)) {
            if (onPath.contains(successor)) {
                log.debug("Severing cyclic edge {} -> {}", id, successor);
            } else if (!visited.contains(successor)) {
                children.add(successor);
                buildForest(successor, successors, treeChildren, visited, onPath);
            }
        }
        onPath.remove(id);
    }

    private double subtreeWidth(String id, Map<String, DiagramNode> byId, Map<String, List<String>> treeChildren,
                                Map<String, Double> widths, LayoutOptions options) {
        Double cached = widths.get(id);
        if (cached != null) {
            return cached;
        }
        List<String> children = treeChildren.getOrDefault(id, List.of());
        double childrenWidth = 0;
        for (int i = 0; i < children.size(); i++) {
            childrenWidth += subtreeWidth(children.get(i), byId, treeChildren, widths, options);
            if (i > 0) {
                childrenWidth += options.nodeSpacing();
            }
        }
        double width = Math.max(byId.get(id).size().width(), childrenWidth);
        widths.put(id, width);
        return width;
    }

    private void place(String id, double left, double y, Map<String, DiagramNode> byId,
                       Map<String, List<String>> treeChildren, Map<String, Double> widths,
                       Map<String, Point> positions, LayoutOptions options) {
        DiagramNode node = byId.get(id);
        double width = widths.get(id);
        positions.put(id, new Point(left + (width - node.size().width()) / 2, y));

        List<String> children = treeChildren.getOrDefault(id, List.of());
        if (children.isEmpty()) {
            return;
        }
        double childrenWidth = (children.size() - 1) * options.nodeSpacing();
        for (String child : children) {
            childrenWidth += widths.get(child);
        }
        double childLeft = left + (width - childrenWidth) / 2;
        double childY = y + node.size().height() + options.layerSpacing();
        for (String child : children) {
            place(child, childLeft, childY, byId, treeChildren, widths, positions, options);
            childLeft += widths.get(child) + options.nodeSpacing();
        }
    }

    // ==================== Force-directed ====================

    private Map<String, Point> forceDirected(Map<String, DiagramNode> byId, List<DiagramEdge> edges, LayoutOptions options) {
        List<String> ids = new ArrayList<>(byId.keySet());
        int n = ids.size();
        double[] x = new double[n];
        double[] y = new double[n];
        Map<String, Integer> index = new HashMap<>();

        Random random = new Random(options.seed());
        double extent = Math.sqrt(n) * (options.nodeSpacing() * 2 + 100);
        for (int i = 0; i < n; i++) {
            index.put(ids.get(i), i);
            x[i] = random.nextDouble() * extent;
            y[i] = random.nextDouble() * extent;
        }

        double k = Math.max(options.nodeSpacing() * 2, 1);
        for (int iteration = 0; iteration < options.iterations(); iteration++) {
            double[] dx = new double[n];
            double[] dy = new double[n];

            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double deltaX = x[i] - x[j];
                    double deltaY = y[i] - y[j];
                    double distance = Math.max(Math.hypot(deltaX, deltaY), MIN_DISTANCE);
                    double force = k * k / distance;
                    dx[i] += deltaX / distance * force;
                    dy[i] += deltaY / distance * force;
                    dx[j] -= deltaX / distance * force;
                    dy[j] -= deltaY / distance * force;
                }
            }

            for (DiagramEdge edge : edges) {
                int source = index.get(edge.sourceId());
                int target = index.get(edge.targetId());
                if (source == target) {
                    continue;
                }
                double deltaX = x[target] - x[source];
                double deltaY = y[target] - y[source];
                double distance = Math.max(Math.hypot(deltaX, deltaY), MIN_DISTANCE);
                double force = distance / k;
                dx[source] += deltaX / distance * force;
                dy[source] += deltaY / distance * force;
                dx[target] -= deltaX / distance * force;
                dy[target] -= deltaY / distance * force;
            }

            double damping = 0.5 * (1.0 - (double) iteration / options.iterations());
            for (int i = 0; i < n; i++) {
                x[i] += dx[i] * damping;
                y[i] += dy[i] * damping;
            }
        }

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        for (int i = 0; i < n; i++) {
            minX = Math.min(minX, x[i]);
            minY = Math.min(minY, y[i]);
        }
        Map<String, Point> positions = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            positions.put(ids.get(i), new Point(x[i] - minX + options.padding(), y[i] - minY + options.padding()));
        }
        return positions;
    }

    // ==================== Routing and bounds ====================

    private Map<String, List<Point>> routes(Map<String, DiagramNode> byId, List<DiagramEdge> edges,
                                            Map<String, Point> positions) {
        Map<String, List<Point>> routes = new LinkedHashMap<>();
        for (DiagramEdge edge : edges) {
            routes.put(edge.id(), List.of(
                center(byId.get(edge.sourceId()), positions),
                center(byId.get(edge.targetId()), positions)));
        }
        return routes;
    }

    private static Point center(DiagramNode node, Map<String, Point> positions) {
        Point position = positions.getOrDefault(node.id(), node.position());
        return new Point(position.x() + node.size().width() / 2, position.y() + node.size().height() / 2);
    }

    private static Dimension bounds(Map<String, DiagramNode> byId, Map<String, Point> positions) {
        double maxX = 0;
        double maxY = 0;
        for (DiagramNode node : byId.values()) {
            Point position = positions.getOrDefault(node.id(), node.position());
            maxX = Math.max(maxX, position.x() + node.size().width());
            maxY = Math.max(maxY, position.y() + node.size().height());
        }
        return new Dimension(maxX + BOUNDS_MARGIN, maxY + BOUNDS_MARGIN);
    }
}
