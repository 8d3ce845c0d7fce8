package com.modelsync.core.server.provider;

import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.rules.ConnectionRuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a diagram snapshot for structural problems and lints the language descriptor.
 *
 * <p>Validation never changes the diagram. Findings are reported as {@link DiagramMarker}s.
 */
public class DiagramValidator {

    private static final Logger log = LoggerFactory.getLogger(DiagramValidator.class);

    public static final String NEGATIVE_POSITION = "NEGATIVE_POSITION";
    public static final String INVALID_SIZE = "INVALID_SIZE";
    public static final String MISSING_LABEL = "MISSING_LABEL";
    public static final String MISSING_SOURCE = "MISSING_SOURCE";
    public static final String MISSING_TARGET = "MISSING_TARGET";
    public static final String SELF_LOOP = "SELF_LOOP";
    public static final String DUPLICATE_NAME = "DUPLICATE_NAME";
    public static final String OVERLAPPING_NODES = "OVERLAPPING_NODES";
    public static final String PERMISSIVE_EDGE_TYPE = "PERMISSIVE_EDGE_TYPE";

    /**
     * Validates a snapshot and lints its descriptor.
     *
     * @param snapshot diagram to check
     * @param descriptor language descriptor, may be null to skip the lint
     * @return report of all findings
     */
    public ValidationReport validate(DiagramSnapshot snapshot, LanguageDescriptor descriptor) {
        List<DiagramMarker> markers = new ArrayList<>();
        Map<String, String> parents = containmentParents(snapshot);

        checkNodes(snapshot, markers);
        checkEdges(snapshot, markers);
        checkDuplicateNames(snapshot, parents, markers);
        checkOverlaps(snapshot, parents, markers);
        if (descriptor != null) {
            markers.addAll(lintDescriptor(descriptor));
        }

        ValidationReport report = ValidationReport.of(markers);
        log.debug("Validated {}: {} errors, {} warnings", snapshot.id(), report.errorCount(), report.warningCount());
        return report;
    }

    /**
     * Reports edge types that any pair of nodes may be joined with because no connection
     * rule names them.
     */
    public List<DiagramMarker> lintDescriptor(LanguageDescriptor descriptor) {
        List<DiagramMarker> markers = new ArrayList<>();
        ConnectionRuleValidator rules = ConnectionRuleValidator.forDescriptor(descriptor);
        for (String edgeType : rules.unconstrainedEdgeTypes(descriptor)) {
            markers.add(DiagramMarker.warning(null, PERMISSIVE_EDGE_TYPE,
                "No connection rule constrains edge type " + edgeType + "; any nodes may be connected"));
        }
        return markers;
    }

    private void checkNodes(DiagramSnapshot snapshot, List<DiagramMarker> markers) {
        for (DiagramNode node : snapshot.nodes()) {
            if (node.position().x() < 0 || node.position().y() < 0) {
                markers.add(DiagramMarker.warning(node.id(), NEGATIVE_POSITION,
                    "Node is placed at negative coordinates " + node.position()));
            }
            if (!node.size().isPositive()) {
                markers.add(DiagramMarker.error(node.id(), INVALID_SIZE, "Node has a non-positive size " + node.size()));
            }
            if (node.label() == null || node.label().isBlank()) {
                markers.add(DiagramMarker.hint(node.id(), MISSING_LABEL, "Node has no label"));
            }
        }
    }

    private void checkEdges(DiagramSnapshot snapshot, List<DiagramMarker> markers) {
        for (DiagramEdge edge : snapshot.edges()) {
            if (snapshot.findNode(edge.sourceId()).isEmpty()) {
                markers.add(DiagramMarker.error(edge.id(), MISSING_SOURCE, "Edge source does not exist: " + edge.sourceId()));
            }
            if (snapshot.findNode(edge.targetId()).isEmpty()) {
                markers.add(DiagramMarker.error(edge.id(), MISSING_TARGET, "Edge target does not exist: " + edge.targetId()));
            }
            if (edge.isSelfLoop()) {
                markers.add(DiagramMarker.info(edge.id(), SELF_LOOP, "Edge connects a node to itself"));
            }
        }
    }

    private void checkDuplicateNames(DiagramSnapshot snapshot, Map<String, String> parents, List<DiagramMarker> markers) {
        Set<String> seen = new HashSet<>();
        for (DiagramNode node : snapshot.nodes()) {
            if (node.label() == null || node.label().isBlank()) {
                continue;
            }
            String key = parents.get(node.id()) + "|" + node.type() + "|" + node.label();
            if (!seen.add(key)) {
                markers.add(DiagramMarker.error(node.id(), DUPLICATE_NAME,
                    "Another " + node.type() + " in the same container is named " + node.label()));
            }
        }
    }

    private void checkOverlaps(DiagramSnapshot snapshot, Map<String, String> parents, List<DiagramMarker> markers) {
        List<DiagramNode> nodes = snapshot.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                DiagramNode a = nodes.get(i);
                DiagramNode b = nodes.get(j);
                if (isAncestor(a.id(), b.id(), parents) || isAncestor(b.id(), a.id(), parents)) {
                    continue;
                }
                if (overlaps(a, b)) {
                    markers.add(DiagramMarker.warning(b.id(), OVERLAPPING_NODES, "Node overlaps node " + a.id()));
                }
            }
        }
    }

    private static boolean overlaps(DiagramNode a, DiagramNode b) {
        return a.position().x() < b.position().x() + b.size().width()
            && b.position().x() < a.position().x() + a.size().width()
            && a.position().y() < b.position().y() + b.size().height()
            && b.position().y() < a.position().y() + a.size().height();
    }

    private static boolean isAncestor(String candidate, String nodeId, Map<String, String> parents) {
        Set<String> visited = new HashSet<>();
        String current = parents.get(nodeId);
        while (current != null && visited.add(current)) {
            if (current.equals(candidate)) {
                return true;
            }
            current = parents.get(current);
        }
        return false;
    }

    private static Map<String, String> containmentParents(DiagramSnapshot snapshot) {
        Map<String, String> parents = new HashMap<>();
        for (DiagramEdge edge : snapshot.edges()) {
            if (edge.kind() == EdgeKind.CONTAINMENT) {
                parents.put(edge.targetId(), edge.sourceId());
            }
        }
        return parents;
    }
}
