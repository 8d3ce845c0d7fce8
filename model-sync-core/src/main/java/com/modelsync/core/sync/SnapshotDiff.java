package com.modelsync.core.sync;

import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes element changes between two published snapshots.
 */
public final class SnapshotDiff {

    private SnapshotDiff() {
    }

    /**
     * Lists added, removed and modified nodes and edges.
     *
     * @param previous previously published snapshot, null if none
     * @param current new snapshot
     * @return changes in node then edge order
     */
    public static List<ElementChange> between(DiagramSnapshot previous, DiagramSnapshot current) {
        Objects.requireNonNull(current, "current must not be null");
        List<ElementChange> changes = new ArrayList<>();

        Map<String, DiagramNode> oldNodes = previous != null ? index(previous.nodes(), DiagramNode::id) : Map.of();
        Map<String, DiagramNode> newNodes = index(current.nodes(), DiagramNode::id);
        for (DiagramNode node : newNodes.values()) {
            DiagramNode old = oldNodes.get(node.id());
            if (old == null) {
                changes.add(ElementChange.added(node.id(), node.type()));
            } else {
                compare(changes, node.id(), node.type(), "type", old.type(), node.type());
                compare(changes, node.id(), node.type(), "label", old.label(), node.label());
                compare(changes, node.id(), node.type(), "position", old.position(), node.position());
                compare(changes, node.id(), node.type(), "size", old.size(), node.size());
            }
        }
        for (DiagramNode old : oldNodes.values()) {
            if (!newNodes.containsKey(old.id())) {
                changes.add(ElementChange.removed(old.id(), old.type()));
            }
        }

        Map<String, DiagramEdge> oldEdges = previous != null ? index(previous.edges(), DiagramEdge::id) : Map.of();
        Map<String, DiagramEdge> newEdges = index(current.edges(), DiagramEdge::id);
        for (DiagramEdge edge : newEdges.values()) {
            DiagramEdge old = oldEdges.get(edge.id());
            if (old == null) {
                changes.add(ElementChange.added(edge.id(), edge.type()));
            } else {
                compare(changes, edge.id(), edge.type(), "sourceId", old.sourceId(), edge.sourceId());
                compare(changes, edge.id(), edge.type(), "targetId", old.targetId(), edge.targetId());
            }
        }
        for (DiagramEdge old : oldEdges.values()) {
            if (!newEdges.containsKey(old.id())) {
                changes.add(ElementChange.removed(old.id(), old.type()));
            }
        }
        return changes;
    }

    private static void compare(List<ElementChange> changes, String id, String type, String property,
                                Object oldValue, Object newValue) {
        if (!Objects.equals(oldValue, newValue)) {
            changes.add(ElementChange.modified(id, type, property, oldValue, newValue));
        }
    }

    private static <T> Map<String, T> index(List<T> elements, Function<T, String> id) {
        Map<String, T> byId = new LinkedHashMap<>();
        for (T element : elements) {
            byId.put(id.apply(element), element);
        }
        return byId;
    }
}
