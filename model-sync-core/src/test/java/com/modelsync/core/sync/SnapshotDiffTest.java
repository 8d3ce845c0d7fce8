package com.modelsync.core.sync;

import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SnapshotDiff}.
 */
class SnapshotDiffTest {

    @Test
    void between_noPrevious_reportsEverythingAdded() {
        DiagramSnapshot current = snapshot(List.of(node("a", "A", Point.ORIGIN)), List.of(edge("e", "a", "a")));

        List<ElementChange> changes = SnapshotDiff.between(null, current);

        assertThat(changes).containsExactly(
            ElementChange.added("a", "node:entity"),
            ElementChange.added("e", "edge:target"));
    }

    @Test
    void between_changedNodesAndEdges_reportsPropertyModifications() {
        DiagramSnapshot previous = snapshot(
            List.of(node("a", "A", Point.ORIGIN), node("b", "B", Point.ORIGIN), node("c", "C", Point.ORIGIN)),
            List.of(edge("e", "a", "b")));
        DiagramSnapshot current = snapshot(
            List.of(node("a", "Renamed", Point.ORIGIN), node("b", "B", new Point(5, 5)), node("c", "C", Point.ORIGIN)),
            List.of(edge("e", "a", "c")));

        List<ElementChange> changes = SnapshotDiff.between(previous, current);

        assertThat(changes).containsExactly(
            ElementChange.modified("a", "node:entity", "label", "A", "Renamed"),
            ElementChange.modified("b", "node:entity", "position", Point.ORIGIN, new Point(5, 5)),
            ElementChange.modified("e", "edge:target", "targetId", "b", "c"));
    }

    @Test
    void between_removedElements_areReported() {
        DiagramSnapshot previous = snapshot(List.of(node("a", "A", Point.ORIGIN), node("b", "B", Point.ORIGIN)),
            List.of(edge("e", "a", "b")));
        DiagramSnapshot current = snapshot(List.of(node("a", "A", Point.ORIGIN)), List.of());

        assertThat(SnapshotDiff.between(previous, current)).containsExactly(
            ElementChange.removed("b", "node:entity"),
            ElementChange.removed("e", "edge:target"));
    }

    @Test
    void between_identicalContent_hasNoChanges() {
        DiagramSnapshot previous = snapshot(List.of(node("a", "A", Point.ORIGIN)), List.of());

        assertThat(SnapshotDiff.between(previous, previous.copy())).isEmpty();
    }

    private static DiagramSnapshot snapshot(List<DiagramNode> nodes, List<DiagramEdge> edges) {
        return new DiagramSnapshot("file:///m.ecml", 1, nodes, edges);
    }

    private static DiagramNode node(String id, String label, Point position) {
        return new DiagramNode(id, "node:entity", label, position, new Dimension(100, 50), null, List.of(), List.of());
    }

    private static DiagramEdge edge(String id, String source, String target) {
        return new DiagramEdge(id, "edge:target", EdgeKind.REFERENCE, source, target, null, null, List.of(), null, "target");
    }
}
