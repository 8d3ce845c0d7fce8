package com.modelsync.core.server.provider;

import com.modelsync.core.TestModels;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagramValidatorTest {

    private final DiagramValidator validator = new DiagramValidator();

    @Test
    void validate_convertedModel_isValid() {
        DiagramSnapshot snapshot = TestModels.abContext().snapshot();

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.valid()).isTrue();
        assertThat(report.errorCount()).isZero();
    }

    @Test
    void validate_overlappingNodes_warnsOnSecondNode() {
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(
            node("a", "A", 0, 0),
            node("b", "B", 50, 20)), List.of());

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.markersFor("b")).extracting(DiagramMarker::code)
            .containsExactly(DiagramValidator.OVERLAPPING_NODES);
        assertThat(report.markersFor("a")).isEmpty();
        assertThat(report.valid()).isTrue();
        assertThat(report.warningCount()).isEqualTo(1);
    }

    @Test
    void validate_nestedNodes_areNotReportedAsOverlapping() {
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(
            node("pkg", "P", 0, 0),
            node("child", "C", 10, 10)),
            List.of(edge("pkg_contains_child", EdgeKind.CONTAINMENT, "pkg", "child")));

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.hasCode(DiagramValidator.OVERLAPPING_NODES)).isFalse();
    }

    @Test
    void validate_duplicateNamesInSameContainer_reportsError() {
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(
            node("a1", "A", 0, 0),
            node("a2", "A", 300, 0)), List.of());

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.valid()).isFalse();
        assertThat(report.markersFor("a2")).extracting(DiagramMarker::code)
            .containsExactly(DiagramValidator.DUPLICATE_NAME);
        assertThat(report.markersFor("a2").get(0).severity()).isEqualTo(MarkerSeverity.ERROR);
    }

    @Test
    void validate_sameNameInDifferentContainers_isAllowed() {
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(
            node("p1", "P1", 0, 0),
            node("p2", "P2", 300, 0),
            node("a1", "A", 0, 300),
            node("a2", "A", 300, 300)),
            List.of(
                edge("p1_contains_a1", EdgeKind.CONTAINMENT, "p1", "a1"),
                edge("p2_contains_a2", EdgeKind.CONTAINMENT, "p2", "a2")));

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.hasCode(DiagramValidator.DUPLICATE_NAME)).isFalse();
    }

    @Test
    void validate_danglingEdge_reportsMissingEndpoints() {
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(node("a", "A", 0, 0)),
            List.of(edge("e", EdgeKind.REFERENCE, "ghost", "gone")));

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.markersFor("e")).extracting(DiagramMarker::code)
            .containsExactly(DiagramValidator.MISSING_SOURCE, DiagramValidator.MISSING_TARGET);
        assertThat(report.errorCount()).isEqualTo(2);
    }

    @Test
    void validate_selfLoop_isInformational() {
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(node("a", "A", 0, 0)),
            List.of(edge("loop", EdgeKind.REFERENCE, "a", "a")));

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.markersFor("loop")).singleElement()
            .satisfies(marker -> {
                assertThat(marker.code()).isEqualTo(DiagramValidator.SELF_LOOP);
                assertThat(marker.severity()).isEqualTo(MarkerSeverity.INFO);
            });
        assertThat(report.valid()).isTrue();
    }

    @Test
    void validate_badGeometryAndLabel_reportsEachProblem() {
        DiagramNode broken = new DiagramNode("x", "node:entity", " ", new Point(-10, 5),
            new Dimension(0, 40), null, List.of(), List.of());
        DiagramSnapshot snapshot = new DiagramSnapshot("d", 1, List.of(broken), List.of());

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(report.markersFor("x")).extracting(DiagramMarker::code).containsExactly(
            DiagramValidator.NEGATIVE_POSITION, DiagramValidator.INVALID_SIZE, DiagramValidator.MISSING_LABEL);
        assertThat(report.errorCount()).isEqualTo(1);
        assertThat(report.warningCount()).isEqualTo(1);
    }

    @Test
    void lintDescriptor_flagsEdgeTypesWithoutRules() {
        List<DiagramMarker> markers = validator.lintDescriptor(TestModels.ecml());

        assertThat(markers).allSatisfy(marker -> {
            assertThat(marker.code()).isEqualTo(DiagramValidator.PERMISSIVE_EDGE_TYPE);
            assertThat(marker.severity()).isEqualTo(MarkerSeverity.WARNING);
            assertThat(marker.elementId()).isNull();
        });
        assertThat(markers).extracting(DiagramMarker::message)
            .anyMatch(message -> message.contains("edge:target"))
            .anyMatch(message -> message.contains("edge:reference"))
            .noneMatch(message -> message.contains("edge:extends"));
    }

    @Test
    void validate_withDescriptor_includesLintWarnings() {
        ValidationReport report = validator.validate(TestModels.abContext().snapshot(), TestModels.ecml());

        assertThat(report.hasCode(DiagramValidator.PERMISSIVE_EDGE_TYPE)).isTrue();
        assertThat(report.valid()).isTrue();
    }

    private static DiagramNode node(String id, String label, double x, double y) {
        return new DiagramNode(id, "node:entity", label, new Point(x, y), new Dimension(150, 80),
            null, List.of(), List.of());
    }

    private static DiagramEdge edge(String id, EdgeKind kind, String source, String target) {
        return new DiagramEdge(id, "edge:test", kind, source, target, null, null, List.of(), null, null);
    }
}
