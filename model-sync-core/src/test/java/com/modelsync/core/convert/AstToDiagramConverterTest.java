package com.modelsync.core.convert;

import com.modelsync.core.TestModels;
import com.modelsync.core.ast.AstNode;
import com.modelsync.core.ast.ReferenceValue;
import com.modelsync.core.descriptor.ElementTypes;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.model.Point;
import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.model.SourceRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link AstToDiagramConverter}.
 */
class AstToDiagramConverterTest {

    private final AstToDiagramConverter converter = new AstToDiagramConverter();

    @Test
    void convert_entitiesWithReference_producesTwoNodesAndTypedEdge() {
        DiagramContext context = reconciled(TestModels.abModel(), TestModels.ecml());

        DiagramSnapshot snapshot = converter.convert(context);

        assertThat(snapshot.nodes()).extracting(DiagramNode::label).containsExactly("A", "B");
        String idOfA = idOf(snapshot, "A");
        String idOfB = idOf(snapshot, "B");
        assertThat(snapshot.edges()).singleElement().satisfies(edge -> {
            assertThat(edge.type()).isEqualTo("edge:target");
            assertThat(edge.kind()).isEqualTo(EdgeKind.REFERENCE);
            assertThat(edge.sourceId()).isEqualTo(idOfB);
            assertThat(edge.targetId()).isEqualTo(idOfA);
            assertThat(edge.id()).isEqualTo(idOfB + "_target_" + idOfA);
        });
    }

    @Test
    void convert_unmappedReferenceProperty_usesGenericReferenceType() {
        LanguageDescriptor descriptor = new LanguageDescriptor("plain", null,
            Map.of("Entity", NodeMapping.of("node:entity")), List.of(), List.of(), Map.of());
        DiagramContext context = reconciled(TestModels.abModel(), descriptor);

        DiagramSnapshot snapshot = converter.convert(context);

        assertThat(snapshot.edges()).extracting(DiagramEdge::type).containsExactly(ElementTypes.EDGE_REFERENCE);
    }

    @Test
    void convert_everyEdgeEndpoint_resolvesWithinSnapshot() {
        AstNode property = AstNode.builder("Property").name("owner").span(30, 8).build();
        AstNode customer = AstNode.builder("Entity").name("Customer").span(0, 20).build();
        AstNode order = AstNode.builder("Entity").name("Order").span(21, 40)
            .child("properties", property)
            .field("target", ReferenceValue.resolved("Customer", customer))
            .field("superType", ReferenceValue.unresolved("Missing"))
            .build();
        AstNode pkg = AstNode.builder("Package").name("shop").span(0, 70)
            .child("entities", customer).child("entities", order).build();
        DiagramContext context = reconciled(AstNode.builder("Model").child("packages", pkg).build(), TestModels.ecml());

        DiagramSnapshot snapshot = converter.convert(context);

        Set<String> nodeIds = snapshot.nodes().stream().map(DiagramNode::id).collect(Collectors.toSet());
        assertThat(snapshot.nodes()).hasSize(4);
        assertThat(snapshot.edges()).isNotEmpty().allSatisfy(edge -> {
            assertThat(nodeIds).contains(edge.sourceId());
            assertThat(nodeIds).contains(edge.targetId());
        });
        assertThat(snapshot.edges()).filteredOn(edge -> edge.kind() == EdgeKind.CONTAINMENT)
            .extracting(DiagramEdge::type).containsOnly(ElementTypes.EDGE_CONTAINS).hasSize(3);
    }

    @Test
    void convert_unnamedOrUnmappedNodes_areSkippedButTraversed() {
        AstNode inner = AstNode.builder("Entity").name("Inner").span(10, 5).build();
        AstNode wrapper = AstNode.builder("Block").span(5, 20).child("members", inner).build();
        AstNode anonymous = AstNode.builder("Entity").span(30, 5).build();
        AstNode root = AstNode.builder("Model").child("blocks", wrapper).child("entities", anonymous).build();

        DiagramSnapshot snapshot = converter.convert(reconciled(root, TestModels.ecml()));

        assertThat(snapshot.nodes()).extracting(DiagramNode::label).containsExactly("Inner");
    }

    @Test
    void convert_referenceInsideWrapperNode_isFound() {
        AstNode a = AstNode.builder("Entity").name("A").span(0, 10).build();
        AstNode clause = AstNode.builder("TargetClause").span(25, 10)
            .field("target", ReferenceValue.resolved("A", a))
            .build();
        AstNode b = AstNode.builder("Entity").name("B").span(11, 30).field("clause", clause).build();
        AstNode root = AstNode.builder("Model").child("entities", a).child("entities", b).build();

        DiagramSnapshot snapshot = converter.convert(reconciled(root, TestModels.ecml()));

        assertThat(snapshot.edges()).singleElement()
            .satisfies(edge -> assertThat(edge.type()).isEqualTo("edge:target"));
    }

    @Test
    void convert_referenceList_producesOneEdgePerElement() {
        AstNode a = AstNode.builder("Entity").name("A").span(0, 10).build();
        AstNode c = AstNode.builder("Entity").name("C").span(11, 10).build();
        AstNode b = AstNode.builder("Entity").name("B").span(22, 10)
            .reference("uses", ReferenceValue.resolved("A", a))
            .reference("uses", ReferenceValue.resolved("C", c))
            .build();
        AstNode root = AstNode.builder("Model").child("entities", a).child("entities", c).child("entities", b).build();

        DiagramSnapshot snapshot = converter.convert(reconciled(root, TestModels.ecml()));

        assertThat(snapshot.edges()).hasSize(2)
            .extracting(DiagramEdge::id)
            .allSatisfy(id -> assertThat(id).contains("_uses["));
    }

    @Test
    void convert_listMixingReferencesAndWrapperNodes_scansBoth() {
        AstNode a = AstNode.builder("Entity").name("A").span(0, 10).build();
        AstNode c = AstNode.builder("Entity").name("C").span(11, 10).build();
        AstNode clause = AstNode.builder("TargetClause").span(30, 8)
            .field("target", ReferenceValue.resolved("C", c))
            .build();
        AstNode b = AstNode.builder("Entity").name("B").span(22, 20)
            .reference("uses", ReferenceValue.resolved("A", a))
            .child("uses", clause)
            .build();
        AstNode root = AstNode.builder("Model").child("entities", a).child("entities", c).child("entities", b).build();

        DiagramSnapshot snapshot = converter.convert(reconciled(root, TestModels.ecml()));

        Map<String, String> nodeIds = snapshot.nodes().stream()
            .collect(Collectors.toMap(DiagramNode::label, DiagramNode::id));
        assertThat(snapshot.edges())
            .extracting(DiagramEdge::property, DiagramEdge::targetId)
            .containsExactlyInAnyOrder(
                tuple("uses", nodeIds.get("A")),
                tuple("target", nodeIds.get("C")));
        assertThat(snapshot.edges()).allSatisfy(edge -> assertThat(edge.sourceId()).isEqualTo(nodeIds.get("B")));
    }

    @Test
    void convert_metadataPositionAndSize_takePrecedence() {
        DiagramContext context = reconciled(TestModels.abModel(), TestModels.ecml());
        String idOfA = idOf(converter.convert(context), "A");
        context.metadata().setPosition(idOfA, new Point(400, 300));
        context.metadata().setSize(idOfA, new Dimension(220, 120));

        DiagramNode a = converter.convert(context).findNode(idOfA).orElseThrow();

        assertThat(a.position()).isEqualTo(new Point(400, 300));
        assertThat(a.size()).isEqualTo(new Dimension(220, 120));
    }

    @Test
    void convert_embeddedPosition_usedWhenNoMetadata() {
        AstNode a = AstNode.builder("Entity").name("A").span(0, 10)
            .field("position", Map.of("x", 70, "y", 90))
            .build();
        DiagramSnapshot snapshot = converter.convert(reconciled(AstNode.builder("Model").child("entities", a).build(),
            TestModels.ecml()));

        assertThat(snapshot.nodes().get(0).position()).isEqualTo(new Point(70, 90));
    }

    @Test
    void convert_unpositionedNodes_areLaidOutAndPersisted() {
        DiagramContext context = reconciled(TestModels.abModel(), TestModels.ecml());

        DiagramSnapshot snapshot = converter.convert(context);

        assertThat(snapshot.nodes()).allSatisfy(node ->
            assertThat(context.metadata().position(node.id())).contains(node.position()));
        assertThat(snapshot.nodes().get(0).position()).isNotEqualTo(snapshot.nodes().get(1).position());
    }

    @Test
    void convert_recordsSourceRangesForNodesAndReferences() {
        DiagramContext context = reconciled(TestModels.abModel(), TestModels.ecml());

        DiagramSnapshot snapshot = converter.convert(context);

        assertThat(context.metadata().sourceRange(idOf(snapshot, "B"))).contains(new SourceRange(13, 25));
        assertThat(context.metadata().sourceRange(snapshot.edges().get(0).id())).contains(new SourceRange(35, 1));
    }

    @Test
    void convert_entityNodes_getDescriptorSizeAndPorts() {
        DiagramSnapshot snapshot = converter.convert(reconciled(TestModels.abModel(), TestModels.ecml()));

        DiagramNode a = snapshot.nodes().get(0);
        assertThat(a.size()).isEqualTo(new Dimension(150, 80));
        assertThat(a.ports()).extracting(port -> port.portId()).containsExactly("in", "out");
    }

    @Test
    void convert_incrementsRevision() {
        DiagramContext context = reconciled(TestModels.abModel(), TestModels.ecml());
        DiagramSnapshot first = converter.convert(context);
        context.setSnapshot(first);

        DiagramSnapshot second = converter.convert(context);

        assertThat(second.revision()).isEqualTo(first.revision() + 1);
    }

    @Test
    void convert_withoutReconcile_stillProducesUniqueIds() {
        DiagramContext context = new DiagramContext(TestModels.abDocument(), TestModels.abModel(), TestModels.ecml());

        DiagramSnapshot snapshot = converter.convert(context);

        assertThat(snapshot.nodes()).hasSize(2);
        assertThat(snapshot.elementIds()).doesNotHaveDuplicates();
    }

    private static DiagramContext reconciled(AstNode root, LanguageDescriptor descriptor) {
        DiagramContext context = new DiagramContext(new SourceDocument(TestModels.URI, TestModels.AB_TEXT, 1), root, descriptor);
        context.registry().reconcile(root, TestModels.URI);
        return context;
    }

    private static String idOf(DiagramSnapshot snapshot, String label) {
        return snapshot.nodes().stream().filter(node -> label.equals(node.label())).findFirst().orElseThrow().id();
    }
}
