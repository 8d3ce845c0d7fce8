package com.modelsync.core.operation.impl;

import com.modelsync.core.TestModels;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.model.Point;
import com.modelsync.core.model.TextEdit;
import com.modelsync.core.model.TextRange;
import com.modelsync.core.operation.CreateNodeOperation;
import com.modelsync.core.operation.DeleteElementOperation;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.rules.PortGeometry;
import com.modelsync.core.sync.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DeleteElementHandler}.
 */
class DeleteElementHandlerTest {

    private final DeleteElementHandler handler = new DeleteElementHandler(new TemplateTextMaterializer());

    private DiagramContext context;
    private String a;
    private String b;
    private String edgeId;

    @BeforeEach
    void setUp() {
        context = TestModels.abContext();
        a = TestModels.nodeId(context, "A");
        b = TestModels.nodeId(context, "B");
        edgeId = context.snapshot().edges().get(0).id();
    }

    @Test
    void execute_node_removesConnectedEdgesAndSourceText() {
        OperationResult result = handler.execute(context, DeleteElementOperation.of(a));

        assertThat(result.success()).isTrue();
        assertThat(result.affectedIds()).containsExactly(a, edgeId);
        assertThat(context.snapshot().nodes()).extracting(node -> node.id()).containsExactly(b);
        assertThat(context.snapshot().edges()).isEmpty();
        assertThat(result.textEdits()).containsExactly(
            TextEdit.delete(TextRange.of(0, 0, 1, 1)),
            TextEdit.delete(TextRange.of(3, 0, 4, 0)));
        assertThat(context.metadata().position(a)).isEmpty();
        assertThat(applied(result)).isEqualTo("\nentity B {\n}\n");
    }

    @Test
    void execute_referencingNode_deletesOneRangeCoveringItsReference() {
        OperationResult result = handler.execute(context, DeleteElementOperation.of(b));

        assertThat(result.affectedIds()).containsExactly(b, edgeId);
        assertThat(result.textEdits()).containsExactly(TextEdit.delete(TextRange.of(2, 0, 4, 1)));
        assertThat(applied(result)).isEqualTo("entity A {\n}\n\n");
    }

    @Test
    void execute_edgeOnly_keepsNodes() {
        OperationResult result = handler.execute(context, DeleteElementOperation.of(edgeId));

        assertThat(result.affectedIds()).containsExactly(edgeId);
        assertThat(context.snapshot().nodes()).hasSize(2);
        assertThat(result.textEdits()).containsExactly(TextEdit.delete(TextRange.of(3, 0, 4, 0)));
        assertThat(applied(result)).isEqualTo("entity A {\n}\nentity B {\n}\n");
    }

    @Test
    void execute_container_deletesContainedNodes() {
        OperationResult created = new CreateNodeHandler(new TemplateTextMaterializer(), new PortGeometry(10))
            .execute(context, new CreateNodeOperation("node:property", null, a, Map.of()));
        String child = created.affectedIds().get(0);

        OperationResult result = handler.execute(context, DeleteElementOperation.of(a));

        assertThat(result.affectedIds()).contains(a, child);
        assertThat(context.snapshot().findNode(child)).isEmpty();
    }

    @Test
    void execute_unknownElement_isRejected() {
        OperationResult result = handler.execute(context, DeleteElementOperation.of(a, "ghost"));

        assertThat(result.success()).isFalse();
        assertThat(context.snapshot().nodes()).hasSize(2);
    }

    private static String applied(OperationResult result) {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.put(TestModels.abDocument());
        assertThat(store.applyEdits(TestModels.URI, result.textEdits()).join()).isTrue();
        return store.get(TestModels.URI).orElseThrow().text();
    }

    @Test
    void undo_restoresElementsInOrderWithMetadata() {
        Point positionOfA = context.metadata().position(a).orElseThrow();
        OperationResult result = handler.execute(context, DeleteElementOperation.of(a));

        assertThat(handler.undo(context, result)).isTrue();

        assertThat(context.snapshot().nodes()).extracting(node -> node.id()).containsExactly(a, b);
        assertThat(context.snapshot().findEdge(edgeId)).isPresent();
        assertThat(context.metadata().position(a)).contains(positionOfA);
        assertThat(context.metadata().sourceRange(edgeId)).isPresent();
    }
}
