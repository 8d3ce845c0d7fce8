package com.modelsync.core.server.provider;

import com.modelsync.core.TestModels;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.model.Point;
import com.modelsync.core.operation.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextMenuProviderTest {

    private final ContextMenuProvider provider = new ContextMenuProvider();
    private DiagramContext context;

    @BeforeEach
    void setUp() {
        context = TestModels.abContext();
    }

    @Test
    void getContextMenu_emptySelection_offersCreateAndLayout() {
        List<MenuItem> items = provider.getContextMenu(context, List.of());

        assertThat(items).extracting(MenuItem::id).containsExactly("create", "layout", ContextMenuProvider.ACTION_SELECT_ALL);
        assertThat(items.get(0).children()).extracting(MenuItem::id)
            .containsExactly("create-node:package", "create-node:entity");
        assertThat(items.get(0).children().get(1).action()).isEqualTo(Operation.CREATE_NODE);
        assertThat(items.get(0).children().get(1).args()).containsEntry("elementType", "node:entity");
        assertThat(items.get(1).children()).extracting(MenuItem::id)
            .containsExactly("layout-grid", "layout-tree", "layout-layered", "layout-force");
        assertThat(items.get(2).enabled()).isTrue();
    }

    @Test
    void getContextMenu_nullSelectionOnEmptyDiagram_disablesSelectAll() {
        List<MenuItem> items = provider.getContextMenu(TestModels.emptyContext(), null);

        assertThat(items.get(2).id()).isEqualTo(ContextMenuProvider.ACTION_SELECT_ALL);
        assertThat(items.get(2).enabled()).isFalse();
    }

    @Test
    void getContextMenu_node_offersRenameDeleteAndRevealSource() {
        String a = TestModels.nodeId(context, "A");

        List<MenuItem> items = provider.getContextMenu(context, List.of(a));

        assertThat(items).extracting(MenuItem::id)
            .containsExactly(ContextMenuProvider.ACTION_RENAME, "delete", ContextMenuProvider.ACTION_REVEAL_SOURCE);
        assertThat(items).allMatch(MenuItem::enabled);
        assertThat(items.get(1).args()).containsEntry("elementId", a);
    }

    @Test
    void getContextMenu_unroutedEdge_disablesClearRouting() {
        String edgeId = context.snapshot().edges().get(0).id();

        List<MenuItem> items = provider.getContextMenu(context, List.of(edgeId));

        assertThat(items).extracting(MenuItem::id).containsExactly("delete", ContextMenuProvider.ACTION_CLEAR_ROUTING);
        assertThat(items.get(1).enabled()).isFalse();
    }

    @Test
    void getContextMenu_routedEdge_enablesClearRouting() {
        String edgeId = context.snapshot().edges().get(0).id();
        context.metadata().setRoutingPoints(edgeId, List.of(new Point(10, 10)));

        List<MenuItem> items = provider.getContextMenu(context, List.of(edgeId));

        assertThat(items.get(1).enabled()).isTrue();
    }

    @Test
    void getContextMenu_multiSelection_offersBulkActions() {
        String a = TestModels.nodeId(context, "A");
        String b = TestModels.nodeId(context, "B");

        List<MenuItem> items = provider.getContextMenu(context, List.of(a, b));

        assertThat(items).extracting(MenuItem::label).containsExactly("Delete 2 Elements", "Layout Selection");
        assertThat(items.get(0).args()).containsEntry("elementIds", a + "," + b);
    }

    @Test
    void getContextMenu_unknownElement_returnsNothing() {
        assertThat(provider.getContextMenu(context, List.of("missing"))).isEmpty();
    }
}
