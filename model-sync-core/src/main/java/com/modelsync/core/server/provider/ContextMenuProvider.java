package com.modelsync.core.server.provider;

import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.layout.LayoutAlgorithm;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.operation.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes context menu entries for the current selection.
 *
 * <p>An empty selection gets canvas entries, a single node or edge gets element entries
 * and several elements get bulk entries.
 */
public class ContextMenuProvider {

    public static final String ACTION_APPLY_LAYOUT = "applyLayout";
    public static final String ACTION_SELECT_ALL = "selectAll";
    public static final String ACTION_RENAME = "rename";
    public static final String ACTION_REVEAL_SOURCE = "revealSource";
    public static final String ACTION_CLEAR_ROUTING = "clearRouting";
    public static final String ACTION_LAYOUT_SELECTION = "layoutSelection";

    public List<MenuItem> getContextMenu(DiagramContext context, List<String> selectedIds) {
        List<String> selection = selectedIds != null ? selectedIds : List.of();
        DiagramSnapshot snapshot = context.snapshot();

        if (selection.isEmpty()) {
            return canvasItems(context.descriptor(), snapshot);
        }
        if (selection.size() > 1) {
            return multiSelectionItems(selection);
        }

        String elementId = selection.get(0);
        if (snapshot.findNode(elementId).isPresent()) {
            return nodeItems(context, elementId);
        }
        Optional<DiagramEdge> edge = snapshot.findEdge(elementId);
        if (edge.isPresent()) {
            return edgeItems(context, edge.get());
        }
        return List.of();
    }

    private List<MenuItem> canvasItems(LanguageDescriptor descriptor, DiagramSnapshot snapshot) {
        List<MenuItem> createItems = new ArrayList<>();
        for (Map.Entry<String, NodeMapping> entry : descriptor.nodes().entrySet()) {
            if (!entry.getValue().creatable()) {
                continue;
            }
            String diagramType = descriptor.diagramTypeFor(entry.getKey());
            String label = entry.getValue().label() != null ? entry.getValue().label() : entry.getKey();
            createItems.add(MenuItem.action("create-" + diagramType, label, Operation.CREATE_NODE,
                Map.of("elementType", diagramType)));
        }

        List<MenuItem> layoutItems = new ArrayList<>();
        for (LayoutAlgorithm algorithm : LayoutAlgorithm.values()) {
            layoutItems.add(MenuItem.action("layout-" + algorithm.id(), algorithm.id(), ACTION_APPLY_LAYOUT,
                Map.of("algorithm", algorithm.id())));
        }

        List<MenuItem> items = new ArrayList<>();
        items.add(MenuItem.submenu("create", "Create", createItems));
        items.add(MenuItem.submenu("layout", "Layout", layoutItems));
        items.add(MenuItem.action(ACTION_SELECT_ALL, "Select All", ACTION_SELECT_ALL, Map.of())
            .withEnabled(!snapshot.nodes().isEmpty()));
        return items;
    }

    private List<MenuItem> nodeItems(DiagramContext context, String nodeId) {
        Map<String, String> args = Map.of("elementId", nodeId);
        boolean hasSource = context.metadata().sourceRange(nodeId).isPresent();
        return List.of(
            MenuItem.action(ACTION_RENAME, "Rename", ACTION_RENAME, args)
                .withEnabled(context.astNodeFor(nodeId).isPresent()),
            MenuItem.action("delete", "Delete", Operation.DELETE_ELEMENT, args),
            MenuItem.action(ACTION_REVEAL_SOURCE, "Go to Source", ACTION_REVEAL_SOURCE, args).withEnabled(hasSource));
    }

    private List<MenuItem> edgeItems(DiagramContext context, DiagramEdge edge) {
        Map<String, String> args = Map.of("elementId", edge.id());
        boolean routed = !context.metadata().routingPoints(edge.id()).isEmpty() || !edge.routingPoints().isEmpty();
        return List.of(
            MenuItem.action("delete", "Delete", Operation.DELETE_ELEMENT, args),
            MenuItem.action(ACTION_CLEAR_ROUTING, "Clear Routing", ACTION_CLEAR_ROUTING, args).withEnabled(routed));
    }

    private List<MenuItem> multiSelectionItems(List<String> selection) {
        Map<String, String> args = Map.of("elementIds", String.join(",", selection));
        return List.of(
            MenuItem.action("delete", "Delete " + selection.size() + " Elements", Operation.DELETE_ELEMENT, args),
            MenuItem.action(ACTION_LAYOUT_SELECTION, "Layout Selection", ACTION_LAYOUT_SELECTION, args));
    }
}
