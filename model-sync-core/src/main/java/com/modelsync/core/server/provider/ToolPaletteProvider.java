package com.modelsync.core.server.provider;

import com.modelsync.core.descriptor.EdgeTypeConfig;
import com.modelsync.core.descriptor.ElementTypes;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.server.provider.ToolPalette.ToolGroup;
import com.modelsync.core.server.provider.ToolPalette.ToolItem;
import com.modelsync.core.server.provider.ToolPalette.ToolKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the tool palette of a language from its descriptor.
 */
public class ToolPaletteProvider {

    public static final String NODES_GROUP = "nodes";
    public static final String EDGES_GROUP = "edges";
    public static final String ACTIONS_GROUP = "actions";

    public ToolPalette getToolPalette(LanguageDescriptor descriptor) {
        List<ToolItem> nodeTools = new ArrayList<>();
        for (Map.Entry<String, NodeMapping> entry : descriptor.nodes().entrySet()) {
            NodeMapping mapping = entry.getValue();
            if (!mapping.creatable()) {
                continue;
            }
            String diagramType = descriptor.diagramTypeFor(entry.getKey());
            String label = mapping.label() != null ? mapping.label() : entry.getKey();
            nodeTools.add(new ToolItem("create-" + diagramType, label, ToolKind.NODE, diagramType));
        }

        List<ToolItem> edgeTools = new ArrayList<>();
        for (EdgeTypeConfig edgeType : descriptor.edgeTypes()) {
            if (edgeType.creatable()) {
                String label = edgeType.label() != null ? edgeType.label() : ElementTypes.displayName(edgeType.type());
                edgeTools.add(new ToolItem("create-" + edgeType.type(), label, ToolKind.EDGE, edgeType.type()));
            }
        }
        if (descriptor.edgeTypes().isEmpty()) {
            edgeTools.add(new ToolItem("create-" + ElementTypes.EDGE_REFERENCE, "Reference", ToolKind.EDGE,
                ElementTypes.EDGE_REFERENCE));
        }

        List<ToolGroup> groups = new ArrayList<>();
        if (!nodeTools.isEmpty()) {
            groups.add(new ToolGroup(NODES_GROUP, "Nodes", nodeTools));
        }
        if (!edgeTools.isEmpty()) {
            groups.add(new ToolGroup(EDGES_GROUP, "Edges", edgeTools));
        }
        groups.add(new ToolGroup(ACTIONS_GROUP, "Actions",
            List.of(new ToolItem(Operation.DELETE_ELEMENT, "Delete", ToolKind.ACTION, null))));

        String defaultTool = nodeTools.isEmpty() ? null : nodeTools.get(0).id();
        return new ToolPalette(descriptor.languageId(), groups, defaultTool);
    }
}
