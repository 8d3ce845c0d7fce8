package com.modelsync.core.server.provider;

import com.modelsync.core.TestModels;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.server.provider.ToolPalette.ToolGroup;
import com.modelsync.core.server.provider.ToolPalette.ToolItem;
import com.modelsync.core.server.provider.ToolPalette.ToolKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolPaletteProviderTest {

    private final ToolPaletteProvider provider = new ToolPaletteProvider();

    @Test
    void getToolPalette_ecml_groupsCreatableNodesEdgesAndActions() {
        ToolPalette palette = provider.getToolPalette(TestModels.ecml());

        assertThat(palette.languageId()).isEqualTo("ecml");
        assertThat(palette.groups()).extracting(ToolGroup::id).containsExactly(
            ToolPaletteProvider.NODES_GROUP, ToolPaletteProvider.EDGES_GROUP, ToolPaletteProvider.ACTIONS_GROUP);
        assertThat(palette.groups().get(0).items()).extracting(ToolItem::id)
            .containsExactly("create-node:package", "create-node:entity");
        assertThat(palette.groups().get(1).items()).extracting(ToolItem::elementType)
            .containsExactly("edge:extends", "edge:target");
        assertThat(palette.defaultToolId()).isEqualTo("create-node:package");
    }

    @Test
    void getToolPalette_nonCreatableNode_isLeftOut() {
        ToolPalette palette = provider.getToolPalette(TestModels.ecml());

        assertThat(palette.findTool("create-node:property")).isEmpty();
        assertThat(palette.findTool("create-node:entity")).get()
            .satisfies(tool -> {
                assertThat(tool.label()).isEqualTo("Entity");
                assertThat(tool.kind()).isEqualTo(ToolKind.NODE);
            });
    }

    @Test
    void getToolPalette_deleteAction_isAlwaysOffered() {
        ToolPalette palette = provider.getToolPalette(TestModels.ecml());

        assertThat(palette.findTool(Operation.DELETE_ELEMENT)).get()
            .extracting(ToolItem::kind).isEqualTo(ToolKind.ACTION);
    }

    @Test
    void getToolPalette_noEdgeTypes_offersGenericReference() {
        LanguageDescriptor descriptor = new LanguageDescriptor("mini", "Mini",
            Map.of("Thing", NodeMapping.of("node:thing")), List.of(), List.of(), Map.of());

        ToolPalette palette = provider.getToolPalette(descriptor);

        assertThat(palette.findTool("create-edge:reference")).get()
            .extracting(ToolItem::kind).isEqualTo(ToolKind.EDGE);
        assertThat(palette.findTool("create-node:thing")).isPresent();
    }
}
