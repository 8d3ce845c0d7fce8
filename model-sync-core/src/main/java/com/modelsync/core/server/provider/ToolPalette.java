package com.modelsync.core.server.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Creation tools offered for a language.
 *
 * @param languageId language the palette belongs to
 * @param groups tool groups in display order
 * @param defaultToolId tool selected initially, null when there are no node tools
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolPalette(String languageId, List<ToolGroup> groups, String defaultToolId) {

    public ToolPalette {
        Objects.requireNonNull(languageId, "languageId must not be null");
        groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public Optional<ToolItem> findTool(String toolId) {
        return groups.stream()
            .flatMap(group -> group.items().stream())
            .filter(item -> item.id().equals(toolId))
            .findFirst();
    }

    /**
     * Named group of tools.
     *
     * @param id group ID
     * @param label display label
     * @param items tools in display order
     */
    public record ToolGroup(String id, String label, List<ToolItem> items) {
        public ToolGroup {
            Objects.requireNonNull(id, "id must not be null");
            items = items != null ? List.copyOf(items) : List.of();
        }
    }

    /**
     * A single tool.
     *
     * @param id tool ID
     * @param label display label
     * @param kind what the tool does
     * @param elementType diagram type created by the tool, null for actions
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolItem(String id, String label, ToolKind kind, String elementType) {
        public ToolItem {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }

    /**
     * Tool kinds.
     */
    public enum ToolKind {
        NODE,
        EDGE,
        ACTION
    }
}
