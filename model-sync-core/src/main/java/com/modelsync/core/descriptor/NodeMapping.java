package com.modelsync.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelsync.core.model.Dimension;

import java.util.List;

/**
 * Mapping of one AST type to its diagram representation.
 *
 * @param diagramType diagram node type, null to infer it from the AST type name
 * @param label palette label, null to derive one from the diagram type
 * @param shape shape hint
 * @param cssClass style class
 * @param defaultSize size used when neither metadata nor the AST gives one
 * @param ports boundary ports
 * @param creatable whether the palette offers a tool for it
 * @param template text template for new elements, {@code ${name}} is substituted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeMapping(
    @JsonProperty("diagramType") String diagramType,
    @JsonProperty("label") String label,
    @JsonProperty("shape") String shape,
    @JsonProperty("cssClass") String cssClass,
    @JsonProperty("defaultSize") Dimension defaultSize,
    @JsonProperty("ports") List<PortDefinition> ports,
    @JsonProperty("creatable") Boolean creatable,
    @JsonProperty("template") String template
) {
    public NodeMapping {
        ports = ports != null ? List.copyOf(ports) : List.of();
        creatable = creatable == null || creatable;
    }

    public static NodeMapping of(String diagramType) {
        return new NodeMapping(diagramType, null, null, null, null, List.of(), true, null);
    }

    public NodeMapping withPorts(List<PortDefinition> newPorts) {
        return new NodeMapping(diagramType, label, shape, cssClass, defaultSize, newPorts, creatable, template);
    }

    public NodeMapping withDefaultSize(Dimension size) {
        return new NodeMapping(diagramType, label, shape, cssClass, size, ports, creatable, template);
    }
}
