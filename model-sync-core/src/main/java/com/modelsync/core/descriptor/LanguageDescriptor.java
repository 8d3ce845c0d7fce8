package com.modelsync.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelsync.core.ast.FieldKind;
import com.modelsync.core.model.Dimension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative per-language configuration consumed by the converter, the operation
 * handlers and the connection rule validator.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * languageId: ecml
 * displayName: Entity Modeling Language
 * nodes:
 *   Entity:
 *     diagramType: node:entity
 *     defaultSize: { width: 150, height: 80 }
 *     ports:
 *       - { id: in, side: left }
 *       - { id: out, side: right }
 * edgeTypes:
 *   - { type: edge:target, property: target }
 * connectionRules:
 *   - { edgeType: edge:target, sourceType: node:entity, sourcePort: out, targetType: '*' }
 * schema:
 *   Entity:
 *     target: REFERENCE
 * }</pre>
 *
 * @param languageId language identifier
 * @param displayName human readable name
 * @param nodes AST type to node mapping, in declaration order
 * @param edgeTypes declared edge types
 * @param connectionRules connection rules
 * @param schema AST type to field kinds, consulted before structural inference
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LanguageDescriptor(
    @JsonProperty("languageId") String languageId,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("nodes") Map<String, NodeMapping> nodes,
    @JsonProperty("edgeTypes") List<EdgeTypeConfig> edgeTypes,
    @JsonProperty("connectionRules") List<ConnectionRule> connectionRules,
    @JsonProperty("schema") Map<String, Map<String, FieldKind>> schema
) {
    public LanguageDescriptor {
        Objects.requireNonNull(languageId, "languageId must not be null");
        displayName = displayName != null ? displayName : languageId;
        nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        edgeTypes = edgeTypes != null ? List.copyOf(edgeTypes) : List.of();
        connectionRules = connectionRules != null ? List.copyOf(connectionRules) : List.of();
        schema = schema != null ? Map.copyOf(schema) : Map.of();
    }

    /**
     * Whether the AST type has a node mapping. Only mapped, named AST nodes become diagram nodes.
     */
    public boolean isMapped(String astType) {
        return nodes.containsKey(astType);
    }

    public Optional<NodeMapping> mappingFor(String astType) {
        return Optional.ofNullable(nodes.get(astType));
    }

    /**
     * Resolves the diagram node type of an AST type, inferring it from the type name when
     * the mapping leaves it open or no mapping exists.
     */
    public String diagramTypeFor(String astType) {
        NodeMapping mapping = nodes.get(astType);
        if (mapping != null && mapping.diagramType() != null) {
            return mapping.diagramType();
        }
        return ElementTypes.inferNodeType(astType);
    }

    /**
     * Finds the first AST type whose resolved diagram type is the given one.
     */
    public Optional<String> astTypeFor(String diagramType) {
        return nodes.keySet().stream()
            .filter(astType -> diagramTypeFor(astType).equals(diagramType))
            .findFirst();
    }

    public Optional<NodeMapping> mappingForDiagramType(String diagramType) {
        return astTypeFor(diagramType).map(nodes::get);
    }

    @JsonIgnore
    public Set<String> supportedNodeTypes() {
        Set<String> types = new LinkedHashSet<>();
        nodes.keySet().forEach(astType -> types.add(diagramTypeFor(astType)));
        return types;
    }

    /**
     * Supported edge types: the declared ones plus the generic reference type.
     */
    @JsonIgnore
    public Set<String> supportedEdgeTypes() {
        Set<String> types = new LinkedHashSet<>();
        edgeTypes.forEach(config -> types.add(config.type()));
        types.add(ElementTypes.EDGE_REFERENCE);
        return types;
    }

    public Dimension defaultSizeFor(String diagramType) {
        return mappingForDiagramType(diagramType)
            .map(NodeMapping::defaultSize)
            .orElseGet(() -> ElementTypes.defaultSize(diagramType));
    }

    public List<PortDefinition> portsFor(String diagramType) {
        return mappingForDiagramType(diagramType).map(NodeMapping::ports).orElse(List.of());
    }

    public Optional<EdgeTypeConfig> edgeType(String type) {
        return edgeTypes.stream().filter(config -> config.type().equals(type)).findFirst();
    }

    /**
     * Edge type produced by an AST reference field, if the descriptor declares one.
     */
    public Optional<String> edgeTypeForProperty(String property) {
        return edgeTypes.stream()
            .filter(config -> property.equals(config.property()))
            .map(EdgeTypeConfig::type)
            .findFirst();
    }

    /**
     * AST field an edge type is written to. Undeclared types use the part after the colon.
     */
    public String propertyForEdgeType(String edgeType) {
        return edgeType(edgeType)
            .map(EdgeTypeConfig::property)
            .filter(Objects::nonNull)
            .orElseGet(() -> edgeType.contains(":") ? edgeType.substring(edgeType.indexOf(':') + 1) : edgeType);
    }

    public boolean allowsDuplicates(String edgeType) {
        return edgeType(edgeType).map(EdgeTypeConfig::allowDuplicates).orElse(false);
    }

    /**
     * Kind of an AST field: the declared schema entry if present, otherwise inferred from the value.
     */
    public FieldKind fieldKind(String astType, String field, Object value) {
        Map<String, FieldKind> fields = schema.get(astType);
        if (fields != null) {
            FieldKind declared = fields.get(field);
            if (declared != null) {
                return declared;
            }
        }
        return FieldKind.infer(value);
    }
}
