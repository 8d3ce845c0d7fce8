package com.modelsync.core.convert;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.ast.FieldKind;
import com.modelsync.core.ast.ReferenceValue;
import com.modelsync.core.descriptor.ElementTypes;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramMetadata;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.identity.ElementIdRegistry;
import com.modelsync.core.layout.LayoutEngine;
import com.modelsync.core.layout.LayoutOptions;
import com.modelsync.core.layout.LayoutResult;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.model.Point;
import com.modelsync.core.model.SourceRange;
import com.modelsync.core.rules.PortGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Derives a diagram snapshot from the AST of a {@link DiagramContext}.
 *
 * <p>Conversion runs in two passes over the tree:
 * <ol>
 *   <li>Nodes: every named AST node whose type the descriptor maps becomes a diagram node.
 *       Other nodes are skipped but still traversed. Position and size come from the stored
 *       metadata, then from embedded {@code position}/{@code size} fields, then from defaults.
 *       Nodes without any position are laid out below the positioned ones and the result is
 *       stored so later conversions keep it.</li>
 *   <li>Edges: a containment edge from the nearest accepted ancestor to each node, and one
 *       reference edge per resolved reference found in the node's fields, including fields of
 *       unmapped wrapper nodes nested inside it.</li>
 * </ol>
 *
 * <p>Element IDs come from the context's {@link ElementIdRegistry}. If the registry has not
 * reconciled the tree, random IDs are minted: the diagram is usable but its IDs will not
 * survive the next conversion.
 */
public class AstToDiagramConverter {

    private static final Logger log = LoggerFactory.getLogger(AstToDiagramConverter.class);

    private static final String POSITION_FIELD = "position";
    private static final String SIZE_FIELD = "size";

    private final LayoutEngine layoutEngine;
    private final PortGeometry portGeometry;
    private final LayoutOptions layoutOptions;

    public AstToDiagramConverter(LayoutEngine layoutEngine, PortGeometry portGeometry, LayoutOptions layoutOptions) {
        this.layoutEngine = Objects.requireNonNull(layoutEngine, "layoutEngine must not be null");
        this.portGeometry = Objects.requireNonNull(portGeometry, "portGeometry must not be null");
        this.layoutOptions = Objects.requireNonNull(layoutOptions, "layoutOptions must not be null");
    }

    public AstToDiagramConverter() {
        this(new LayoutEngine(), new PortGeometry(10), LayoutOptions.defaults());
    }

    /**
     * Converts the context's AST into a new snapshot whose revision is one above the
     * context's current snapshot. The context itself is not updated.
     *
     * @param context document context
     * @return new snapshot
     */
    public DiagramSnapshot convert(DiagramContext context) {
        long revision = context.snapshot().revision() + 1;
        AstNode root = context.root();
        if (root == null) {
            log.debug("No AST for {}, producing empty diagram", context.uri());
            return new DiagramSnapshot(context.uri(), revision, List.of(), List.of());
        }

        LanguageDescriptor descriptor = context.descriptor();
        DiagramMetadata metadata = context.metadata();
        ElementIdRegistry registry = context.registry();
        if (!registry.isReconciled()) {
            log.warn("Element IDs for {} were not reconciled; minting unstable IDs", context.uri());
        }

        Map<AstNode, String> accepted = new IdentityHashMap<>();
        List<Candidate> candidates = new ArrayList<>();
        Map<String, SourceRange> sourceRanges = new HashMap<>();
        collectNodes(root, descriptor, registry, metadata, accepted, candidates, sourceRanges);

        List<DiagramEdge> edges = new ArrayList<>();
        Set<String> edgeIds = new HashSet<>();
        for (Candidate candidate : candidates) {
            nearestAcceptedAncestor(candidate.node(), accepted).ifPresent(parentId ->
                addEdge(edges, edgeIds, new DiagramEdge(parentId + "_contains_" + candidate.id(),
                    ElementTypes.EDGE_CONTAINS, EdgeKind.CONTAINMENT, parentId, candidate.id(),
                    null, null, List.of(), null, candidate.node().containerProperty())));

            Set<AstNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
            visited.add(candidate.node());
            scanReferences(candidate.id(), candidate.node(), descriptor, metadata, accepted, visited, edges, edgeIds, sourceRanges);
        }

        Map<String, Point> positions = resolvePositions(candidates, edges, metadata);
        List<DiagramNode> nodes = candidates.stream()
            .map(candidate -> toDiagramNode(candidate, positions.get(candidate.id()), metadata))
            .toList();

        metadata.replaceSourceRanges(sourceRanges);
        log.debug("Converted {} into {} nodes and {} edges (revision {})",
            context.uri(), nodes.size(), edges.size(), revision);
        return new DiagramSnapshot(context.uri(), revision, nodes, edges);
    }

    // ==================== Pass 1: nodes ====================

    private void collectNodes(AstNode root, LanguageDescriptor descriptor, ElementIdRegistry registry,
                              DiagramMetadata metadata, Map<AstNode, String> accepted,
                              List<Candidate> candidates, Map<String, SourceRange> sourceRanges) {
        Set<String> usedIds = new HashSet<>();
        root.walk(node -> {
            if (!node.hasName() || !descriptor.isMapped(node.type())) {
                return;
            }
            String id = registry.getUuid(node)
                .filter(candidateId -> !usedIds.contains(candidateId))
                .orElseGet(() -> UUID.randomUUID().toString());
            usedIds.add(id);
            accepted.put(node, id);

            NodeMapping mapping = descriptor.mappingFor(node.type()).orElseThrow();
            String diagramType = descriptor.diagramTypeFor(node.type());
            Dimension size = metadata.size(id)
                .or(() -> embeddedDimension(node.field(SIZE_FIELD)))
                .orElseGet(() -> mapping.defaultSize() != null
                    ? mapping.defaultSize()
                    : descriptor.defaultSizeFor(diagramType));
            Point position = metadata.position(id)
                .or(() -> embeddedPoint(node.field(POSITION_FIELD)))
                .orElse(null);

            candidates.add(new Candidate(node, id, diagramType, mapping, size, position));
            sourceRanges.put(id, new SourceRange(node.offset(), node.length()));
        });
    }

    private DiagramNode toDiagramNode(Candidate candidate, Point position, DiagramMetadata metadata) {
        NodeMapping mapping = candidate.mapping();
        List<String> cssClasses = new ArrayList<>();
        if (mapping.cssClass() != null) {
            cssClasses.add(mapping.cssClass());
        }
        if (metadata.isCollapsed(candidate.id())) {
            cssClasses.add("collapsed");
        }
        return new DiagramNode(
            candidate.id(),
            candidate.diagramType(),
            candidate.node().name(),
            position,
            candidate.size(),
            mapping.shape(),
            cssClasses,
            portGeometry.createPorts(candidate.id(), candidate.size(), mapping.ports()));
    }

    /**
     * Returns the final position of every candidate, laying out those without one below the
     * already positioned nodes and storing the computed positions in the metadata.
     */
    private Map<String, Point> resolvePositions(List<Candidate> candidates, List<DiagramEdge> edges,
                                                DiagramMetadata metadata) {
        Map<String, Point> positions = new HashMap<>();
        List<DiagramNode> unpositioned = new ArrayList<>();
        double baseline = 0;
        for (Candidate candidate : candidates) {
            if (candidate.position() != null) {
                positions.put(candidate.id(), candidate.position());
                baseline = Math.max(baseline, candidate.position().y() + candidate.size().height() + layoutOptions.layerSpacing());
            } else {
                unpositioned.add(new DiagramNode(candidate.id(), candidate.diagramType(), candidate.node().name(),
                    Point.ORIGIN, candidate.size(), null, List.of(), List.of()));
            }
        }
        if (unpositioned.isEmpty()) {
            return positions;
        }

        LayoutResult layout = layoutEngine.layout(unpositioned, edges, layoutOptions);
        for (DiagramNode node : unpositioned) {
            Point position = layout.positions().getOrDefault(node.id(), Point.ORIGIN).translate(0, baseline);
            positions.put(node.id(), position);
            metadata.setPosition(node.id(), position);
        }
        log.debug("Auto-positioned {} nodes", unpositioned.size());
        return positions;
    }

    // ==================== Pass 2: edges ====================

    private Optional<String> nearestAcceptedAncestor(AstNode node, Map<AstNode, String> accepted) {
        Optional<AstNode> current = node.container();
        while (current.isPresent()) {
            String id = accepted.get(current.get());
            if (id != null) {
                return Optional.of(id);
            }
            current = current.get().container();
        }
        return Optional.empty();
    }

    /**
     * Emits reference edges for the references held by {@code node}, descending into
     * contained nodes that are not diagram nodes themselves. List elements are handled by
     * their own type, so a list mixing references and wrapper nodes yields both.
     */
    private void scanReferences(String sourceId, AstNode node, LanguageDescriptor descriptor, DiagramMetadata metadata,
                                Map<AstNode, String> accepted, Set<AstNode> visited, List<DiagramEdge> edges,
                                Set<String> edgeIds, Map<String, SourceRange> sourceRanges) {
        for (Map.Entry<String, Object> field : node.fields().entrySet()) {
            String property = field.getKey();
            Object value = field.getValue();
            FieldKind kind = descriptor.fieldKind(node.type(), property, value);

            switch (kind) {
                case REFERENCE -> {
                    if (value instanceof ReferenceValue reference) {
                        addReferenceEdge(sourceId, property, -1, reference, descriptor, metadata, accepted,
                            edges, edgeIds, sourceRanges);
                    }
                }
                case REFERENCE_LIST, CHILD, CHILD_LIST -> {
                    List<?> elements = value instanceof List<?> list ? list : value == null ? List.of() : List.of(value);
                    for (int i = 0; i < elements.size(); i++) {
                        Object element = elements.get(i);
                        if (element instanceof ReferenceValue reference) {
                            addReferenceEdge(sourceId, property, value instanceof List ? i : -1, reference, descriptor, metadata, accepted,
                                edges, edgeIds, sourceRanges);
                        } else if (element instanceof AstNode child && !accepted.containsKey(child) && visited.add(child)) {
                            scanReferences(sourceId, child, descriptor, metadata, accepted, visited, edges, edgeIds, sourceRanges);
                        }
                    }
                }
                case SCALAR -> {
                    // no edges
                }
            }
        }
    }

    private void addReferenceEdge(String sourceId, String property, int index, ReferenceValue reference,
                                  LanguageDescriptor descriptor, DiagramMetadata metadata,
                                  Map<AstNode, String> accepted, List<DiagramEdge> edges,
                                  Set<String> edgeIds, Map<String, SourceRange> sourceRanges) {
        Optional<AstNode> target = reference.target();
        if (target.isEmpty()) {
            log.debug("Skipping unresolved reference '{}' in {}", reference.rawText(), property);
            return;
        }
        String targetId = accepted.get(target.get());
        if (targetId == null) {
            log.debug("Reference '{}' targets a node without diagram representation", reference.rawText());
            return;
        }

        String qualifiedProperty = index >= 0 ? property + "[" + index + "]" : property;
        String edgeId = sourceId + "_" + qualifiedProperty + "_" + targetId;
        String edgeType = descriptor.edgeTypeForProperty(property).orElse(ElementTypes.EDGE_REFERENCE);
        if (addEdge(edges, edgeIds, new DiagramEdge(edgeId, edgeType, EdgeKind.REFERENCE, sourceId, targetId,
                null, null, metadata.routingPoints(edgeId), null, property))
            && reference.hasSpan()) {
            sourceRanges.put(edgeId, new SourceRange(reference.offset(), reference.length()));
        }
    }

    private static boolean addEdge(List<DiagramEdge> edges, Set<String> edgeIds, DiagramEdge edge) {
        if (!edgeIds.add(edge.id())) {
            return false;
        }
        edges.add(edge);
        return true;
    }

    // ==================== Embedded layout ====================

    private static Optional<Point> embeddedPoint(Object value) {
        Double x = number(value, "x");
        Double y = number(value, "y");
        return x != null && y != null ? Optional.of(new Point(x, y)) : Optional.empty();
    }

    private static Optional<Dimension> embeddedDimension(Object value) {
        Double width = number(value, "width");
        Double height = number(value, "height");
        return width != null && height != null && width > 0 && height > 0
            ? Optional.of(new Dimension(width, height))
            : Optional.empty();
    }

    private static Double number(Object container, String key) {
        Object value = null;
        if (container instanceof Map<?, ?> map) {
            value = map.get(key);
        } else if (container instanceof AstNode node) {
            value = node.field(key);
        }
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private record Candidate(AstNode node, String id, String diagramType, NodeMapping mapping,
                             Dimension size, Point position) {
    }
}
