package com.modelsync.core.operation.impl;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.descriptor.ElementTypes;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.identity.Fingerprint;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.model.Point;
import com.modelsync.core.operation.AbstractOperationHandler;
import com.modelsync.core.operation.CreateNodeOperation;
import com.modelsync.core.operation.MaterializeResult;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.operation.TextMaterializer;
import com.modelsync.core.rules.PortGeometry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates a node on the diagram and asks the materializer for its source text.
 *
 * <p>The node gets a unique name: the requested name, or the AST type name, followed by
 * the first free numeric suffix if that name is taken. Names already used in the AST and
 * labels of nodes that exist only on the diagram so far both count as taken. The new
 * element ID is registered as pending so the reparsed node keeps it.
 */
public class CreateNodeHandler extends AbstractOperationHandler<CreateNodeOperation, CreateNodeHandler.CreatedNode> {

    /** Location used when the operation does not specify one */
    public static final Point DEFAULT_LOCATION = new Point(100, 100);

    private final TextMaterializer materializer;
    private final PortGeometry portGeometry;

    public CreateNodeHandler(TextMaterializer materializer, PortGeometry portGeometry) {
        super(CreatedNode.class);
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
        this.portGeometry = Objects.requireNonNull(portGeometry, "portGeometry must not be null");
    }

    @Override
    public String getKind() {
        return Operation.CREATE_NODE;
    }

    @Override
    public Class<CreateNodeOperation> getOperationType() {
        return CreateNodeOperation.class;
    }

    @Override
    public Optional<String> validate(DiagramContext context, CreateNodeOperation operation) {
        if (!context.descriptor().supportedNodeTypes().contains(operation.elementType())) {
            return Optional.of("Unsupported node type: " + operation.elementType());
        }
        if (operation.containerId() != null && context.snapshot().findNode(operation.containerId()).isEmpty()) {
            return Optional.of("Container not found: " + operation.containerId());
        }
        return Optional.empty();
    }

    @Override
    protected OperationResult apply(DiagramContext context, CreateNodeOperation operation) {
        LanguageDescriptor descriptor = context.descriptor();
        String type = operation.elementType();
        String astType = descriptor.astTypeFor(type).orElseGet(() -> ElementTypes.displayName(type));
        String name = uniqueName(baseName(operation, astType), existingNames(context));

        MaterializeResult text = materializer.createNode(context, astType, name, operation.containerId(), operation.args());
        if (!text.success()) {
            return failed("Cannot materialize node '" + name + "': " + text.error());
        }

        NodeMapping mapping = descriptor.mappingForDiagramType(type).orElseGet(() -> NodeMapping.of(type));
        Dimension size = descriptor.defaultSizeFor(type);
        Point location = operation.location() != null ? operation.location() : DEFAULT_LOCATION;
        String id = UUID.randomUUID().toString();

        DiagramNode node = new DiagramNode(id, type, name, location, size, mapping.shape(),
            mapping.cssClass() != null ? List.of(mapping.cssClass()) : List.of(),
            portGeometry.createPorts(id, size, mapping.ports()));

        DiagramSnapshot snapshot = context.snapshot();
        snapshot.addNode(node);
        String containmentEdgeId = null;
        if (operation.containerId() != null) {
            containmentEdgeId = operation.containerId() + "_contains_" + id;
            snapshot.addEdge(new DiagramEdge(containmentEdgeId, ElementTypes.EDGE_CONTAINS, EdgeKind.CONTAINMENT,
                operation.containerId(), id, null, null, List.of(), null, null));
        }
        context.metadata().setPosition(id, location);
        context.metadata().setSize(id, size);
        context.registry().registerPending(id, Fingerprint.expected(astType, containerPath(context, operation), name));
        snapshot.incrementRevision();

        return OperationResult.succeeded(getKind(), List.of(id), text.edits(), new CreatedNode(id, containmentEdgeId));
    }

    @Override
    protected void revert(DiagramContext context, CreatedNode undoState) {
        DiagramSnapshot snapshot = context.snapshot();
        if (undoState.containmentEdgeId() != null) {
            snapshot.removeEdge(undoState.containmentEdgeId());
        }
        snapshot.removeNode(undoState.nodeId());
        context.metadata().remove(undoState.nodeId());
        context.registry().unregisterPending(undoState.nodeId());
    }

    /**
     * Returns {@code base} if unused, otherwise {@code base1}, {@code base2}, ...
     *
     * @param base requested name
     * @param taken names in use
     * @return first free name
     */
    static String uniqueName(String base, Set<String> taken) {
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 1;
        while (taken.contains(base + suffix)) {
            suffix++;
        }
        return base + suffix;
    }

    private static String baseName(CreateNodeOperation operation, String astType) {
        if (operation.args().get(CreateNodeOperation.NAME_ARG) instanceof String requested && !requested.isBlank()) {
            return requested.trim();
        }
        return astType;
    }

    private static Set<String> existingNames(DiagramContext context) {
        Set<String> names = new HashSet<>();
        if (context.root() != null) {
            context.root().walk(node -> {
                if (node.hasName()) {
                    names.add(node.name());
                }
            });
        }
        context.snapshot().nodes().forEach(node -> {
            if (node.label() != null) {
                names.add(node.label());
            }
        });
        return names;
    }

    private static List<String> containerPath(DiagramContext context, CreateNodeOperation operation) {
        List<String> path = new ArrayList<>();
        Optional<AstNode> container = operation.containerId() != null
            ? context.astNodeFor(operation.containerId())
            : Optional.ofNullable(context.root());
        container.ifPresent(node -> {
            path.addAll(node.namedAncestorPath());
            if (node.hasName()) {
                path.add(node.name());
            }
        });
        return path;
    }

    /**
     * Undo state: the created node and its containment edge.
     *
     * @param nodeId created node
     * @param containmentEdgeId containment edge or null
     */
    public record CreatedNode(String nodeId, String containmentEdgeId) implements OperationResult.UndoState {
    }
}
