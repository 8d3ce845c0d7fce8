package com.modelsync.core.operation.impl;

import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.operation.AbstractOperationHandler;
import com.modelsync.core.operation.CreateEdgeOperation;
import com.modelsync.core.operation.MaterializeResult;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.operation.TextMaterializer;
import com.modelsync.core.rules.ConnectionCheck;
import com.modelsync.core.rules.ConnectionEndpoint;
import com.modelsync.core.rules.ConnectionRuleValidator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates an edge between two nodes after checking the connection rules.
 *
 * <p>Rejected when the edge type is unsupported, an endpoint or port does not exist, no
 * rule allows the connection, or an edge of the same type already joins the same
 * endpoints and the descriptor does not allow duplicates.
 */
public class CreateEdgeHandler extends AbstractOperationHandler<CreateEdgeOperation, CreateEdgeHandler.CreatedEdge> {

    private final TextMaterializer materializer;

    public CreateEdgeHandler(TextMaterializer materializer) {
        super(CreatedEdge.class);
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
    }

    @Override
    public String getKind() {
        return Operation.CREATE_EDGE;
    }

    @Override
    public Class<CreateEdgeOperation> getOperationType() {
        return CreateEdgeOperation.class;
    }

    @Override
    public Optional<String> validate(DiagramContext context, CreateEdgeOperation operation) {
        LanguageDescriptor descriptor = context.descriptor();
        DiagramSnapshot snapshot = context.snapshot();
        String type = operation.elementType();

        if (!descriptor.supportedEdgeTypes().contains(type)) {
            return Optional.of("Unsupported edge type: " + type);
        }
        Optional<DiagramNode> source = snapshot.findNode(operation.sourceId());
        if (source.isEmpty()) {
            return Optional.of("Source element not found: " + operation.sourceId());
        }
        Optional<DiagramNode> target = snapshot.findNode(operation.targetId());
        if (target.isEmpty()) {
            return Optional.of("Target element not found: " + operation.targetId());
        }
        Optional<ConnectionEndpoint> sourceEndpoint = EndpointResolver.endpoint(source.get(), operation.sourcePortId());
        if (sourceEndpoint.isEmpty()) {
            return Optional.of("Unknown source port: " + operation.sourcePortId());
        }
        Optional<ConnectionEndpoint> targetEndpoint = EndpointResolver.endpoint(target.get(), operation.targetPortId());
        if (targetEndpoint.isEmpty()) {
            return Optional.of("Unknown target port: " + operation.targetPortId());
        }

        ConnectionCheck check = ConnectionRuleValidator.forDescriptor(descriptor)
            .check(type, sourceEndpoint.get(), targetEndpoint.get());
        if (!check.valid()) {
            return Optional.of(check.reason());
        }

        if (!descriptor.allowsDuplicates(type) && snapshot.edges().stream().anyMatch(edge ->
                edge.type().equals(type)
                    && edge.sourceId().equals(operation.sourceId())
                    && edge.targetId().equals(operation.targetId()))) {
            return Optional.of("Duplicate " + type + " edge between " + operation.sourceId() + " and " + operation.targetId());
        }
        return Optional.empty();
    }

    @Override
    protected OperationResult apply(DiagramContext context, CreateEdgeOperation operation) {
        LanguageDescriptor descriptor = context.descriptor();
        String type = operation.elementType();
        String property = descriptor.propertyForEdgeType(type);

        MaterializeResult text = materializer.createEdge(context, type, property,
            operation.sourceId(), operation.targetId(), operation.args());
        if (!text.success()) {
            return failed("Cannot materialize edge: " + text.error());
        }

        DiagramSnapshot snapshot = context.snapshot();
        DiagramNode source = snapshot.findNode(operation.sourceId()).orElseThrow();
        DiagramNode target = snapshot.findNode(operation.targetId()).orElseThrow();
        String id = UUID.randomUUID().toString();
        String label = operation.args().get(CreateEdgeOperation.LABEL_ARG) instanceof String value ? value : null;

        DiagramEdge edge = new DiagramEdge(id, type, EdgeKind.REFERENCE, source.id(), target.id(),
            EndpointResolver.portElementId(source, operation.sourcePortId()),
            EndpointResolver.portElementId(target, operation.targetPortId()),
            operation.routingPoints(), label, property);
        snapshot.addEdge(edge);
        context.metadata().setRoutingPoints(id, operation.routingPoints());
        snapshot.incrementRevision();

        return OperationResult.succeeded(getKind(), List.of(id), text.edits(), new CreatedEdge(id));
    }

    @Override
    protected void revert(DiagramContext context, CreatedEdge undoState) {
        context.snapshot().removeEdge(undoState.edgeId());
        context.metadata().remove(undoState.edgeId());
    }

    /**
     * Lists the nodes an edge of the given type may connect to from a source node, ignoring ports.
     *
     * @param context document context
     * @param sourceId source node element ID
     * @param edgeType edge type
     * @return valid target node IDs
     */
    public List<String> validTargets(DiagramContext context, String sourceId, String edgeType) {
        Optional<DiagramNode> source = context.snapshot().findNode(sourceId);
        if (source.isEmpty()) {
            return List.of();
        }
        ConnectionRuleValidator validator = ConnectionRuleValidator.forDescriptor(context.descriptor());
        ConnectionEndpoint sourceEndpoint = ConnectionEndpoint.of(source.get().id(), source.get().type());
        return context.snapshot().nodes().stream()
            .filter(node -> validator.isValid(edgeType, sourceEndpoint, ConnectionEndpoint.of(node.id(), node.type())))
            .map(DiagramNode::id)
            .toList();
    }

    /**
     * Undo state: the created edge.
     *
     * @param edgeId created edge
     */
    public record CreatedEdge(String edgeId) implements OperationResult.UndoState {
    }
}
