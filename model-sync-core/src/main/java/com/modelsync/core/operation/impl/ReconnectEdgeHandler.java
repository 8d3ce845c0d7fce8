package com.modelsync.core.operation.impl;

import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Point;
import com.modelsync.core.operation.AbstractOperationHandler;
import com.modelsync.core.operation.MaterializeResult;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.operation.ReconnectEdgeOperation;
import com.modelsync.core.operation.TextMaterializer;
import com.modelsync.core.rules.ConnectionCheck;
import com.modelsync.core.rules.ConnectionEndpoint;
import com.modelsync.core.rules.ConnectionRuleValidator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves the source and/or target of an edge.
 *
 * <p>The resulting connection must satisfy the connection rules. Stored routing points are
 * cleared because they describe the old route.
 */
public class ReconnectEdgeHandler extends AbstractOperationHandler<ReconnectEdgeOperation, ReconnectEdgeHandler.Reconnected> {

    private final TextMaterializer materializer;

    public ReconnectEdgeHandler(TextMaterializer materializer) {
        super(Reconnected.class);
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
    }

    @Override
    public String getKind() {
        return Operation.RECONNECT_EDGE;
    }

    @Override
    public Class<ReconnectEdgeOperation> getOperationType() {
        return ReconnectEdgeOperation.class;
    }

    @Override
    public Optional<String> validate(DiagramContext context, ReconnectEdgeOperation operation) {
        DiagramSnapshot snapshot = context.snapshot();
        Optional<DiagramEdge> edge = snapshot.findEdge(operation.edgeId());
        if (edge.isEmpty()) {
            return Optional.of("Edge not found: " + operation.edgeId());
        }
        if (operation.newSourceId() == null && operation.newTargetId() == null) {
            return Optional.of("Reconnect requires a new source or target");
        }

        String sourceId = operation.newSourceId() != null ? operation.newSourceId() : edge.get().sourceId();
        String targetId = operation.newTargetId() != null ? operation.newTargetId() : edge.get().targetId();
        Optional<DiagramNode> source = snapshot.findNode(sourceId);
        if (source.isEmpty()) {
            return Optional.of("Source element not found: " + sourceId);
        }
        Optional<DiagramNode> target = snapshot.findNode(targetId);
        if (target.isEmpty()) {
            return Optional.of("Target element not found: " + targetId);
        }

        Optional<ConnectionEndpoint> sourceEndpoint = EndpointResolver.endpoint(source.get(),
            operation.newSourceId() != null ? operation.newSourcePortId() : edge.get().sourcePortId());
        if (sourceEndpoint.isEmpty()) {
            return Optional.of("Unknown source port: " + operation.newSourcePortId());
        }
        Optional<ConnectionEndpoint> targetEndpoint = EndpointResolver.endpoint(target.get(),
            operation.newTargetId() != null ? operation.newTargetPortId() : edge.get().targetPortId());
        if (targetEndpoint.isEmpty()) {
            return Optional.of("Unknown target port: " + operation.newTargetPortId());
        }

        ConnectionCheck check = ConnectionRuleValidator.forDescriptor(context.descriptor())
            .check(edge.get().type(), sourceEndpoint.get(), targetEndpoint.get());
        return check.valid() ? Optional.empty() : Optional.of(check.reason());
    }

    @Override
    protected OperationResult apply(DiagramContext context, ReconnectEdgeOperation operation) {
        DiagramSnapshot snapshot = context.snapshot();
        DiagramEdge previous = snapshot.findEdge(operation.edgeId()).orElseThrow();

        String sourcePort = previous.sourcePortId();
        String targetPort = previous.targetPortId();
        if (operation.newSourceId() != null) {
            sourcePort = EndpointResolver.portElementId(snapshot.findNode(operation.newSourceId()).orElseThrow(),
                operation.newSourcePortId());
        }
        if (operation.newTargetId() != null) {
            targetPort = EndpointResolver.portElementId(snapshot.findNode(operation.newTargetId()).orElseThrow(),
                operation.newTargetPortId());
        }
        DiagramEdge updated = previous
            .withEndpoints(
                operation.newSourceId() != null ? operation.newSourceId() : previous.sourceId(), sourcePort,
                operation.newTargetId() != null ? operation.newTargetId() : previous.targetId(), targetPort)
            .withRoutingPoints(List.of());

        MaterializeResult text = materializer.reconnectEdge(context, previous, updated);
        if (!text.success()) {
            return failed("Cannot materialize reconnect: " + text.error());
        }

        List<Point> previousRoutingPoints = context.metadata().routingPoints(previous.id());
        snapshot.replaceEdge(updated);
        context.metadata().clearRoutingPoints(previous.id());
        snapshot.incrementRevision();

        return OperationResult.succeeded(getKind(), List.of(previous.id()), text.edits(),
            new Reconnected(previous, previousRoutingPoints));
    }

    @Override
    protected void revert(DiagramContext context, Reconnected undoState) {
        context.snapshot().replaceEdge(undoState.previous());
        context.metadata().setRoutingPoints(undoState.previous().id(), undoState.routingPoints());
    }

    /**
     * Undo state: the edge before reconnection and its stored routing points.
     *
     * @param previous previous edge
     * @param routingPoints previously stored routing points
     */
    public record Reconnected(DiagramEdge previous, List<Point> routingPoints) implements OperationResult.UndoState {
    }
}
