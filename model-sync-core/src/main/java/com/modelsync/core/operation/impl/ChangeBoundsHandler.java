package com.modelsync.core.operation.impl;

import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramMetadata;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;
import com.modelsync.core.operation.AbstractOperationHandler;
import com.modelsync.core.operation.ChangeBoundsOperation;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.rules.PortGeometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves and resizes nodes. Only diagram metadata changes; the source text is untouched.
 *
 * <p>Sizes are clamped to {@value #MIN_WIDTH} x {@value #MIN_HEIGHT}.
 */
public class ChangeBoundsHandler extends AbstractOperationHandler<ChangeBoundsOperation, ChangeBoundsHandler.PreviousBounds> {

    public static final double MIN_WIDTH = 50;
    public static final double MIN_HEIGHT = 30;

    private final PortGeometry portGeometry;

    public ChangeBoundsHandler(PortGeometry portGeometry) {
        super(PreviousBounds.class);
        this.portGeometry = Objects.requireNonNull(portGeometry, "portGeometry must not be null");
    }

    @Override
    public String getKind() {
        return Operation.CHANGE_BOUNDS;
    }

    @Override
    public Class<ChangeBoundsOperation> getOperationType() {
        return ChangeBoundsOperation.class;
    }

    @Override
    public Optional<String> validate(DiagramContext context, ChangeBoundsOperation operation) {
        if (operation.changes().isEmpty()) {
            return Optional.of("No bounds changes");
        }
        for (ChangeBoundsOperation.BoundsChange change : operation.changes()) {
            if (context.snapshot().findNode(change.elementId()).isEmpty()) {
                return Optional.of("Node not found: " + change.elementId());
            }
            if (change.newPosition() == null && change.newSize() == null) {
                return Optional.of("No new bounds for " + change.elementId());
            }
        }
        return Optional.empty();
    }

    @Override
    protected OperationResult apply(DiagramContext context, ChangeBoundsOperation operation) {
        DiagramSnapshot snapshot = context.snapshot();
        DiagramMetadata metadata = context.metadata();
        List<Previous> previous = new ArrayList<>();
        List<String> affected = new ArrayList<>();

        for (ChangeBoundsOperation.BoundsChange change : operation.changes()) {
            DiagramNode node = snapshot.findNode(change.elementId()).orElseThrow();
            previous.add(new Previous(node, metadata.position(node.id()).orElse(null), metadata.size(node.id()).orElse(null)));

            DiagramNode updated = node;
            if (change.newPosition() != null) {
                updated = updated.withPosition(change.newPosition());
                metadata.setPosition(node.id(), change.newPosition());
            }
            if (change.newSize() != null) {
                Dimension size = clamp(change.newSize());
                updated = updated.withSize(size).withPorts(portGeometry.resize(node.ports(), size));
                metadata.setSize(node.id(), size);
            }
            snapshot.replaceNode(updated);
            affected.add(node.id());
        }
        snapshot.incrementRevision();
        return OperationResult.succeeded(getKind(), affected, List.of(), new PreviousBounds(previous));
    }

    @Override
    protected void revert(DiagramContext context, PreviousBounds undoState) {
        DiagramMetadata metadata = context.metadata();
        List<Previous> entries = undoState.nodes();
        for (int i = entries.size() - 1; i >= 0; i--) {
            Previous entry = entries.get(i);
            String id = entry.node().id();
            context.snapshot().replaceNode(entry.node());
            DiagramMetadata.ElementMetadata current = metadata.remove(id);
            metadata.restore(new DiagramMetadata.ElementMetadata(id, entry.position(), entry.size(),
                current.routingPoints(), current.collapsed(), current.sourceRange()));
        }
    }

    static Dimension clamp(Dimension size) {
        return new Dimension(Math.max(MIN_WIDTH, size.width()), Math.max(MIN_HEIGHT, size.height()));
    }

    /**
     * Undo state: nodes and stored bounds before the change.
     *
     * @param nodes previous state per node
     */
    public record PreviousBounds(List<Previous> nodes) implements OperationResult.UndoState {

        public PreviousBounds {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * Previous state of one node.
     *
     * @param node node before the change
     * @param position stored position before the change, may be null
     * @param size stored size before the change, may be null
     */
    public record Previous(DiagramNode node, Point position, Dimension size) {
    }
}
