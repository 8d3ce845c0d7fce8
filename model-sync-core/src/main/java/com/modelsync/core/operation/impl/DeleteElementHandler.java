package com.modelsync.core.operation.impl;

import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramMetadata;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.operation.AbstractOperationHandler;
import com.modelsync.core.operation.DeleteElementOperation;
import com.modelsync.core.operation.MaterializeResult;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.operation.TextMaterializer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Deletes nodes and edges together with their metadata.
 *
 * <p>Deleting a node also deletes the nodes it contains and every edge touching a deleted
 * node.
 */
public class DeleteElementHandler extends AbstractOperationHandler<DeleteElementOperation, DeleteElementHandler.Deleted> {

    private final TextMaterializer materializer;

    public DeleteElementHandler(TextMaterializer materializer) {
        super(Deleted.class);
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
    }

    @Override
    public String getKind() {
        return Operation.DELETE_ELEMENT;
    }

    @Override
    public Class<DeleteElementOperation> getOperationType() {
        return DeleteElementOperation.class;
    }

    @Override
    public Optional<String> validate(DiagramContext context, DeleteElementOperation operation) {
        if (operation.elementIds().isEmpty()) {
            return Optional.of("No elements to delete");
        }
        for (String id : operation.elementIds()) {
            if (!context.snapshot().containsElement(id)) {
                return Optional.of("Element not found: " + id);
            }
        }
        return Optional.empty();
    }

    @Override
    protected OperationResult apply(DiagramContext context, DeleteElementOperation operation) {
        DiagramSnapshot snapshot = context.snapshot();
        Set<String> nodeIds = collectNodes(snapshot, operation.elementIds());
        Set<String> edgeIds = new LinkedHashSet<>();
        for (String id : operation.elementIds()) {
            if (snapshot.findEdge(id).isPresent()) {
                edgeIds.add(id);
            }
        }
        for (DiagramEdge edge : snapshot.edges()) {
            if (nodeIds.contains(edge.sourceId()) || nodeIds.contains(edge.targetId())) {
                edgeIds.add(edge.id());
            }
        }

        List<String> affected = new ArrayList<>(nodeIds);
        affected.addAll(edgeIds);
        MaterializeResult text = materializer.deleteElements(context, affected);
        if (!text.success()) {
            return failed("Cannot materialize deletion: " + text.error());
        }

        DiagramMetadata metadata = context.metadata();
        List<DiagramSnapshot.Removed<DiagramEdge>> removedEdges = new ArrayList<>();
        List<DiagramSnapshot.Removed<DiagramNode>> removedNodes = new ArrayList<>();
        List<DiagramMetadata.ElementMetadata> removedMetadata = new ArrayList<>();
        for (String edgeId : edgeIds) {
            snapshot.removeEdge(edgeId).ifPresent(removedEdges::add);
            removedMetadata.add(metadata.remove(edgeId));
        }
        for (String nodeId : nodeIds) {
            snapshot.removeNode(nodeId).ifPresent(removedNodes::add);
            removedMetadata.add(metadata.remove(nodeId));
            context.registry().unregisterPending(nodeId);
        }
        snapshot.incrementRevision();

        return OperationResult.succeeded(getKind(), affected, text.edits(),
            new Deleted(removedNodes, removedEdges, removedMetadata));
    }

    @Override
    protected void revert(DiagramContext context, Deleted undoState) {
        DiagramSnapshot snapshot = context.snapshot();
        List<DiagramSnapshot.Removed<DiagramNode>> nodes = new ArrayList<>(undoState.nodes());
        for (int i = nodes.size() - 1; i >= 0; i--) {
            snapshot.restoreNode(nodes.get(i));
        }
        List<DiagramSnapshot.Removed<DiagramEdge>> edges = new ArrayList<>(undoState.edges());
        for (int i = edges.size() - 1; i >= 0; i--) {
            snapshot.restoreEdge(edges.get(i));
        }
        undoState.metadata().forEach(context.metadata()::restore);
    }

    private static Set<String> collectNodes(DiagramSnapshot snapshot, List<String> requested) {
        Set<String> nodeIds = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String id : requested) {
            if (snapshot.findNode(id).isPresent()) {
                queue.add(id);
            }
        }
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!nodeIds.add(id)) {
                continue;
            }
            for (DiagramEdge edge : snapshot.edges()) {
                if (edge.kind() == EdgeKind.CONTAINMENT && edge.sourceId().equals(id)) {
                    queue.add(edge.targetId());
                }
            }
        }
        return nodeIds;
    }

    /**
     * Undo state: everything removed, in removal order.
     *
     * @param nodes removed nodes
     * @param edges removed edges
     * @param metadata removed metadata entries
     */
    public record Deleted(
        List<DiagramSnapshot.Removed<DiagramNode>> nodes,
        List<DiagramSnapshot.Removed<DiagramEdge>> edges,
        List<DiagramMetadata.ElementMetadata> metadata
    ) implements OperationResult.UndoState {

        public Deleted {
            nodes = List.copyOf(nodes);
            edges = List.copyOf(edges);
            metadata = List.copyOf(metadata);
        }
    }
}
