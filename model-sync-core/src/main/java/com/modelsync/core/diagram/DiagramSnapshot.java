package com.modelsync.core.diagram;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.DiagramPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The graphical model of one document at one revision.
 *
 * <p>A snapshot is produced by the converter and then edited in place by operation
 * handlers until the next conversion supersedes it. Every mutation made through a handler
 * increments the revision. Snapshots are flat: nested AST structure is expressed by
 * containment edges.
 */
@JsonPropertyOrder({"id", "revision", "nodes", "edges"})
public class DiagramSnapshot {

    private final String id;
    private long revision;
    private final List<DiagramNode> nodes;
    private final List<DiagramEdge> edges;

    public DiagramSnapshot(String id, long revision, List<DiagramNode> nodes, List<DiagramEdge> edges) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.revision = revision;
        this.nodes = new ArrayList<>(nodes != null ? nodes : List.of());
        this.edges = new ArrayList<>(edges != null ? edges : List.of());
    }

    public static DiagramSnapshot empty(String id) {
        return new DiagramSnapshot(id, 0, List.of(), List.of());
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("revision")
    public long revision() {
        return revision;
    }

    @JsonProperty("nodes")
    public List<DiagramNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @JsonProperty("edges")
    public List<DiagramEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Increments and returns the revision.
     */
    public long incrementRevision() {
        return ++revision;
    }

    public Optional<DiagramNode> findNode(String nodeId) {
        return nodes.stream().filter(node -> node.id().equals(nodeId)).findFirst();
    }

    public Optional<DiagramEdge> findEdge(String edgeId) {
        return edges.stream().filter(edge -> edge.id().equals(edgeId)).findFirst();
    }

    public boolean containsElement(String elementId) {
        return findNode(elementId).isPresent() || findEdge(elementId).isPresent();
    }

    public void addNode(DiagramNode node) {
        if (containsElement(node.id())) {
            throw new IllegalArgumentException("Element already exists: " + node.id());
        }
        nodes.add(node);
    }

    /**
     * Replaces the node with the same ID.
     *
     * @return false if no such node exists
     */
    public boolean replaceNode(DiagramNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(node.id())) {
                nodes.set(i, node);
                return true;
            }
        }
        return false;
    }

    public Optional<Removed<DiagramNode>> removeNode(String nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(nodeId)) {
                return Optional.of(new Removed<>(nodes.remove(i), i));
            }
        }
        return Optional.empty();
    }

    public void restoreNode(Removed<DiagramNode> removed) {
        nodes.add(Math.min(removed.index(), nodes.size()), removed.element());
    }

    public void addEdge(DiagramEdge edge) {
        if (containsElement(edge.id())) {
            throw new IllegalArgumentException("Element already exists: " + edge.id());
        }
        edges.add(edge);
    }

    public boolean replaceEdge(DiagramEdge edge) {
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).id().equals(edge.id())) {
                edges.set(i, edge);
                return true;
            }
        }
        return false;
    }

    public Optional<Removed<DiagramEdge>> removeEdge(String edgeId) {
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).id().equals(edgeId)) {
                return Optional.of(new Removed<>(edges.remove(i), i));
            }
        }
        return Optional.empty();
    }

    public void restoreEdge(Removed<DiagramEdge> removed) {
        edges.add(Math.min(removed.index(), edges.size()), removed.element());
    }

    public List<DiagramEdge> edgesConnectedTo(String nodeId) {
        return edges.stream().filter(edge -> edge.connects(nodeId)).toList();
    }

    /**
     * Finds the node owning a port, by port element ID.
     */
    public Optional<DiagramPort> findPort(String portElementId) {
        return nodes.stream()
            .flatMap(node -> node.ports().stream())
            .filter(port -> port.id().equals(portElementId))
            .findFirst();
    }

    /**
     * IDs of all nodes, ports and edges.
     */
    public Set<String> elementIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (DiagramNode node : nodes) {
            ids.add(node.id());
            node.ports().forEach(port -> ids.add(port.id()));
        }
        edges.forEach(edge -> ids.add(edge.id()));
        return ids;
    }

    public DiagramSnapshot copy() {
        return new DiagramSnapshot(id, revision, nodes, edges);
    }

    @Override
    public String toString() {
        return "DiagramSnapshot[" + id + " r" + revision + ", " + nodes.size() + " nodes, " + edges.size() + " edges]";
    }

    /**
     * A removed element together with its former index, for undo.
     *
     * @param element removed element
     * @param index former position in the snapshot
     * @param <T> element type
     */
    public record Removed<T>(T element, int index) {
    }
}
