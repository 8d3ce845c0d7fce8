package com.modelsync.core.operation.impl;

import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.DiagramPort;
import com.modelsync.core.rules.ConnectionEndpoint;

import java.util.Optional;

/**
 * Resolves port references given by the client, which may be either descriptor port IDs
 * or port element IDs.
 */
final class EndpointResolver {

    private EndpointResolver() {
    }

    static Optional<DiagramPort> findPort(DiagramNode node, String portRef) {
        return node.ports().stream()
            .filter(port -> port.id().equals(portRef) || port.portId().equals(portRef))
            .findFirst();
    }

    /**
     * Builds the rule endpoint for a node and optional port.
     *
     * @return endpoint, empty if the port does not exist on the node
     */
    static Optional<ConnectionEndpoint> endpoint(DiagramNode node, String portRef) {
        if (portRef == null) {
            return Optional.of(ConnectionEndpoint.of(node.id(), node.type()));
        }
        return findPort(node, portRef)
            .map(port -> new ConnectionEndpoint(node.id(), node.type(), port.portId()));
    }

    static String portElementId(DiagramNode node, String portRef) {
        return portRef == null ? null : findPort(node, portRef).map(DiagramPort::id).orElse(null);
    }
}
