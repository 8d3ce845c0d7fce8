package com.modelsync.core.rules;

import java.util.Objects;

/**
 * One side of a proposed connection.
 *
 * @param elementId node element ID
 * @param nodeType diagram type of the node
 * @param portId descriptor port ID, null when connecting to the node itself
 */
public record ConnectionEndpoint(String elementId, String nodeType, String portId) {

    public ConnectionEndpoint {
        Objects.requireNonNull(elementId, "elementId must not be null");
        Objects.requireNonNull(nodeType, "nodeType must not be null");
    }

    public static ConnectionEndpoint of(String elementId, String nodeType) {
        return new ConnectionEndpoint(elementId, nodeType, null);
    }
}
