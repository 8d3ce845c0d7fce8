package com.modelsync.core.operation;

/**
 * A diagram edit requested by the client.
 *
 * <p>Operations are dispatched to an {@link OperationHandler} by {@link #kind()}.
 */
public interface Operation {

    String CREATE_NODE = "createNode";
    String CREATE_EDGE = "createEdge";
    String RECONNECT_EDGE = "reconnectEdge";
    String DELETE_ELEMENT = "deleteElement";
    String CHANGE_BOUNDS = "changeBounds";

    /**
     * Returns the operation kind used for handler lookup.
     *
     * @return operation kind
     */
    String kind();
}
