package com.modelsync.core.operation;

import com.modelsync.core.diagram.DiagramContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatches operations to handlers by kind.
 */
public class OperationHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationHandlerRegistry.class);

    private final Map<String, OperationHandler<?>> handlers = new LinkedHashMap<>();

    public OperationHandlerRegistry register(OperationHandler<?> handler) {
        OperationHandler<?> previous = handlers.put(handler.getKind(), handler);
        if (previous != null) {
            log.debug("Replaced handler for {}: {} -> {}", handler.getKind(),
                previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<OperationHandler<?>> handlerFor(String kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public Set<String> kinds() {
        return handlers.keySet();
    }

    /**
     * Executes an operation with the handler registered for its kind.
     *
     * @param context document context
     * @param operation operation to execute
     * @return result, failed if no handler accepts the operation
     */
    public OperationResult execute(DiagramContext context, Operation operation) {
        OperationHandler<?> handler = handlers.get(operation.kind());
        if (handler == null) {
            log.warn("No handler for operation kind: {}", operation.kind());
            return OperationResult.failed(operation.kind(), "Unsupported operation: " + operation.kind());
        }
        return executeTyped(handler, context, operation);
    }

    /**
     * Undoes a successful result with the handler that produced it.
     *
     * @param context document context
     * @param result result to undo
     * @return true if undone
     */
    public boolean undo(DiagramContext context, OperationResult result) {
        OperationHandler<?> handler = handlers.get(result.kind());
        if (handler == null) {
            log.warn("No handler to undo operation kind: {}", result.kind());
            return false;
        }
        return handler.undo(context, result);
    }

    private static <O extends Operation> OperationResult executeTyped(OperationHandler<O> handler,
                                                                      DiagramContext context, Operation operation) {
        if (!handler.getOperationType().isInstance(operation)) {
            return OperationResult.failed(operation.kind(),
                "Handler for " + operation.kind() + " does not accept " + operation.getClass().getSimpleName());
        }
        return handler.execute(context, handler.getOperationType().cast(operation));
    }
}
