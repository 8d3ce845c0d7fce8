package com.modelsync.core.operation;

import com.modelsync.core.diagram.DiagramContext;

import java.util.Optional;

/**
 * Applies one kind of {@link Operation} to a diagram context.
 *
 * <p>Handlers act synchronously on the context's current snapshot. They never write the
 * source text themselves; they return the text edits to apply. {@link #undo} reverts the
 * in-memory diagram mutation only, text-level undo belongs to the host editor.
 *
 * @param <O> operation type
 */
public interface OperationHandler<O extends Operation> {

    /**
     * Operation kind this handler serves, see the constants on {@link Operation}.
     *
     * @return operation kind
     */
    String getKind();

    /**
     * Operation class this handler accepts.
     *
     * @return operation class
     */
    Class<O> getOperationType();

    /**
     * Checks whether the operation can be applied.
     *
     * @param context document context
     * @param operation operation to check
     * @return reason the operation cannot be applied, empty if it can
     */
    Optional<String> validate(DiagramContext context, O operation);

    default boolean canExecute(DiagramContext context, O operation) {
        return validate(context, operation).isEmpty();
    }

    /**
     * Applies the operation. Fails without mutating anything when {@link #validate} objects
     * or the materializer cannot produce text edits.
     *
     * @param context document context
     * @param operation operation to apply
     * @return result with text edits and undo state
     */
    OperationResult execute(DiagramContext context, O operation);

    /**
     * Reverts the diagram mutation of a successful result.
     *
     * @param context document context
     * @param result result returned by {@link #execute}
     * @return true if the mutation was reverted
     */
    boolean undo(DiagramContext context, OperationResult result);
}
