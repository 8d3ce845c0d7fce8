package com.modelsync.core.operation;

import com.modelsync.core.diagram.DiagramContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base class for operation handlers.
 *
 * <p>Implements {@link #execute} as validate-then-apply so subclasses only implement
 * {@link #validate} and {@link #apply}, and provides the typed undo-state lookup.
 *
 * @param <O> operation type
 * @param <U> undo state type
 */
public abstract class AbstractOperationHandler<O extends Operation, U extends OperationResult.UndoState>
    implements OperationHandler<O> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final Class<U> undoStateType;

    protected AbstractOperationHandler(Class<U> undoStateType) {
        this.undoStateType = undoStateType;
    }

    @Override
    public final OperationResult execute(DiagramContext context, O operation) {
        Optional<String> problem = validate(context, operation);
        if (problem.isPresent()) {
            log.debug("Rejected {} on {}: {}", getKind(), context.uri(), problem.get());
            return OperationResult.failed(getKind(), problem.get());
        }
        OperationResult result = apply(context, operation);
        if (result.success()) {
            log.debug("Applied {} on {}: {} (revision {})", getKind(), context.uri(), result.affectedIds(),
                context.snapshot().revision());
        } else {
            log.warn("Failed {} on {}: {}", getKind(), context.uri(), result.error());
        }
        return result;
    }

    @Override
    public final boolean undo(DiagramContext context, OperationResult result) {
        if (!result.success() || !getKind().equals(result.kind()) || !undoStateType.isInstance(result.undoState())) {
            log.warn("Cannot undo {} result on {}", result.kind(), context.uri());
            return false;
        }
        revert(context, undoStateType.cast(result.undoState()));
        context.snapshot().incrementRevision();
        log.debug("Undid {} on {}", getKind(), context.uri());
        return true;
    }

    /**
     * Applies a validated operation.
     *
     * @param context document context
     * @param operation operation that passed {@link #validate}
     * @return result
     */
    protected abstract OperationResult apply(DiagramContext context, O operation);

    /**
     * Reverts the mutation described by the undo state. The revision is bumped by the caller.
     *
     * @param context document context
     * @param undoState state recorded by {@link #apply}
     */
    protected abstract void revert(DiagramContext context, U undoState);

    protected OperationResult failed(String error) {
        return OperationResult.failed(getKind(), error);
    }
}
