package com.modelsync.core.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.modelsync.core.model.TextEdit;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of executing an operation.
 *
 * <p>A failed result never comes with a diagram mutation. A successful one carries the
 * text edits that make the source match the diagram and the state needed to undo the
 * in-memory mutation.
 *
 * @param kind operation kind
 * @param success whether the operation was applied
 * @param affectedIds element IDs created, changed or removed
 * @param textEdits source edits to apply
 * @param error failure reason, null on success
 * @param undoState handler-specific undo state, null on failure
 */
public record OperationResult(
    String kind,
    boolean success,
    List<String> affectedIds,
    List<TextEdit> textEdits,
    String error,
    @JsonIgnore UndoState undoState
) {
    public OperationResult {
        Objects.requireNonNull(kind, "kind must not be null");
        affectedIds = affectedIds != null ? List.copyOf(affectedIds) : List.of();
        textEdits = textEdits != null ? List.copyOf(textEdits) : List.of();
    }

    public static OperationResult succeeded(String kind, List<String> affectedIds, List<TextEdit> textEdits,
                                            UndoState undoState) {
        return new OperationResult(kind, true, affectedIds, textEdits, null, undoState);
    }

    public static OperationResult failed(String kind, String error) {
        return new OperationResult(kind, false, List.of(), List.of(), error, null);
    }

    /**
     * Marker for the state a handler keeps to undo its mutation.
     */
    public interface UndoState {
    }
}
