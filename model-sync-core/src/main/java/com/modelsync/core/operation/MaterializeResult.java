package com.modelsync.core.operation;

import com.modelsync.core.model.TextEdit;

import java.util.List;

/**
 * Text edits produced by a {@link TextMaterializer}.
 *
 * @param success whether the edits could be produced
 * @param edits edits to apply, empty on failure
 * @param error failure reason, null on success
 */
public record MaterializeResult(boolean success, List<TextEdit> edits, String error) {

    public MaterializeResult {
        edits = edits != null ? List.copyOf(edits) : List.of();
    }

    public static MaterializeResult of(List<TextEdit> edits) {
        return new MaterializeResult(true, edits, null);
    }

    public static MaterializeResult noEdits() {
        return new MaterializeResult(true, List.of(), null);
    }

    public static MaterializeResult failed(String error) {
        return new MaterializeResult(false, List.of(), error);
    }
}
