package com.modelsync.core.server.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.modelsync.core.model.TextEdit;

import java.util.List;

/**
 * Outcome of a property update.
 *
 * @param success whether text edits were produced
 * @param edits edits writing the new value
 * @param error failure reason, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyUpdateResult(boolean success, List<TextEdit> edits, String error) {

    public PropertyUpdateResult {
        edits = edits != null ? List.copyOf(edits) : List.of();
    }

    public static PropertyUpdateResult succeeded(List<TextEdit> edits) {
        return new PropertyUpdateResult(true, edits, null);
    }

    public static PropertyUpdateResult failed(String error) {
        return new PropertyUpdateResult(false, List.of(), error);
    }
}
