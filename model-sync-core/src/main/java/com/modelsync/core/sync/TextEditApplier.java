package com.modelsync.core.sync;

import com.modelsync.core.model.TextEdit;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Applies text edits to a document, usually through the host editor.
 */
@FunctionalInterface
public interface TextEditApplier {

    /**
     * Applies non-overlapping edits, sorted by descending position, as one change.
     *
     * @param uri document URI
     * @param edits edits to apply
     * @return future completing with true if the document accepted the edits
     */
    CompletableFuture<Boolean> applyEdits(String uri, List<TextEdit> edits);
}
