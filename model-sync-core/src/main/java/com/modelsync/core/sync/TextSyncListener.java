package com.modelsync.core.sync;

import com.modelsync.core.model.TextEdit;

import java.util.List;

/**
 * Receives the outcome of text edit batches from {@link DiagramToTextSync}.
 */
public interface TextSyncListener {

    default void onEditsApplied(EditsApplied event) {
    }

    default void onEditsFailed(EditsFailed event) {
    }

    default void onVersionConflict(VersionConflict event) {
    }

    /**
     * A batch was applied.
     *
     * @param uri document URI
     * @param operationKinds operations that contributed edits
     * @param edits merged edits as applied
     * @param timestamp epoch milliseconds
     */
    record EditsApplied(String uri, List<String> operationKinds, List<TextEdit> edits, long timestamp) {
    }

    /**
     * A batch was rejected or could not be applied.
     *
     * @param uri document URI
     * @param operationKinds operations that contributed edits
     * @param reason failure reason
     * @param timestamp epoch milliseconds
     */
    record EditsFailed(String uri, List<String> operationKinds, String reason, long timestamp) {
    }

    /**
     * Edits were computed against a different document version than the last known one.
     *
     * @param uri document URI
     * @param operationKind operation that produced the edits
     * @param expectedVersion version the edits were computed for
     * @param actualVersion last known document version
     * @param timestamp epoch milliseconds
     */
    record VersionConflict(String uri, String operationKind, long expectedVersion, long actualVersion, long timestamp) {
    }
}
