package com.modelsync.core.sync;

/**
 * Synchronization state of a document in {@link TextToDiagramSync}.
 */
public enum SyncState {
    /** Not open */
    UNTRACKED,
    /** Open, with changes not yet converted */
    TRACKED_UNSYNCED,
    /** Open, diagram matches the latest version */
    TRACKED_SYNCED,
    /** Conversion in progress */
    SYNCING
}
