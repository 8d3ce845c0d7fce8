package com.modelsync.core.sync;

/**
 * Receives diagram model changes from {@link TextToDiagramSync}.
 */
@FunctionalInterface
public interface ModelChangeListener {

    void onModelChanged(ModelChangeEvent event);

    /**
     * Called when a conversion throws. The previously published model stays current.
     *
     * @param uri document URI
     * @param error conversion failure
     */
    default void onSyncFailed(String uri, Exception error) {
    }
}
