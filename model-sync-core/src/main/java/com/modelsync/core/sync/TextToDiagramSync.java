package com.modelsync.core.sync;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.diagram.DiagramSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps diagram models in step with their text documents.
 *
 * <p>Every change notification bumps the document's version and restarts its debounce
 * timer. When the timer fires the latest AST is converted on the document's queue and the
 * result is published to {@link ModelChangeListener}s. A conversion whose version was
 * superseded while it ran is discarded. Closing a document publishes a removal event.
 */
public class TextToDiagramSync implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TextToDiagramSync.class);

    /**
     * Converts the AST of a document to a diagram snapshot.
     */
    @FunctionalInterface
    public interface ModelConverter {
        DiagramSnapshot convert(String uri, AstNode root);
    }

    private final ModelConverter converter;
    private final DocumentScheduler scheduler;
    private final long debounceMs;

    private final Map<String, TrackedDocument> documents = new ConcurrentHashMap<>();
    private final List<ModelChangeListener> listeners = new CopyOnWriteArrayList<>();

    public TextToDiagramSync(ModelConverter converter, DocumentScheduler scheduler, long debounceMs) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must not be negative: " + debounceMs);
        }
        this.debounceMs = debounceMs;
    }

    public void addListener(ModelChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(ModelChangeListener listener) {
        listeners.remove(listener);
    }

    // ==================== Document lifecycle ====================

    /**
     * Starts tracking a document and converts it right away.
     */
    public void onDocumentOpened(String uri, AstNode root) {
        Objects.requireNonNull(uri, "uri must not be null");
        TrackedDocument document = new TrackedDocument(uri, root);
        TrackedDocument replaced = documents.put(uri, document);
        if (replaced != null) {
            replaced.cancelTimer();
        }
        long version = document.version.incrementAndGet();
        log.debug("Tracking {}", uri);
        scheduler.execute(uri, () -> sync(document, version, false));
    }

    /**
     * Records a new AST for a document and restarts its debounce timer. Untracked
     * documents start being tracked.
     */
    public void onDocumentChanged(String uri, AstNode root) {
        Objects.requireNonNull(uri, "uri must not be null");
        TrackedDocument document = documents.get(uri);
        if (document == null) {
            onDocumentOpened(uri, root);
            return;
        }

        synchronized (document) {
            document.root = root;
            long version = document.version.incrementAndGet();
            document.state = SyncState.TRACKED_UNSYNCED;
            document.cancelTimer();
            if (debounceMs == 0) {
                scheduler.execute(uri, () -> sync(document, version, false));
            } else {
                document.timer = scheduler.schedule(uri, () -> sync(document, version, false), debounceMs);
            }
        }
    }

    /**
     * Stops tracking a document and publishes a removal event.
     */
    public void onDocumentClosed(String uri) {
        TrackedDocument document = documents.remove(uri);
        if (document == null) {
            return;
        }
        document.cancelTimer();
        long version = document.version.get();
        log.debug("Stopped tracking {}", uri);
        scheduler.execute(uri, () -> publish(ModelChangeEvent.removed(uri, version)));
    }

    /**
     * Converts a document now, skipping the debounce.
     *
     * @return false if the document is not tracked
     */
    public boolean syncNow(String uri) {
        TrackedDocument document = documents.get(uri);
        if (document == null) {
            return false;
        }
        long version;
        synchronized (document) {
            document.cancelTimer();
            version = document.version.get();
        }
        scheduler.execute(uri, () -> sync(document, version, true));
        return true;
    }

    public SyncState state(String uri) {
        TrackedDocument document = documents.get(uri);
        return document != null ? document.state : SyncState.UNTRACKED;
    }

    /**
     * Returns the local version of a tracked document, or 0.
     */
    public long version(String uri) {
        TrackedDocument document = documents.get(uri);
        return document != null ? document.version.get() : 0;
    }

    public boolean isTracked(String uri) {
        return documents.containsKey(uri);
    }

    @Override
    public void close() {
        for (TrackedDocument document : documents.values()) {
            document.cancelTimer();
        }
        documents.clear();
    }

    // ==================== Conversion ====================

    private void sync(TrackedDocument document, long scheduledVersion, boolean force) {
        if (documents.get(document.uri) != document) {
            return;
        }
        long version = document.version.get();
        if (version != scheduledVersion) {
            log.debug("Skipping sync of {} version {}: superseded by {}", document.uri, scheduledVersion, version);
            return;
        }
        if (!force && document.syncedVersion == version) {
            return;
        }

        document.state = SyncState.SYNCING;
        DiagramSnapshot snapshot;
        try {
            snapshot = converter.convert(document.uri, document.root);
        } catch (RuntimeException e) {
            log.error("Conversion of {} version {} failed", document.uri, version, e);
            document.state = SyncState.TRACKED_UNSYNCED;
            notifyFailed(document.uri, e);
            return;
        }

        if (documents.get(document.uri) != document || document.version.get() != version) {
            log.debug("Discarding stale conversion of {} version {}", document.uri, version);
            if (document.state == SyncState.SYNCING) {
                document.state = SyncState.TRACKED_UNSYNCED;
            }
            return;
        }

        List<ElementChange> changes = SnapshotDiff.between(document.published, snapshot);
        document.published = snapshot;
        document.syncedVersion = version;
        document.state = document.version.get() == version ? SyncState.TRACKED_SYNCED : SyncState.TRACKED_UNSYNCED;
        log.debug("Synced {} version {} ({} changes)", document.uri, version, changes.size());
        publish(ModelChangeEvent.updated(document.uri, version, changes, snapshot));
    }

    private void publish(ModelChangeEvent event) {
        for (ModelChangeListener listener : listeners) {
            try {
                listener.onModelChanged(event);
            } catch (RuntimeException e) {
                log.error("Model change listener failed for {}", event.uri(), e);
            }
        }
    }

    private void notifyFailed(String uri, Exception error) {
        for (ModelChangeListener listener : listeners) {
            try {
                listener.onSyncFailed(uri, error);
            } catch (RuntimeException e) {
                log.error("Model change listener failed for {}", uri, e);
            }
        }
    }

    private static final class TrackedDocument {
        private final String uri;
        private final AtomicLong version = new AtomicLong();
        private volatile AstNode root;
        private volatile SyncState state = SyncState.TRACKED_UNSYNCED;
        private volatile long syncedVersion;
        private volatile DiagramSnapshot published;
        private DocumentScheduler.Cancellable timer;

        private TrackedDocument(String uri, AstNode root) {
            this.uri = uri;
            this.root = root;
        }

        private synchronized void cancelTimer() {
            if (timer != null) {
                timer.cancel();
                timer = null;
            }
        }
    }
}
