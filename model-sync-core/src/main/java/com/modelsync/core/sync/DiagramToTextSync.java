package com.modelsync.core.sync;

import com.modelsync.core.model.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Forwards text edits produced by diagram operations to the document.
 *
 * <p>Edits submitted for one document within the batch window are collected and applied
 * as a single change. Before applying, ranges are validated and overlapping or touching
 * edits are merged. Outcomes are reported to {@link TextSyncListener}s.
 *
 * <p>With a zero batch window every submission is applied on its own.
 */
public class DiagramToTextSync implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DiagramToTextSync.class);

    private final TextEditApplier applier;
    private final DocumentScheduler scheduler;
    private final long batchDebounceMs;
    private final boolean validateEdits;

    private final Map<String, PendingBatch> pending = new ConcurrentHashMap<>();
    private final Map<String, Long> documentVersions = new ConcurrentHashMap<>();
    private final List<TextSyncListener> listeners = new CopyOnWriteArrayList<>();

    public DiagramToTextSync(TextEditApplier applier, DocumentScheduler scheduler, long batchDebounceMs, boolean validateEdits) {
        this.applier = Objects.requireNonNull(applier, "applier must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        if (batchDebounceMs < 0) {
            throw new IllegalArgumentException("batchDebounceMs must not be negative: " + batchDebounceMs);
        }
        this.batchDebounceMs = batchDebounceMs;
        this.validateEdits = validateEdits;
    }

    public void addListener(TextSyncListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(TextSyncListener listener) {
        listeners.remove(listener);
    }

    // ==================== Submission ====================

    /**
     * Submits edits for a document.
     *
     * @param uri document URI
     * @param operationKind operation that produced the edits
     * @param edits edits to apply
     * @return future completing with true once the batch containing these edits was applied
     */
    public CompletableFuture<Boolean> submit(String uri, String operationKind, List<TextEdit> edits) {
        return enqueue(uri, operationKind, edits, null);
    }

    /**
     * Submits edits computed against a specific document version.
     *
     * <p>If the version differs from the last known one a conflict is reported and the
     * edits are dropped. The version is checked again when the batch is applied, so a
     * document that moves on inside the batch window also yields a conflict.
     */
    public CompletableFuture<Boolean> submit(String uri, String operationKind, List<TextEdit> edits, long expectedVersion) {
        if (checkVersionConflict(uri, operationKind, expectedVersion)) {
            return CompletableFuture.completedFuture(false);
        }
        return enqueue(uri, operationKind, edits, expectedVersion);
    }

    private CompletableFuture<Boolean> enqueue(String uri, String operationKind, List<TextEdit> edits, Long expectedVersion) {
        Objects.requireNonNull(uri, "uri must not be null");
        if (edits == null || edits.isEmpty()) {
            return CompletableFuture.completedFuture(true);
        }

        if (batchDebounceMs == 0) {
            List<String> kinds = List.of(operationKind);
            List<TextEdit> copy = List.copyOf(edits);
            return scheduler.submit(uri, () -> isStale(uri, kinds, expectedVersion)
                    ? CompletableFuture.completedFuture(false)
                    : apply(uri, kinds, copy))
                .thenCompose(result -> result);
        }

        PendingBatch stale = null;
        CompletableFuture<Boolean> result;
        synchronized (pending) {
            PendingBatch batch = pending.get(uri);
            if (batch != null && expectedVersion != null && batch.expectedVersion != null
                && !batch.expectedVersion.equals(expectedVersion)) {
                // Edits already queued were computed against an older text
                pending.remove(uri);
                if (batch.timer != null) {
                    batch.timer.cancel();
                }
                stale = batch;
                batch = null;
            }
            if (batch == null) {
                batch = new PendingBatch();
                pending.put(uri, batch);
            }
            if (batch.expectedVersion == null) {
                batch.expectedVersion = expectedVersion;
            }
            batch.kinds.add(operationKind);
            batch.edits.addAll(edits);
            if (batch.timer != null) {
                batch.timer.cancel();
            }
            batch.timer = scheduler.schedule(uri, () -> flushNow(uri), batchDebounceMs);
            log.debug("Queued {} edits for {} ({} pending)", edits.size(), uri, batch.edits.size());
            result = batch.result;
        }
        if (stale != null) {
            reportConflict(uri, String.join(",", stale.kinds), stale.expectedVersion, expectedVersion);
            stale.result.complete(false);
        }
        return result;
    }

    /**
     * Applies the pending batch of a document without waiting for the window to close.
     */
    public CompletableFuture<Boolean> flush(String uri) {
        CompletableFuture<Boolean> result;
        synchronized (pending) {
            PendingBatch batch = pending.get(uri);
            if (batch == null) {
                return CompletableFuture.completedFuture(true);
            }
            if (batch.timer != null) {
                batch.timer.cancel();
                batch.timer = null;
            }
            result = batch.result;
        }
        scheduler.execute(uri, () -> flushNow(uri));
        return result;
    }

    public CompletableFuture<Void> flushAll() {
        List<CompletableFuture<Boolean>> results = new ArrayList<>();
        for (String uri : List.copyOf(pending.keySet())) {
            results.add(flush(uri));
        }
        return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]));
    }

    /**
     * Drops the pending batch of a document. Its future completes with false.
     */
    public void clearPending(String uri) {
        PendingBatch batch;
        synchronized (pending) {
            batch = pending.remove(uri);
        }
        if (batch != null) {
            if (batch.timer != null) {
                batch.timer.cancel();
            }
            batch.result.complete(false);
            log.debug("Dropped {} pending edits for {}", batch.edits.size(), uri);
        }
    }

    public boolean hasPending(String uri) {
        return pending.containsKey(uri);
    }

    /**
     * Drops pending edits and the known version of a closed document.
     */
    public void forget(String uri) {
        clearPending(uri);
        documentVersions.remove(uri);
    }

    @Override
    public void close() {
        for (String uri : List.copyOf(pending.keySet())) {
            clearPending(uri);
        }
        documentVersions.clear();
    }

    // ==================== Versions ====================

    public void setDocumentVersion(String uri, long version) {
        documentVersions.put(uri, version);
    }

    public OptionalLong getDocumentVersion(String uri) {
        Long version = documentVersions.get(uri);
        return version != null ? OptionalLong.of(version) : OptionalLong.empty();
    }

    /**
     * Returns true and reports a conflict when the expected version differs from the last
     * known version. Unknown documents never conflict.
     */
    public boolean checkVersionConflict(String uri, String operationKind, long expectedVersion) {
        Long actual = documentVersions.get(uri);
        if (actual == null || actual == expectedVersion) {
            return false;
        }
        reportConflict(uri, operationKind, expectedVersion, actual);
        return true;
    }

    private void reportConflict(String uri, String operationKind, long expectedVersion, long actualVersion) {
        log.warn("Version conflict on {}: edits for version {} but document is at {}", uri, expectedVersion, actualVersion);
        TextSyncListener.VersionConflict event = new TextSyncListener.VersionConflict(
            uri, operationKind, expectedVersion, actualVersion, System.currentTimeMillis());
        notifyListeners(listener -> listener.onVersionConflict(event));
    }

    /**
     * Re-checks the version edits were computed against right before they are applied.
     */
    private boolean isStale(String uri, List<String> kinds, Long expectedVersion) {
        return expectedVersion != null && checkVersionConflict(uri, String.join(",", kinds), expectedVersion);
    }

    // ==================== Application ====================

    private void flushNow(String uri) {
        PendingBatch batch;
        synchronized (pending) {
            batch = pending.remove(uri);
        }
        if (batch == null) {
            return;
        }
        List<String> kinds = List.copyOf(batch.kinds);
        if (isStale(uri, kinds, batch.expectedVersion)) {
            log.debug("Dropped {} stale edits for {}", batch.edits.size(), uri);
            batch.result.complete(false);
            return;
        }
        apply(uri, kinds, List.copyOf(batch.edits))
            .whenComplete((applied, error) -> {
                if (error != null) {
                    batch.result.completeExceptionally(error);
                } else {
                    batch.result.complete(applied);
                }
            });
    }

    private CompletableFuture<Boolean> apply(String uri, List<String> kinds, List<TextEdit> edits) {
        if (validateEdits) {
            Optional<TextEdit> invalid = edits.stream().filter(edit -> !edit.range().isWellFormed()).findFirst();
            if (invalid.isPresent()) {
                fail(uri, kinds, "Invalid edit range: " + invalid.get().range());
                return CompletableFuture.completedFuture(false);
            }
        }

        List<TextEdit> merged = mergeEdits(edits);
        CompletableFuture<Boolean> outcome;
        try {
            outcome = applier.applyEdits(uri, merged);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        return outcome.handle((applied, error) -> {
            if (error != null) {
                log.error("Failed to apply edits to {}", uri, error);
                fail(uri, kinds, String.valueOf(error.getMessage()));
                return false;
            }
            if (!Boolean.TRUE.equals(applied)) {
                fail(uri, kinds, "Document rejected the edits");
                return false;
            }
            log.debug("Applied {} edits to {} for {}", merged.size(), uri, kinds);
            TextSyncListener.EditsApplied event = new TextSyncListener.EditsApplied(
                uri, kinds, merged, System.currentTimeMillis());
            notifyListeners(listener -> listener.onEditsApplied(event));
            return true;
        });
    }

    private void fail(String uri, List<String> kinds, String reason) {
        log.warn("Edits for {} not applied: {}", uri, reason);
        TextSyncListener.EditsFailed event = new TextSyncListener.EditsFailed(uri, kinds, reason, System.currentTimeMillis());
        notifyListeners(listener -> listener.onEditsFailed(event));
    }

    private void notifyListeners(Consumer<TextSyncListener> call) {
        for (TextSyncListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.error("Text sync listener failed", e);
            }
        }
    }

    /**
     * Sorts edits by descending start position and merges overlapping or touching ones.
     *
     * <p>A merged edit spans the union of both ranges. Its text is the earlier edit's text
     * followed by the later one's. Edits at the same position keep reverse submission order.
     */
    static List<TextEdit> mergeEdits(List<TextEdit> edits) {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparing((TextEdit edit) -> edit.range().start()).reversed());

        List<TextEdit> merged = new ArrayList<>();
        TextEdit current = null;
        for (TextEdit next : sorted) {
            if (current == null) {
                current = next;
            } else if (next.range().overlapsOrTouches(current.range())) {
                current = new TextEdit(next.range().union(current.range()), next.newText() + current.newText());
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    private static final class PendingBatch {
        private final List<String> kinds = new ArrayList<>();
        private final List<TextEdit> edits = new ArrayList<>();
        private final CompletableFuture<Boolean> result = new CompletableFuture<>();
        private DocumentScheduler.Cancellable timer;
        private Long expectedVersion;
    }
}
