package com.modelsync.core.sync;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Per-document task queue.
 *
 * <p>Tasks for the same URI run one at a time in submission order, together with the
 * debounce timers scheduled for that URI. Tasks for different URIs are independent.
 * This is what keeps all mutation of one document's snapshot, registry and metadata
 * single-threaded.
 */
public interface DocumentScheduler extends AutoCloseable {

    /**
     * Queues a task for a document.
     *
     * @param uri document URI
     * @param task task to run
     */
    void execute(String uri, Runnable task);

    /**
     * Queues a task for a document after a delay.
     *
     * @param uri document URI
     * @param task task to run
     * @param delayMillis delay in milliseconds
     * @return handle to cancel the task before it runs
     */
    Cancellable schedule(String uri, Runnable task, long delayMillis);

    /**
     * Queues a task and exposes its result.
     *
     * @param uri document URI
     * @param task task to run
     * @param <T> result type
     * @return future completed with the task's result or exception
     */
    default <T> CompletableFuture<T> submit(String uri, Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        execute(uri, () -> {
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * Releases the queue of a closed document. Already queued tasks still run, and tasks
     * submitted for the same URI afterwards run after them.
     *
     * @param uri document URI
     */
    void release(String uri);

    @Override
    void close();

    /**
     * Handle of a delayed task.
     */
    @FunctionalInterface
    interface Cancellable {

        /**
         * Cancels the task if it has not started.
         *
         * @return true if the task will not run
         */
        boolean cancel();
    }
}
