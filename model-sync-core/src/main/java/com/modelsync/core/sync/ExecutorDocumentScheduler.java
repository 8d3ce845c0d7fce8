package com.modelsync.core.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DocumentScheduler} backed by one single-threaded scheduled executor per document.
 *
 * <p>Task failures are logged and do not stop the queue. A released queue keeps draining its
 * already queued tasks; a document reopened meanwhile gets a new queue that starts only once
 * the old one has terminated. Delayed tasks pending at release are dropped.
 */
public class ExecutorDocumentScheduler implements DocumentScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorDocumentScheduler.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 2000;

    private final Map<String, ScheduledExecutorService> executors = new ConcurrentHashMap<>();
    private final Map<String, ScheduledExecutorService> draining = new ConcurrentHashMap<>();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private volatile boolean closed;

    @Override
    public void execute(String uri, Runnable task) {
        try {
            executorFor(uri).execute(guarded(uri, task));
        } catch (RejectedExecutionException e) {
            log.warn("Dropped task for {}: scheduler is shut down", uri);
        }
    }

    /**
     * Like the default, but fails the future instead of leaving it pending when the queue
     * no longer accepts tasks.
     */
    @Override
    public <T> CompletableFuture<T> submit(String uri, Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executorFor(uri).execute(() -> {
                try {
                    future.complete(task.call());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Rejected task for {}: scheduler is shut down", uri);
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public Cancellable schedule(String uri, Runnable task, long delayMillis) {
        try {
            ScheduledFuture<?> future = executorFor(uri).schedule(guarded(uri, task), delayMillis, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.warn("Dropped delayed task for {}: scheduler is shut down", uri);
            return () -> true;
        }
    }

    @Override
    public void release(String uri) {
        draining.values().removeIf(ScheduledExecutorService::isTerminated);
        ScheduledExecutorService executor = executors.remove(uri);
        if (executor != null) {
            executor.shutdown();
            if (!executor.isTerminated()) {
                draining.put(uri, executor);
            }
            log.debug("Released task queue for {}", uri);
        }
    }

    @Override
    public void close() {
        closed = true;
        for (ScheduledExecutorService executor : executors.values()) {
            executor.shutdown();
        }
        for (ScheduledExecutorService executor : executors.values()) {
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        executors.clear();
        draining.clear();
    }

    private ScheduledExecutorService executorFor(String uri) {
        if (closed) {
            throw new RejectedExecutionException("Scheduler is closed");
        }
        return executors.computeIfAbsent(uri, key -> {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
                Thread thread = new Thread(runnable, "model-sync-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            ScheduledExecutorService previous = draining.remove(key);
            if (previous != null && !previous.isTerminated()) {
                executor.execute(() -> awaitDrained(key, previous));
            }
            return executor;
        });
    }

    /**
     * Blocks the new queue of a reopened document until the released one has run its last task.
     */
    private static void awaitDrained(String uri, ScheduledExecutorService previous) {
        try {
            if (!previous.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Released task queue for {} still running after {} ms", uri, SHUTDOWN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for released task queue of {}", uri);
        }
    }

    private static Runnable guarded(String uri, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Task for {} failed", uri, e);
            }
        };
    }
}
