package com.reportpull.auth.session;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * Execution context backed by one named worker thread. Code running on the worker can
 * find its scheduler through {@link #current()}.
 */
@Slf4j
public final class WorkerScheduler implements ExecutionContext, AutoCloseable {

    private static final ThreadLocal<WorkerScheduler> CURRENT = new ThreadLocal<>();

    private final String id;
    private final ExecutorService executor;
    private volatile Thread worker;

    public WorkerScheduler(String id) {
        this.id = id;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(() -> {
                CURRENT.set(this);
                try {
                    r.run();
                } finally {
                    CURRENT.remove();
                }
            }, "worker-" + id);
            t.setDaemon(true);
            worker = t;
            return t;
        });
    }

    public static Optional<WorkerScheduler> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isActive() {
        return !executor.isShutdown();
    }

    @Override
    public boolean ownsCurrentThread() {
        return Thread.currentThread() == worker;
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    public Future<?> submit(Runnable task) {
        return executor.submit(task);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker {} did not stop within 5s, interrupting", id);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return "WorkerScheduler[" + id + "]";
    }
}
