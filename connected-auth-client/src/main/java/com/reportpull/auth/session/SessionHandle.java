package com.reportpull.auth.session;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A pooled HTTP client owned by exactly one {@link ExecutionContext}.
 */
@Slf4j
@Getter
public final class SessionHandle implements AutoCloseable {

    private static final ScheduledExecutorService DEADLINES = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-deadline");
        t.setDaemon(true);
        return t;
    });

    private final String contextId;
    private final ExecutionContext owner;
    private final CloseableHttpClient client;
    private final PoolConfig poolConfig;
    private final Instant createdAt;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean();

    SessionHandle(ExecutionContext owner, CloseableHttpClient client, PoolConfig poolConfig, Instant createdAt) {
        this.contextId = owner.id();
        this.owner = owner;
        this.client = client;
        this.poolConfig = poolConfig;
        this.createdAt = createdAt;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stale when closed, bound to another context instance, or owned by a context that stopped.
     */
    boolean isStaleFor(ExecutionContext context) {
        return closed.get() || owner != context || !owner.isActive();
    }

    /**
     * Executes the request, cancelling it once the pool's total timeout elapses.
     */
    public <T> T execute(HttpUriRequestBase request, HttpClientResponseHandler<? extends T> handler) throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Session for context " + contextId + " is closed");
        }
        ScheduledFuture<?> deadline = DEADLINES.schedule(() -> {
            if (request.cancel()) {
                log.warn("Cancelled {} {} after {}s total timeout", request.getMethod(), request.getRequestUri(),
                    poolConfig.getTotalTimeout().toSeconds());
            }
        }, poolConfig.getTotalTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            return client.execute(request, handler);
        } finally {
            deadline.cancel(false);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            client.close();
            log.debug("Closed HTTP session for context {}", contextId);
        }
    }

    SessionStats stats() {
        return new SessionStats(contextId, createdAt, closed.get(), owner.isActive(),
            poolConfig.getMaxTotal(), poolConfig.getMaxPerRoute());
    }
}
