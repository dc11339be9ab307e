package com.reportpull.auth.session;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.slf4j.Slf4j;

/**
 * Hands out HTTP sessions bound to the calling execution context. A context always gets
 * back its own live session; a session whose owner went away is closed and replaced.
 * <p>
 * Create one registry at the composition root and pass it to whatever issues HTTP calls.
 */
@Slf4j
public class SessionRegistry implements AutoCloseable {

    private final HttpClientFactory clientFactory;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SessionHandle> sessions = new HashMap<>();

    public SessionRegistry() {
        this(new PooledHttpClientFactory(), Clock.systemUTC());
    }

    public SessionRegistry(HttpClientFactory clientFactory, Clock clock) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the live session of {@code context}, creating it when missing or stale.
     *
     * @throws SessionBindingException when called from a thread {@code context} does not run on
     */
    public SessionHandle ensureSession(ExecutionContext context, PoolConfig poolConfig) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(poolConfig, "poolConfig");
        if (!context.ownsCurrentThread()) {
            throw new SessionBindingException("Session for context " + context.id()
                + " requested from thread " + Thread.currentThread().getName() + " outside that context");
        }
        lock.lock();
        try {
            SessionHandle existing = sessions.get(context.id());
            if (existing != null && !existing.isStaleFor(context)) {
                return existing;
            }
            if (existing != null) {
                log.info("Replacing stale HTTP session for context {}", context.id());
                closeQuietly(existing);
            }
            SessionHandle created = new SessionHandle(context, clientFactory.create(poolConfig), poolConfig, clock.instant());
            sessions.put(context.id(), created);
            log.debug("Created HTTP session for context {} ({})", context.id(), poolConfig);
            return created;
        } finally {
            lock.unlock();
        }
    }

    public SessionHandle ensureSession(ExecutionContext context) {
        return ensureSession(context, PoolConfig.defaults());
    }

    /**
     * Closes and forgets the session of {@code context}. Close errors are logged.
     *
     * @return whether a session was registered
     */
    public boolean closeSession(ExecutionContext context) {
        SessionHandle removed;
        lock.lock();
        try {
            removed = sessions.remove(context.id());
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        closeQuietly(removed);
        return true;
    }

    /**
     * Closes every session, even after failures.
     *
     * @throws SessionCloseException carrying each close failure as a suppressed exception
     */
    public void closeAll() {
        List<SessionHandle> handles;
        lock.lock();
        try {
            handles = new ArrayList<>(sessions.values());
            sessions.clear();
        } finally {
            lock.unlock();
        }
        List<Exception> failures = new ArrayList<>();
        for (SessionHandle handle : handles) {
            try {
                handle.close();
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to close HTTP session for context {}: {}", handle.getContextId(), e.toString());
                failures.add(e);
            }
        }
        log.info("Closed {} HTTP session(s)", handles.size());
        if (!failures.isEmpty()) {
            throw new SessionCloseException(failures);
        }
    }

    @Override
    public void close() {
        closeAll();
    }

    /**
     * Drops sessions that are closed or whose owner is no longer running.
     *
     * @return how many sessions were removed
     */
    public int purgeClosed() {
        List<SessionHandle> purged = new ArrayList<>();
        lock.lock();
        try {
            Iterator<SessionHandle> it = sessions.values().iterator();
            while (it.hasNext()) {
                SessionHandle handle = it.next();
                if (handle.isClosed() || !handle.getOwner().isActive()) {
                    purged.add(handle);
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
        purged.forEach(SessionRegistry::closeQuietly);
        if (!purged.isEmpty()) {
            log.debug("Purged {} stale HTTP session(s)", purged.size());
        }
        return purged.size();
    }

    public Map<String, SessionStats> stats() {
        lock.lock();
        try {
            Map<String, SessionStats> out = new LinkedHashMap<>();
            sessions.forEach((id, handle) -> out.put(id, handle.stats()));
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    private static void closeQuietly(SessionHandle handle) {
        try {
            handle.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Error closing HTTP session for context {}: {}", handle.getContextId(), e.toString());
        }
    }
}
