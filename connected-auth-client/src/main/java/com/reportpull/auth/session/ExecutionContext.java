package com.reportpull.auth.session;

/**
 * A single-threaded scheduler that owns HTTP sessions. Sessions never cross contexts.
 */
public interface ExecutionContext {

    String id();

    /**
     * False once the context has shut down; its sessions are then stale.
     */
    boolean isActive();

    boolean ownsCurrentThread();
}
