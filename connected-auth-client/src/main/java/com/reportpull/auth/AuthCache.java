package com.reportpull.auth;

import java.util.Objects;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Short-circuits token lookups for API callers. Each read re-checks validity with the manager,
 * and any record change on the manager drops the cached pair.
 */
@Slf4j
public class AuthCache implements TokenRecordListener {

    public record AuthInfo(String accessToken, String baseUrl) {
        @Override
        public String toString() {
            return "AuthInfo[accessToken=" + TokenRecord.abbreviate(accessToken) + ", baseUrl=" + baseUrl + "]";
        }
    }

    private final TokenLifecycleManager manager;
    private final Object lock = new Object();
    private AuthInfo cached;

    public AuthCache(TokenLifecycleManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager");
        manager.addListener(this);
    }

    /**
     * Cached pair when the manager still considers the token valid, otherwise the current
     * record if it is valid, otherwise empty. Never triggers a refresh.
     */
    public Optional<AuthInfo> get() {
        synchronized (lock) {
            if (!manager.isValid()) {
                if (cached != null) {
                    log.debug("Cached auth for {} is no longer valid", manager.serviceId());
                }
                cached = null;
                return Optional.empty();
            }
            if (cached == null) {
                cached = manager.currentRecord()
                    .map(r -> new AuthInfo(r.accessToken(), manager.getInstanceUrl()))
                    .orElse(null);
            }
            return Optional.ofNullable(cached);
        }
    }

    public void invalidate() {
        synchronized (lock) {
            cached = null;
        }
    }

    @Override
    public void onTokenRecordChanged(String serviceId, TokenRecord current) {
        invalidate();
    }
}
