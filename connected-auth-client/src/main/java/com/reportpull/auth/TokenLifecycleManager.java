package com.reportpull.auth;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import com.reportpull.auth.pkce.DesktopBrowserLauncher;
import com.reportpull.auth.pkce.PkceAuthorizationFlow;
import com.reportpull.auth.store.CredentialStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the current token record of one service and keeps it usable: refreshes when a
 * refresh token exists, otherwise runs the configured authorization flow.
 * <p>
 * Refresh and re-authentication are serialized on one lock per manager. Callers that queued
 * behind a refresh reuse its outcome instead of issuing their own exchange.
 */
@Slf4j
public class TokenLifecycleManager {

    private final ServiceConfig config;
    private final TokenExchanger exchanger;
    private final CredentialStore store;
    private final AuthorizationFlow flow;
    private final Clock clock;
    private final List<TokenRecordListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private volatile TokenRecord current;
    // Guarded by lock; read outside it only to detect that an attempt finished meanwhile.
    private volatile long generation;
    private TokenResult lastOutcome;

    public TokenLifecycleManager(ServiceConfig config, TokenExchanger exchanger, CredentialStore store,
                                 AuthorizationFlow flow, Clock clock) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.exchanger = Objects.requireNonNull(exchanger, "exchanger");
        this.store = Objects.requireNonNull(store, "store");
        this.flow = Objects.requireNonNull(flow, "flow");
        this.clock = Objects.requireNonNull(clock, "clock");
        loadStored();
    }

    /**
     * Wires a manager with the system browser, the OS keychain and a JDK HTTP client.
     */
    public static TokenLifecycleManager create(ServiceConfig config) {
        config.validate();
        HttpClient http = HttpClient.newBuilder().connectTimeout(config.getExchangeTimeout()).build();
        TokenExchanger exchanger = new TokenExchanger(http, config);
        AuthorizationFlow flow = config.getAuthMethod() == AuthMethod.JWT_BEARER
            ? new JwtBearerFlow(config, exchanger)
            : new PkceAuthorizationFlow(config, exchanger, new DesktopBrowserLauncher());
        return new TokenLifecycleManager(config, exchanger, CredentialStore.openDefault(), flow, Clock.systemUTC());
    }

    public ServiceConfig config() {
        return config;
    }

    public String serviceId() {
        return config.getServiceId();
    }

    public void addListener(TokenRecordListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(TokenRecordListener listener) {
        listeners.remove(listener);
    }

    public Optional<TokenRecord> currentRecord() {
        return Optional.ofNullable(current);
    }

    /**
     * True when an access token is held and {@code now < expiresAt - buffer}.
     */
    public boolean isValid() {
        TokenRecord record = current;
        boolean valid = record != null && record.isUsableAt(clock.instant(), config.getExpirySafetyBuffer());
        log.debug("Token for {} valid: {}", config.getServiceId(), valid);
        return valid;
    }

    public boolean hasCredentials() {
        return current != null;
    }

    /**
     * Instance the token is valid against, or the authorization host when no token says otherwise.
     */
    public String getInstanceUrl() {
        TokenRecord record = current;
        if (record != null && record.instanceUrl() != null) {
            return record.instanceUrl();
        }
        return config.authorizationHost().toString();
    }

    /**
     * Returns a usable record, refreshing or re-authenticating as needed.
     * Network and provider failures come back as {@link TokenResult.Failure}.
     */
    public TokenResult getValidToken() {
        TokenRecord record = current;
        if (record != null && record.isUsableAt(clock.instant(), config.getExpirySafetyBuffer())) {
            return TokenResult.success(record);
        }
        long observed = generation;
        synchronized (lock) {
            if (generation != observed && lastOutcome != null) {
                log.debug("Reusing outcome of concurrent token attempt for {}", config.getServiceId());
                return lastOutcome;
            }
            record = current;
            if (record != null && record.isUsableAt(clock.instant(), config.getExpirySafetyBuffer())) {
                return TokenResult.success(record);
            }
            TokenResult outcome = record != null && record.hasRefreshToken()
                ? refresh(record)
                : runFlow();
            return publish(outcome);
        }
    }

    /**
     * Runs the configured authorization flow even when a usable token is held.
     */
    public TokenResult authenticate() {
        synchronized (lock) {
            return publish(runFlow());
        }
    }

    /**
     * Drops the access token after the API rejected it. The refresh token is kept so the next
     * {@link #getValidToken()} refreshes instead of prompting.
     * <p>
     * Only acts while {@code rejectedAccessToken} is still the current token, so late 401s from
     * requests sent with an older token leave a newer one alone.
     *
     * @return whether the current token was invalidated
     */
    public boolean invalidateAccessToken(String rejectedAccessToken) {
        synchronized (lock) {
            TokenRecord record = current;
            if (record == null || !record.accessToken().equals(rejectedAccessToken)) {
                log.debug("Ignoring rejection of a token {} no longer holds", config.getServiceId());
                return false;
            }
            if (record.hasRefreshToken()) {
                update(record.expired());
                log.info("Access token for {} invalidated; refresh token kept", config.getServiceId());
            } else {
                current = null;
                store.clear(config.getServiceId());
                notifyListeners(null);
                log.info("Access token for {} invalidated", config.getServiceId());
            }
            lastOutcome = null;
            generation++;
            return true;
        }
    }

    public void clearCredentials() {
        synchronized (lock) {
            current = null;
            lastOutcome = null;
            generation++;
            store.clear(config.getServiceId());
            notifyListeners(null);
        }
        log.info("Cleared authentication credentials for {}", config.getServiceId());
    }

    private TokenResult refresh(TokenRecord record) {
        log.info("Refreshing access token for {}", config.getServiceId());
        TokenResult result = exchanger.exchange(
            new TokenGrant.RefreshToken(config.getConsumerKey(), record.refreshToken()));
        if (result instanceof TokenResult.Success success) {
            TokenRecord fresh = success.record();
            TokenRecord merged = new TokenRecord(
                fresh.accessToken(),
                fresh.hasRefreshToken() ? fresh.refreshToken() : record.refreshToken(),
                fresh.instanceUrl() != null ? fresh.instanceUrl() : record.instanceUrl(),
                fresh.issuedAt(),
                fresh.expiresAt());
            update(merged);
            log.info("Access token for {} refreshed, expires {}", config.getServiceId(), merged.expiresAt());
            return TokenResult.success(merged);
        }
        AuthError cause = ((TokenResult.Failure) result).error();
        log.warn("Refresh failed for {} ({}); re-authentication required", config.getServiceId(), cause.message());
        update(record.expired().withoutRefreshToken());
        return TokenResult.failure(AuthError.reauthenticationRequired(
            "Token refresh failed (" + cause.message() + "); sign in again", cause));
    }

    private TokenResult runFlow() {
        log.info("Starting {} authorization for {}", config.getAuthMethod(), config.getServiceId());
        TokenResult result = flow.authenticate();
        if (result instanceof TokenResult.Success success) {
            update(success.record());
            log.info("Authorization for {} succeeded, expires {}", config.getServiceId(), success.record().expiresAt());
        } else {
            log.warn("Authorization for {} failed: {}", config.getServiceId(),
                result.authError().map(AuthError::message).orElse("unknown"));
        }
        return result;
    }

    private TokenResult publish(TokenResult outcome) {
        lastOutcome = outcome;
        generation++;
        return outcome;
    }

    private void update(TokenRecord record) {
        current = record;
        store.save(config.getServiceId(), record);
        notifyListeners(record);
    }

    private void notifyListeners(TokenRecord record) {
        for (TokenRecordListener listener : listeners) {
            try {
                listener.onTokenRecordChanged(config.getServiceId(), record);
            } catch (RuntimeException e) {
                log.warn("Token listener {} failed", listener, e);
            }
        }
    }

    private void loadStored() {
        Optional<TokenRecord> stored = store.load(config.getServiceId());
        if (stored.isEmpty()) {
            return;
        }
        TokenRecord record = stored.get();
        if (!record.isUsableAt(clock.instant(), config.getExpirySafetyBuffer()) && !record.hasRefreshToken()) {
            log.warn("Stored token for {} is expired and cannot be refreshed; clearing it", config.getServiceId());
            store.clear(config.getServiceId());
            return;
        }
        current = record;
    }
}
