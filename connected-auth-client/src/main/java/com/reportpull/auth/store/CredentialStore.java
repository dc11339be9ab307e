package com.reportpull.auth.store;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import com.reportpull.auth.TokenExchanger;
import com.reportpull.auth.TokenRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Persists one {@link TokenRecord} per service: keychain first, owner-only file as fallback.
 * Storage problems are logged and never break authentication; the in-memory record stays authoritative.
 */
@Slf4j
public class CredentialStore {

    public static final String SERVICE_NAME = "ReportPull";

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String INSTANCE_URL = "instance_url";
    static final String EXPIRES_AT = "expires_at";
    static final String ISSUED_AT = "issued_at";

    private static final String[] FIELDS = {ACCESS_TOKEN, REFRESH_TOKEN, INSTANCE_URL, EXPIRES_AT, ISSUED_AT};

    private final SecretBackend keychain;
    private final TokenFileStore files;

    /**
     * @param keychain may be null when no keychain is available
     */
    public CredentialStore(SecretBackend keychain, TokenFileStore files) {
        this.keychain = keychain;
        this.files = files;
    }

    /**
     * The OS keychain when the platform has one, plus {@code ~/.config/ReportPull}.
     */
    public static CredentialStore openDefault() {
        SecretBackend keychain;
        try {
            keychain = KeyringSecretBackend.open();
        } catch (SecretBackendException e) {
            log.warn("OS keychain unavailable, tokens will be stored in a file only: {}", e.getMessage());
            keychain = null;
        }
        return new CredentialStore(keychain, TokenFileStore.inUserConfig(SERVICE_NAME));
    }

    static String account(String serviceId, String field) {
        return serviceId + "." + field;
    }

    public Optional<TokenRecord> load(String serviceId) {
        if (keychain != null) {
            try {
                Optional<TokenRecord> stored = loadFromKeychain(serviceId);
                if (stored.isPresent()) {
                    log.info("Loaded {} tokens from the keychain", serviceId);
                    return stored;
                }
            } catch (SecretBackendException | DateTimeParseException | NumberFormatException e) {
                log.warn("Could not load {} tokens from the keychain: {}", serviceId, e.getMessage());
            } catch (IllegalArgumentException e) {
                log.warn("Keychain holds an inconsistent {} token record: {}", serviceId, e.getMessage());
            }
        }
        try {
            Optional<TokenRecord> stored = files.read(serviceId);
            stored.ifPresent(r -> log.info("Loaded {} tokens from {}", serviceId, files.fileFor(serviceId)));
            return stored;
        } catch (IOException e) {
            log.warn("Could not load {} tokens from file: {}", serviceId, e.toString());
            return Optional.empty();
        }
    }

    public void save(String serviceId, TokenRecord record) {
        if (keychain != null) {
            try {
                saveToKeychain(serviceId, record);
                log.info("Saved {} tokens to the keychain", serviceId);
                return;
            } catch (SecretBackendException e) {
                log.warn("Could not save {} tokens to the keychain, falling back to file: {}", serviceId, e.getMessage());
            }
        }
        try {
            files.write(serviceId, record);
            log.info("Saved {} tokens to {}", serviceId, files.fileFor(serviceId));
        } catch (IOException e) {
            log.error("Could not save {} tokens: {}", serviceId, e.toString());
        }
    }

    /**
     * Removes every persisted field from both locations. Missing entries are ignored.
     */
    public void clear(String serviceId) {
        if (keychain != null) {
            for (String field : FIELDS) {
                try {
                    keychain.delete(SERVICE_NAME, account(serviceId, field));
                } catch (SecretBackendException e) {
                    log.debug("Keychain entry {} not removed: {}", account(serviceId, field), e.getMessage());
                }
            }
        }
        try {
            files.delete(serviceId);
        } catch (IOException e) {
            log.warn("Could not delete token file for {}: {}", serviceId, e.toString());
        }
        log.info("Cleared stored {} credentials", serviceId);
    }

    private Optional<TokenRecord> loadFromKeychain(String serviceId) {
        Optional<String> accessToken = read(serviceId, ACCESS_TOKEN);
        Optional<String> expiresAt = read(serviceId, EXPIRES_AT);
        if (accessToken.isEmpty() || expiresAt.isEmpty()) {
            return Optional.empty();
        }
        Instant expires = TokenFileStore.parseInstant(expiresAt.get());
        Instant issued = read(serviceId, ISSUED_AT)
            .map(TokenFileStore::parseInstant)
            .orElseGet(() -> expires.minusSeconds(TokenExchanger.DEFAULT_EXPIRES_IN_SECONDS));
        return Optional.of(new TokenRecord(
            accessToken.get(),
            read(serviceId, REFRESH_TOKEN).orElse(null),
            read(serviceId, INSTANCE_URL).orElse(null),
            issued,
            expires));
    }

    private void saveToKeychain(String serviceId, TokenRecord record) {
        keychain.set(SERVICE_NAME, account(serviceId, ACCESS_TOKEN), record.accessToken());
        if (record.hasRefreshToken()) {
            keychain.set(SERVICE_NAME, account(serviceId, REFRESH_TOKEN), record.refreshToken());
        } else {
            keychain.delete(SERVICE_NAME, account(serviceId, REFRESH_TOKEN));
        }
        if (record.instanceUrl() != null) {
            keychain.set(SERVICE_NAME, account(serviceId, INSTANCE_URL), record.instanceUrl());
        } else {
            keychain.delete(SERVICE_NAME, account(serviceId, INSTANCE_URL));
        }
        keychain.set(SERVICE_NAME, account(serviceId, EXPIRES_AT), record.expiresAt().toString());
        keychain.set(SERVICE_NAME, account(serviceId, ISSUED_AT), record.issuedAt().toString());
    }

    private Optional<String> read(String serviceId, String field) {
        return keychain.get(SERVICE_NAME, account(serviceId, field)).filter(v -> !v.isBlank());
    }
}
