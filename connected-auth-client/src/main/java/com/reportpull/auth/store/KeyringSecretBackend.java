package com.reportpull.auth.store;

import java.util.Optional;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;

import lombok.extern.slf4j.Slf4j;

/**
 * OS keychain (macOS Keychain, Windows Credential Manager, freedesktop Secret Service).
 */
@Slf4j
public class KeyringSecretBackend implements SecretBackend {

    private final Keyring keyring;

    KeyringSecretBackend(Keyring keyring) {
        this.keyring = keyring;
    }

    /**
     * @throws SecretBackendException when the platform has no supported keychain
     */
    public static KeyringSecretBackend open() {
        try {
            return new KeyringSecretBackend(Keyring.create());
        } catch (BackendNotSupportedException e) {
            throw new SecretBackendException("No supported OS keychain: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> get(String service, String account) {
        try {
            return Optional.ofNullable(keyring.getPassword(service, account));
        } catch (PasswordAccessException e) {
            // Most backends report a missing entry this way.
            log.debug("Keychain has no entry {}/{}: {}", service, account, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String service, String account, String secret) {
        try {
            keyring.setPassword(service, account, secret);
        } catch (PasswordAccessException e) {
            throw new SecretBackendException("Could not write keychain entry " + service + "/" + account, e);
        }
    }

    @Override
    public void delete(String service, String account) {
        try {
            keyring.deletePassword(service, account);
        } catch (PasswordAccessException e) {
            log.debug("Keychain entry {}/{} not deleted: {}", service, account, e.getMessage());
        }
    }
}
