package com.reportpull.auth.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.AllArgsConstructor;

/**
 * Process-local backend for tests and headless hosts without a keychain.
 */
@AllArgsConstructor
public class InMemorySecretBackend implements SecretBackend {

    public record Entry(String service, String account) {}

    private final Map<Entry, String> secrets;

    public InMemorySecretBackend() {
        this(new ConcurrentHashMap<>());
    }

    @Override
    public Optional<String> get(String service, String account) {
        if (service == null || account == null) {return Optional.empty();}
        return Optional.ofNullable(secrets.get(new Entry(service, account)));
    }

    @Override
    public void set(String service, String account, String secret) {
        if (secret == null) {
            delete(service, account);
            return;
        }
        secrets.put(new Entry(service, account), secret);
    }

    @Override
    public void delete(String service, String account) {
        secrets.remove(new Entry(service, account));
    }

    public int size() {
        return secrets.size();
    }
}
