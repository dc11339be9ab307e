package com.reportpull.auth.store;

import java.util.Optional;

/**
 * Secret storage keyed by service name and account, typically the OS keychain.
 * Implement this over the platform keychain, memory, a vault, etc.
 */
public interface SecretBackend {

    Optional<String> get(String service, String account);

    void set(String service, String account, String secret);

    /**
     * Removes the entry. Removing an entry that does not exist is a no-op.
     */
    void delete(String service, String account);
}
