package com.reportpull.auth.store;

/**
 * The secret backend is unavailable or refused an operation.
 */
public class SecretBackendException extends RuntimeException {

    public SecretBackendException(String message) {
        super(message);
    }

    public SecretBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
