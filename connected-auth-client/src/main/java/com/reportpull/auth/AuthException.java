package com.reportpull.auth;

import lombok.Getter;

/**
 * Local misconfiguration or misuse that callers cannot recover from by retrying.
 * Transient network and provider failures are never thrown; they come back as {@link TokenResult.Failure}.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
