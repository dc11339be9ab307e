package com.reportpull.auth;

import java.util.Optional;

/**
 * Outcome of an exchange or of a manager request for a usable token.
 */
public sealed interface TokenResult {

    record Success(TokenRecord record) implements TokenResult {}

    record Failure(AuthError error) implements TokenResult {}

    static TokenResult success(TokenRecord record) {
        return new Success(record);
    }

    static TokenResult failure(AuthError error) {
        return new Failure(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<TokenRecord> tokenRecord() {
        return this instanceof Success s ? Optional.of(s.record()) : Optional.empty();
    }

    default Optional<AuthError> authError() {
        return this instanceof Failure f ? Optional.of(f.error()) : Optional.empty();
    }
}
