package com.reportpull.auth.pkce;

/**
 * What the redirect delivered, or why nothing usable arrived.
 */
public sealed interface CallbackResult {

    record CodeReceived(String code, String state) implements CallbackResult {
        @Override
        public String toString() {
            return "CodeReceived[state=" + state + "]";
        }
    }

    record ProviderError(String error, String description, String state) implements CallbackResult {}

    record Malformed(String reason) implements CallbackResult {}

    record HandlingFailed(String reason) implements CallbackResult {}

    record TimedOut(long waitedSeconds) implements CallbackResult {}
}
