package com.reportpull.auth;

/**
 * Structured failure. {@code code} is the provider error code when there is one
 * ({@code access_denied}, {@code invalid_grant}, ...), otherwise a short local code.
 * {@code status} is 0 when no HTTP response was received.
 */
public record AuthError(
    AuthErrorKind kind,
    String code,
    String description,
    int status,
    String body,
    String hint
) {

    public static AuthError of(AuthErrorKind kind, String code, String description) {
        return new AuthError(kind, code, description, 0, null, null);
    }

    public static AuthError http(int status, String body, ProviderErrorClass errorClass, String code, String description) {
        return new AuthError(AuthErrorKind.TOKEN_EXCHANGE_HTTP_ERROR, code, description, status, body, errorClass.hint());
    }

    public static AuthError network(String description) {
        return of(AuthErrorKind.TOKEN_EXCHANGE_NETWORK_ERROR, "network_error", description);
    }

    /**
     * Keeps the HTTP status, body and hint of the failure that made re-authentication necessary.
     */
    public static AuthError reauthenticationRequired(String description, AuthError cause) {
        return new AuthError(AuthErrorKind.REAUTHENTICATION_REQUIRED, "reauthentication_required", description,
            cause.status(), cause.body(), cause.hint());
    }

    /**
     * One line for logs and status bars: code, description and hint when present.
     */
    public String message() {
        StringBuilder sb = new StringBuilder(code == null ? kind.name() : code);
        if (description != null && !description.isBlank()) {
            sb.append(": ").append(description);
        }
        if (status > 0) {
            sb.append(" (HTTP ").append(status).append(')');
        }
        if (hint != null) {
            sb.append(". ").append(hint);
        }
        return sb.toString();
    }
}
