package com.reportpull.auth;

import java.util.Locale;

/**
 * How a manager obtains a token when it has nothing to refresh.
 * The two browser variants are distinct settings because the connected app either
 * requires the secret on the web server flow or it does not.
 */
public enum AuthMethod {
    BROWSER_PKCE(false),
    BROWSER_PKCE_WITH_SECRET(true),
    JWT_BEARER(false);

    private final boolean sendsClientSecret;

    AuthMethod(boolean sendsClientSecret) {
        this.sendsClientSecret = sendsClientSecret;
    }

    public boolean sendsClientSecret() {
        return sendsClientSecret;
    }

    public static AuthMethod parse(String value) {
        if (value == null || value.isBlank()) {
            return BROWSER_PKCE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "browser_pkce", "browser_oauth", "pkce" -> BROWSER_PKCE;
            case "browser_pkce_with_secret", "pkce_with_secret" -> BROWSER_PKCE_WITH_SECRET;
            case "jwt_bearer", "jwt" -> JWT_BEARER;
            default -> throw new IllegalArgumentException("Unknown auth method: " + value);
        };
    }
}
