package com.reportpull.auth;

import java.net.URI;
import java.util.Locale;

/**
 * Org environment. Selects the canonical login host used for every token exchange.
 */
public enum AuthEnvironment {
    PRODUCTION(URI.create("https://login.salesforce.com")),
    SANDBOX(URI.create("https://test.salesforce.com"));

    private final URI loginHost;

    AuthEnvironment(URI loginHost) {
        this.loginHost = loginHost;
    }

    public URI loginHost() {
        return loginHost;
    }

    public static AuthEnvironment parse(String value) {
        if (value == null || value.isBlank()) {
            return PRODUCTION;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sandbox", "test" -> SANDBOX;
            case "production", "prod", "login" -> PRODUCTION;
            default -> throw new IllegalArgumentException("Unknown environment: " + value);
        };
    }
}
