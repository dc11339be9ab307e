package com.reportpull.auth;

import java.util.Locale;

/**
 * Known token-endpoint error codes and what to check in the connected app for each.
 */
public enum ProviderErrorClass {
    INVALID_GRANT("invalid_grant",
        "The grant was rejected. Check that: 1) the authorization code or refresh token has not expired or been revoked; "
            + "2) for JWT bearer, the certificate uploaded to the connected app matches the private key; "
            + "3) the JWT subject is pre-authorized for the connected app (admin-approved users); "
            + "4) the assertion audience is the login host for this environment."),
    INVALID_CLIENT("invalid_client",
        "The client was rejected. Check that: 1) the consumer key is correct; "
            + "2) the consumer secret matches, and the auth method is BROWSER_PKCE_WITH_SECRET when "
            + "'Require Secret for Web Server Flow' is enabled in the connected app; "
            + "3) the callback URL http://localhost:<port>/callback is registered; "
            + "4) OAuth settings are enabled with the 'full' and 'refresh_token' scopes; "
            + "5) the token request goes to the standard login host, not a custom domain."),
    OAUTH_FLOW_DISABLED("oauth_flow_disabled",
        "This OAuth flow is disabled for the org or connected app. Enable it in OAuth and OpenID Connect Settings "
            + "(for JWT bearer, also confirm the connected app uses digital signatures)."),
    UNRECOGNIZED(null, "Unrecognized token endpoint error; see the raw response body.");

    private final String code;
    private final String hint;

    ProviderErrorClass(String code, String hint) {
        this.code = code;
        this.hint = hint;
    }

    public String code() {
        return code;
    }

    public String hint() {
        return hint;
    }

    public static ProviderErrorClass classify(String errorCode, String rawBody) {
        if (errorCode != null) {
            String normalized = errorCode.trim().toLowerCase(Locale.ROOT);
            for (ProviderErrorClass c : values()) {
                if (normalized.equals(c.code)) {
                    return c;
                }
            }
        }
        // some proxies answer with a non-JSON body that still names the error
        if (rawBody != null) {
            String lower = rawBody.toLowerCase(Locale.ROOT);
            for (ProviderErrorClass c : values()) {
                if (c.code != null && lower.contains(c.code)) {
                    return c;
                }
            }
        }
        return UNRECOGNIZED;
    }
}
