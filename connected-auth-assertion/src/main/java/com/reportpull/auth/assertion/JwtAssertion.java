package com.reportpull.auth.assertion;

import java.time.Instant;

/**
 * A signed assertion and the claims it was built from.
 */
public record JwtAssertion(
    String issuer,
    String subject,
    String audience,
    Instant issuedAt,
    Instant expiresAt,
    String keyId,
    String compact
) {

    @Override
    public String toString() {
        // the compact form is a credential
        return "JwtAssertion[iss=" + issuer + ", sub=" + subject + ", aud=" + audience
            + ", iat=" + issuedAt + ", exp=" + expiresAt + ", kid=" + keyId + "]";
    }
}
