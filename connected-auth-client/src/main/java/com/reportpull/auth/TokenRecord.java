package com.reportpull.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tokens issued for one service plus the instance they are valid against.
 */
public record TokenRecord(
    String accessToken,
    String refreshToken,
    String instanceUrl,
    Instant issuedAt,
    Instant expiresAt
) {

    public TokenRecord {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt: " + issuedAt + " / " + expiresAt);
        }
        if (refreshToken != null && refreshToken.isBlank()) {
            refreshToken = null;
        }
    }

    public boolean hasRefreshToken() {
        return refreshToken != null;
    }

    /**
     * True when {@code now} is still before expiry minus {@code buffer}.
     */
    public boolean isUsableAt(Instant now, Duration buffer) {
        return now.isBefore(expiresAt.minus(buffer));
    }

    /**
     * Copy whose access token no longer counts as usable. The refresh token and instance survive.
     */
    public TokenRecord expired() {
        return new TokenRecord(accessToken, refreshToken, instanceUrl, issuedAt, issuedAt.plusSeconds(1));
    }

    public TokenRecord withoutRefreshToken() {
        return new TokenRecord(accessToken, null, instanceUrl, issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "TokenRecord[accessToken=" + abbreviate(accessToken)
            + ", refreshToken=" + (refreshToken == null ? "absent" : "present")
            + ", instanceUrl=" + instanceUrl + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }

    static String abbreviate(String secret) {
        if (secret == null) {
            return "null";
        }
        return secret.length() <= 8 ? "****" : secret.substring(0, 4) + "****";
    }
}
