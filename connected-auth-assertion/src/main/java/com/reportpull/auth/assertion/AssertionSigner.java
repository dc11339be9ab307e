package com.reportpull.auth.assertion;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Mints short-lived bearer assertions for the JWT-bearer grant.
 * Every call produces a fresh assertion; callers must not keep one for a later exchange.
 */
public interface AssertionSigner {

    Duration DEFAULT_LIFETIME = Duration.ofMinutes(3);
    Duration MAX_LIFETIME = Duration.ofMinutes(5);

    JwtAssertion sign(String issuer,
                      String subject,
                      String audience,
                      Path privateKeyPath,
                      String keyId,
                      Duration lifetime);

    default JwtAssertion sign(String issuer, String subject, String audience, Path privateKeyPath, String keyId) {
        return sign(issuer, subject, audience, privateKeyPath, keyId, DEFAULT_LIFETIME);
    }
}
