package com.reportpull.auth.assertion;

import com.reportpull.auth.assertion.key.PemKeyLoader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;

/**
 * RS256 implementation using JJWT. The key file is read on every call.
 */
@Slf4j
@AllArgsConstructor
public final class JwtAssertionSigner implements AssertionSigner {
    private final Clock clock;

    public JwtAssertionSigner() {
        this(Clock.systemUTC());
    }

    @Override
    public JwtAssertion sign(String issuer,
                             String subject,
                             String audience,
                             Path privateKeyPath,
                             String keyId,
                             Duration lifetime) {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(audience, "audience");
        if (lifetime == null || lifetime.isZero() || lifetime.isNegative() || lifetime.compareTo(MAX_LIFETIME) > 0) {
            throw new IllegalArgumentException("Assertion lifetime must be within (0, " + MAX_LIFETIME + "]: " + lifetime);
        }
        if (privateKeyPath == null) {
            throw new AssertionSigningException("No private key path configured for JWT assertion signing");
        }

        PrivateKey key = PemKeyLoader.loadPrivateKey(privateKeyPath);

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant exp = now.plus(lifetime);

        JwtBuilder builder = Jwts.builder()
            .issuer(issuer)
            .subject(subject)
            .audience().single(audience)
            .issuedAt(Date.from(now))
            .expiration(Date.from(exp));
        if (keyId != null && !keyId.isBlank()) {
            builder.header().keyId(keyId).and()
                .claim("kid", keyId);
        }

        String jwt;
        try {
            jwt = builder.signWith(key, Jwts.SIG.RS256).compact();
        } catch (RuntimeException e) {
            throw new AssertionSigningException("Failed to sign JWT assertion with key " + privateKeyPath, e);
        }

        log.debug("Signed JWT assertion for sub={} aud={} exp={}", subject, audience, exp);
        return new JwtAssertion(issuer, subject, audience, now, exp, keyId, jwt);
    }
}
