package com.reportpull.auth.pkce;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * RFC 7636 verifier/challenge pair, S256 method only.
 */
public record PkceChallenge(String codeVerifier, String codeChallenge) {

    public static final String METHOD = "S256";
    public static final int VERIFIER_BYTES = 96;
    public static final int STATE_BYTES = 32;

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    public static PkceChallenge generate(SecureRandom random) {
        String verifier = randomUrlSafe(random, VERIFIER_BYTES);
        return new PkceChallenge(verifier, challengeFor(verifier));
    }

    public static String newState(SecureRandom random) {
        return randomUrlSafe(random, STATE_BYTES);
    }

    public static String challengeFor(String verifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return URL_ENCODER.encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Recomputes the challenge the way the authorization server does and compares in constant time.
     */
    public static boolean verify(String verifier, String challenge) {
        if (verifier == null || challenge == null) {
            return false;
        }
        return MessageDigest.isEqual(
            challengeFor(verifier).getBytes(StandardCharsets.US_ASCII),
            challenge.getBytes(StandardCharsets.US_ASCII));
    }

    private static String randomUrlSafe(SecureRandom random, int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return URL_ENCODER.encodeToString(buf);
    }

    @Override
    public String toString() {
        return "PkceChallenge[codeChallenge=" + codeChallenge + "]";
    }
}
