package com.reportpull.auth.pkce;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.Getter;

/**
 * One authorization attempt. The verifier may be handed to a code exchange exactly once.
 */
@Getter
public final class PkceAttempt {

    private final String codeVerifier;
    private final String codeChallenge;
    private final String state;
    private final String redirectUri;
    private final int port;
    private final Instant deadline;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean consumed = new AtomicBoolean();

    public PkceAttempt(PkceChallenge challenge, String state, String redirectUri, int port, Instant deadline) {
        this.codeVerifier = challenge.codeVerifier();
        this.codeChallenge = challenge.codeChallenge();
        this.state = state;
        this.redirectUri = redirectUri;
        this.port = port;
        this.deadline = deadline;
    }

    /**
     * Marks the attempt used and returns the verifier.
     *
     * @throws IllegalStateException if the attempt was already consumed
     */
    public String consume() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("PKCE attempt for " + redirectUri + " was already consumed");
        }
        return codeVerifier;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }

    @Override
    public String toString() {
        return "PkceAttempt[redirectUri=" + redirectUri + ", deadline=" + deadline + ", consumed=" + consumed.get() + "]";
    }
}
