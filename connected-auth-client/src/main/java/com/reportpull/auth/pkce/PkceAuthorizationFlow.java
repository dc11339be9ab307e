package com.reportpull.auth.pkce;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.reportpull.auth.AuthError;
import com.reportpull.auth.AuthErrorKind;
import com.reportpull.auth.AuthorizationFlow;
import com.reportpull.auth.ServiceConfig;
import com.reportpull.auth.TokenExchanger;
import com.reportpull.auth.TokenGrant;
import com.reportpull.auth.TokenResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Authorization Code + PKCE through the system browser and a localhost redirect.
 */
@Slf4j
public class PkceAuthorizationFlow implements AuthorizationFlow {

    private final ServiceConfig config;
    private final TokenExchanger exchanger;
    private final BrowserLauncher browser;
    private final Clock clock;
    private final SecureRandom random;

    public PkceAuthorizationFlow(ServiceConfig config, TokenExchanger exchanger, BrowserLauncher browser) {
        this(config, exchanger, browser, Clock.systemUTC(), new SecureRandom());
    }

    public PkceAuthorizationFlow(ServiceConfig config, TokenExchanger exchanger, BrowserLauncher browser,
                                 Clock clock, SecureRandom random) {
        this.config = Objects.requireNonNull(config, "config");
        this.exchanger = Objects.requireNonNull(exchanger, "exchanger");
        this.browser = Objects.requireNonNull(browser, "browser");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Generates PKCE parameters, binds the redirect listener and builds the authorization URL.
     * The caller owns the returned listener and must close it.
     *
     * @throws CallbackBindException when no callback port is free
     */
    public AuthorizationRequest beginAuthorization() {
        PkceChallenge challenge = PkceChallenge.generate(random);
        String state = PkceChallenge.newState(random);

        CallbackListener listener = new CallbackListener(config.getCallbackPort(), config.getCallbackPortRange());
        int port = listener.bind();
        String redirectUri = listener.redirectUri();

        PkceAttempt attempt = new PkceAttempt(challenge, state, redirectUri, port,
            clock.instant().plus(config.getCallbackTimeout()));

        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", config.getConsumerKey());
        params.put("redirect_uri", redirectUri);
        params.put("scope", config.getScope());
        params.put("state", state);
        params.put("code_challenge", challenge.codeChallenge());
        params.put("code_challenge_method", PkceChallenge.METHOD);

        URI url = URI.create(config.authorizeEndpoint() + "?" + params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&")));
        log.info("Prepared authorization request for service {} via {} (redirect {})",
            config.getServiceId(), config.authorizationHost(), redirectUri);
        return new AuthorizationRequest(url, attempt, listener);
    }

    @Override
    public TokenResult authenticate() {
        AuthorizationRequest request = beginAuthorization();
        try (CallbackListener listener = request.listener()) {
            try {
                browser.open(request.authorizationUrl());
            } catch (IOException | RuntimeException e) {
                log.error("Failed to open browser for authorization: {}", e.toString());
                return TokenResult.failure(AuthError.of(AuthErrorKind.BROWSER_LAUNCH_FAILED, "browser_launch_failed",
                    "Could not open the system browser (" + e.getMessage() + "). Open this URL manually: "
                        + request.authorizationUrl()));
            }
            listener.markBrowserOpened();
            CallbackResult callback = listener.awaitResult(config.getCallbackTimeout());
            return complete(request.attempt(), callback);
        }
    }

    /**
     * Turns a callback outcome into a token result, exchanging the code when there is one.
     * Nothing is exchanged once the attempt's deadline has passed.
     */
    public TokenResult complete(PkceAttempt attempt, CallbackResult callback) {
        if (!(callback instanceof CallbackResult.TimedOut) && attempt.isExpired(clock.instant())) {
            log.warn("Authorization callback arrived after the attempt expired at {}", attempt.getDeadline());
            return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_TIMEOUT, "callback_timeout",
                "The sign-in attempt expired at " + attempt.getDeadline() + "; start a new one"));
        }
        if (callback instanceof CallbackResult.CodeReceived received) {
            if (!stateMatches(attempt.getState(), received.state())) {
                log.error("OAuth callback state does not match the authorization request");
                return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_MALFORMED, "state_mismatch",
                    "The callback state does not match this sign-in attempt; the redirect may be forged or stale"));
            }
            String verifier;
            try {
                verifier = attempt.consume();
            } catch (IllegalStateException e) {
                return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_MALFORMED, "attempt_consumed",
                    e.getMessage()));
            }
            String secret = config.getAuthMethod().sendsClientSecret() ? config.getConsumerSecret() : null;
            return exchanger.exchange(new TokenGrant.AuthorizationCode(
                config.getConsumerKey(), received.code(), attempt.getRedirectUri(), verifier, secret));
        }
        if (callback instanceof CallbackResult.ProviderError providerError) {
            return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_PROVIDER_ERROR,
                providerError.error(), providerError.description()));
        }
        if (callback instanceof CallbackResult.Malformed malformed) {
            return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_MALFORMED, "malformed_callback",
                malformed.reason()));
        }
        if (callback instanceof CallbackResult.TimedOut timedOut) {
            return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_TIMEOUT, "callback_timeout",
                "No authorization callback received within " + timedOut.waitedSeconds()
                    + "s; the browser window may have been closed"));
        }
        CallbackResult.HandlingFailed failed = (CallbackResult.HandlingFailed) callback;
        return TokenResult.failure(AuthError.of(AuthErrorKind.CALLBACK_HANDLING_FAILED, "callback_handling_failed",
            failed.reason()));
    }

    private static boolean stateMatches(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
            actual.getBytes(StandardCharsets.US_ASCII));
    }
}
