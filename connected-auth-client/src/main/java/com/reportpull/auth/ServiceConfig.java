package com.reportpull.auth;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Connected-app settings for one service. Immutable; build a new instance to reconfigure.
 */
@Slf4j
@Getter
@ToString
@Builder(toBuilder = true)
public class ServiceConfig {

    public static final String ENV_CONSUMER_KEY = "SF_CONSUMER_KEY";
    public static final String ENV_CLIENT_ID = "SF_CLIENT_ID";
    public static final String ENV_CONSUMER_SECRET = "SF_CONSUMER_SECRET";
    public static final String ENV_JWT_SUBJECT = "SF_JWT_SUBJECT";
    public static final String ENV_JWT_KEY_PATH = "SF_JWT_KEY_PATH";
    public static final String ENV_JWT_KEY_ID = "SF_JWT_KEY_ID";
    public static final String ENV_ENVIRONMENT = "SF_ENVIRONMENT";
    public static final String ENV_INSTANCE_URL = "SF_INSTANCE_URL";
    public static final String ENV_AUTH_METHOD = "SF_AUTH_METHOD";

    @Builder.Default
    private final String serviceId = "salesforce";
    private final String consumerKey;
    @ToString.Exclude
    private final String consumerSecret;
    private final String jwtSubject;
    private final Path privateKeyPath;
    private final String keyId;
    @Builder.Default
    private final AuthEnvironment environment = AuthEnvironment.PRODUCTION;
    @Builder.Default
    private final AuthMethod authMethod = AuthMethod.BROWSER_PKCE;
    /** Custom or vanity domain. Used for the browser authorization step only. */
    private final String instanceUrl;
    /** Replaces the canonical login host for token exchange, e.g. for a private deployment. */
    private final URI tokenHostOverride;
    @Builder.Default
    private final String scope = "full refresh_token";
    @Builder.Default
    private final int callbackPort = 8080;
    @Builder.Default
    private final int callbackPortRange = 10;
    @Builder.Default
    private final Duration callbackTimeout = Duration.ofSeconds(300);
    @Builder.Default
    private final Duration assertionLifetime = Duration.ofMinutes(3);
    @Builder.Default
    private final Duration expirySafetyBuffer = Duration.ofMinutes(5);
    @Builder.Default
    private final Duration exchangeTimeout = Duration.ofSeconds(30);
    @Builder.Default
    private final String apiVersion = "63.0";

    public static ServiceConfig fromEnvironment(String serviceId, Map<String, String> env) {
        String instanceUrl = blankToNull(env.get(ENV_INSTANCE_URL));
        String environment = blankToNull(env.get(ENV_ENVIRONMENT));
        AuthEnvironment authEnvironment = environment != null
            ? AuthEnvironment.parse(environment)
            : inferEnvironment(instanceUrl);
        String keyPath = blankToNull(env.get(ENV_JWT_KEY_PATH));
        String consumerKey = blankToNull(env.get(ENV_CONSUMER_KEY));

        return ServiceConfig.builder()
            .serviceId(serviceId)
            .consumerKey(consumerKey != null ? consumerKey : blankToNull(env.get(ENV_CLIENT_ID)))
            .consumerSecret(blankToNull(env.get(ENV_CONSUMER_SECRET)))
            .jwtSubject(blankToNull(env.get(ENV_JWT_SUBJECT)))
            .privateKeyPath(keyPath == null ? null : Path.of(keyPath))
            .keyId(blankToNull(env.get(ENV_JWT_KEY_ID)))
            .environment(authEnvironment)
            .authMethod(AuthMethod.parse(env.get(ENV_AUTH_METHOD)))
            .instanceUrl(instanceUrl)
            .build();
    }

    public static ServiceConfig fromSystemEnvironment(String serviceId) {
        return fromEnvironment(serviceId, System.getenv());
    }

    /**
     * Host the browser is sent to: the custom instance when one is set, else the login host.
     */
    public URI authorizationHost() {
        if (instanceUrl == null || instanceUrl.isBlank()) {
            return environment.loginHost();
        }
        String url = instanceUrl.trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + url;
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return URI.create(url);
    }

    /**
     * Host every token exchange goes through. Never the vanity domain: custom domains
     * frequently reject direct token requests.
     */
    public URI tokenHost() {
        return tokenHostOverride != null ? tokenHostOverride : environment.loginHost();
    }

    public URI authorizeEndpoint() {
        return URI.create(authorizationHost() + "/services/oauth2/authorize");
    }

    public URI tokenEndpoint() {
        String host = tokenHost().toString();
        if (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        return URI.create(host + "/services/oauth2/token");
    }

    /**
     * Checks that every field the configured auth method needs is present.
     *
     * @throws ConfigIncompleteException naming each missing field
     */
    public ServiceConfig validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(consumerKey)) {
            missing.add("consumer key (" + ENV_CONSUMER_KEY + ")");
        }
        switch (authMethod) {
            case BROWSER_PKCE_WITH_SECRET -> {
                if (isBlank(consumerSecret)) {
                    missing.add("consumer secret (" + ENV_CONSUMER_SECRET + "), required by "
                        + AuthMethod.BROWSER_PKCE_WITH_SECRET);
                }
            }
            case JWT_BEARER -> {
                if (isBlank(jwtSubject)) {
                    missing.add("JWT subject (" + ENV_JWT_SUBJECT + ")");
                }
                if (privateKeyPath == null) {
                    missing.add("JWT private key path (" + ENV_JWT_KEY_PATH + ")");
                }
            }
            case BROWSER_PKCE -> {
                if (!isBlank(consumerSecret)) {
                    log.warn("Consumer secret is configured for service {} but auth method {} does not send it; "
                        + "use {} if the connected app requires the secret", serviceId, authMethod,
                        AuthMethod.BROWSER_PKCE_WITH_SECRET);
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigIncompleteException(serviceId, missing);
        }
        if (assertionLifetime.isZero() || assertionLifetime.isNegative()
            || assertionLifetime.compareTo(Duration.ofMinutes(5)) > 0) {
            throw new IllegalArgumentException("assertionLifetime must be within (0, 5m]: " + assertionLifetime);
        }
        if (callbackPortRange < 1) {
            throw new IllegalArgumentException("callbackPortRange must be at least 1");
        }
        return this;
    }

    private static AuthEnvironment inferEnvironment(String instanceUrl) {
        if (instanceUrl == null) {
            return AuthEnvironment.PRODUCTION;
        }
        String lower = instanceUrl.toLowerCase(Locale.ROOT);
        return lower.contains("test.salesforce.com") || lower.contains(".sandbox.my.salesforce.com")
            ? AuthEnvironment.SANDBOX
            : AuthEnvironment.PRODUCTION;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
