package com.reportpull.auth;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Posts grants to the canonical token endpoint. Every outcome, including network
 * failures, is returned as a {@link TokenResult}; nothing here throws for I/O.
 */
@Slf4j
public record TokenExchanger(HttpClient http, URI tokenEndpoint, Duration timeout, ObjectMapper mapper, Clock clock) {

    public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    public TokenExchanger(HttpClient http, ServiceConfig config) {
        this(http, config.tokenEndpoint(), config.getExchangeTimeout(),
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false),
            Clock.systemUTC());
    }

    public TokenExchanger(HttpClient http, URI tokenEndpoint, Duration timeout, ObjectMapper mapper, Clock clock) {
        this.http = Objects.requireNonNull(http, "http");
        this.tokenEndpoint = Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    static final class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("refresh_token")
        String refreshToken;

        @JsonProperty("instance_url")
        String instanceUrl;

        @JsonProperty("expires_in")
        Long expiresIn;

        @JsonProperty("token_type")
        String tokenType;
    }

    static final class ErrorResponse {
        @JsonProperty("error")
        String error;

        @JsonProperty("error_description")
        String errorDescription;
    }

    public TokenResult exchange(TokenGrant grant) {
        Objects.requireNonNull(grant, "grant");

        HttpRequest req = HttpRequest.newBuilder(tokenEndpoint)
            .timeout(timeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(grant.formParameters())))
            .build();

        log.info("Exchanging {} grant at {}", grant.grantType(), tokenEndpoint);
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during {} exchange", grant.grantType());
            return TokenResult.failure(AuthError.network("Interrupted while contacting " + tokenEndpoint));
        } catch (IOException e) {
            log.warn("Network error during {} exchange at {}: {}", grant.grantType(), tokenEndpoint, e.toString());
            return TokenResult.failure(AuthError.network(
                "Could not reach token endpoint " + tokenEndpoint + ": " + e));
        }

        int sc = resp.statusCode();
        String body = resp.body();
        if (sc == 200) {
            return parseSuccess(grant, body, issuedAt);
        }
        return classifyFailure(grant, sc, body);
    }

    private TokenResult parseSuccess(TokenGrant grant, String body, Instant issuedAt) {
        TokenResponse tr;
        try {
            tr = mapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable {} response from {}", grant.grantType(), tokenEndpoint);
            return TokenResult.failure(AuthError.http(200, body, ProviderErrorClass.UNRECOGNIZED,
                "invalid_response", "Token response is not valid JSON"));
        }
        if (tr == null || tr.accessToken == null || tr.accessToken.isBlank()) {
            return TokenResult.failure(AuthError.http(200, body, ProviderErrorClass.UNRECOGNIZED,
                "invalid_response", "Token response is missing access_token"));
        }
        long expiresIn = (tr.expiresIn == null || tr.expiresIn <= 0) ? DEFAULT_EXPIRES_IN_SECONDS : tr.expiresIn;
        TokenRecord record = new TokenRecord(
            tr.accessToken,
            tr.refreshToken,
            tr.instanceUrl,
            issuedAt,
            issuedAt.plusSeconds(expiresIn)
        );
        log.info("{} exchange succeeded, instance={} expiresAt={} refreshToken={}",
            grant.grantType(), record.instanceUrl(), record.expiresAt(), record.hasRefreshToken() ? "present" : "absent");
        return TokenResult.success(record);
    }

    private TokenResult classifyFailure(TokenGrant grant, int status, String body) {
        String code = null;
        String description = null;
        try {
            ErrorResponse er = mapper.readValue(body, ErrorResponse.class);
            if (er != null) {
                code = er.error;
                description = er.errorDescription;
            }
        } catch (JsonProcessingException e) {
            log.debug("Token error body is not JSON: {}", e.getOriginalMessage());
        }
        ProviderErrorClass errorClass = ProviderErrorClass.classify(code, body);
        if (code == null) {
            code = errorClass.code() != null ? errorClass.code() : "http_" + status;
        }
        if (description == null) {
            description = "HTTP " + status + " from token endpoint";
        }
        log.warn("{} exchange failed: HTTP {} {} - {}", grant.grantType(), status, code, description);
        if (errorClass != ProviderErrorClass.UNRECOGNIZED) {
            log.warn("Troubleshooting: {}", errorClass.hint());
        }
        return TokenResult.failure(AuthError.http(status, body, errorClass, code, description));
    }

    static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
