package com.reportpull.auth.api;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reportpull.auth.AuthCache;
import com.reportpull.auth.TokenLifecycleManager;
import com.reportpull.auth.TokenResult;
import com.reportpull.auth.session.ExecutionContext;
import com.reportpull.auth.session.PoolConfig;
import com.reportpull.auth.session.SessionRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Issues authenticated GETs against the org through the caller's own session.
 * A 401 drops the cached token and is retried once after re-authenticating.
 * HTTP and network failures come back in {@link ApiResponse}.
 */
@Slf4j
public class AuthenticatedApiClient {

    static final String ORGANIZATION_QUERY = "SELECT Id, Name FROM Organization LIMIT 1";

    private final TokenLifecycleManager manager;
    private final AuthCache cache;
    private final SessionRegistry registry;
    private final PoolConfig poolConfig;
    private final BearerAuthHeader authHeader = new BearerAuthHeader();
    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AuthenticatedApiClient(TokenLifecycleManager manager, AuthCache cache, SessionRegistry registry) {
        this(manager, cache, registry, PoolConfig.restApi());
    }

    public AuthenticatedApiClient(TokenLifecycleManager manager, AuthCache cache, SessionRegistry registry,
                                  PoolConfig poolConfig) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.poolConfig = Objects.requireNonNull(poolConfig, "poolConfig");
    }

    static final class QueryResponse {
        @JsonProperty("records")
        List<OrganizationRecord> records;
    }

    static final class OrganizationRecord {
        @JsonProperty("Id")
        String id;

        @JsonProperty("Name")
        String name;
    }

    /**
     * Must be called on {@code context}'s own thread.
     */
    public ApiResponse get(ExecutionContext context, String path, Map<String, String> query) {
        ResolvedAuth auth = resolveAuth();
        if (auth.info() == null) {
            return ApiResponse.failure(auth.failure());
        }
        ApiResponse response = send(context, auth.info(), path, query);
        if (response.status() != 401) {
            return response;
        }

        log.warn("GET {} returned 401 for {}; re-authenticating once", path, manager.serviceId());
        cache.invalidate();
        manager.invalidateAccessToken(auth.info().accessToken());
        auth = resolveAuth();
        if (auth.info() == null) {
            return ApiResponse.failure(auth.failure());
        }
        return send(context, auth.info(), path, query);
    }

    public ApiResponse get(ExecutionContext context, String path) {
        return get(context, path, Map.of());
    }

    /**
     * Verifies credentials by reading the Organization record.
     */
    public ConnectionTestResult testConnection(ExecutionContext context) {
        String path = "/services/data/v" + manager.config().getApiVersion() + "/query";
        ApiResponse response = get(context, path, Map.of("q", ORGANIZATION_QUERY));
        String instanceUrl = manager.getInstanceUrl();
        if (!response.isSuccess()) {
            String details = response.status() > 0
                ? "HTTP " + response.status() + ": " + response.body()
                : response.error();
            return ConnectionTestResult.failed(response.error(), details, instanceUrl);
        }
        try {
            QueryResponse parsed = mapper.readValue(response.body(), QueryResponse.class);
            if (parsed == null || parsed.records == null || parsed.records.isEmpty()) {
                return ConnectionTestResult.failed("no_organization", "Query returned no Organization record", instanceUrl);
            }
            OrganizationRecord org = parsed.records.get(0);
            log.info("Connected to organization {} ({}) at {}", org.name, org.id, instanceUrl);
            return new ConnectionTestResult(true, null, "Connected to " + org.name,
                new ConnectionTestResult.Organization(org.id, org.name), instanceUrl);
        } catch (JsonProcessingException e) {
            return ConnectionTestResult.failed("invalid_response", "Unparseable query response: " + e.getOriginalMessage(),
                instanceUrl);
        }
    }

    private record ResolvedAuth(AuthCache.AuthInfo info, String failure) {}

    private ResolvedAuth resolveAuth() {
        Optional<AuthCache.AuthInfo> cached = cache.get();
        if (cached.isPresent()) {
            return new ResolvedAuth(cached.get(), null);
        }
        TokenResult result = manager.getValidToken();
        if (result instanceof TokenResult.Failure failure) {
            return new ResolvedAuth(null, failure.error().message());
        }
        AuthCache.AuthInfo info = cache.get().orElseGet(() -> result.tokenRecord()
            .map(r -> new AuthCache.AuthInfo(r.accessToken(), manager.getInstanceUrl()))
            .orElse(null));
        return new ResolvedAuth(info, info == null ? "No access token available" : null);
    }

    private ApiResponse send(ExecutionContext context, AuthCache.AuthInfo auth, String path, Map<String, String> query) {
        URI uri;
        try {
            URIBuilder builder = new URIBuilder(auth.baseUrl() + path, StandardCharsets.UTF_8);
            query.forEach(builder::addParameter);
            uri = builder.build();
        } catch (URISyntaxException e) {
            return ApiResponse.failure("Invalid request URI: " + e.getMessage());
        }
        HttpGet request = authHeader.add(new HttpGet(uri), auth);
        request.setHeader("Accept", "application/json");
        try {
            ApiResponse response = registry.ensureSession(context, poolConfig).execute(request,
                r -> ApiResponse.http(r.getCode(),
                    r.getEntity() == null ? "" : EntityUtils.toString(r.getEntity(), StandardCharsets.UTF_8)));
            log.debug("GET {} -> {}", uri.getPath(), response.status());
            return response;
        } catch (IOException e) {
            log.warn("GET {} failed: {}", uri.getPath(), e.toString());
            return ApiResponse.failure("Network error: " + e.getMessage());
        }
    }
}
