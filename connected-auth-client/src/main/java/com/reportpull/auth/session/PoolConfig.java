package com.reportpull.auth.session;

import java.time.Duration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Connection pool and timeout tuning for one session.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class PoolConfig {

    @Builder.Default
    private final int maxTotal = 100;
    @Builder.Default
    private final int maxPerRoute = 30;
    @Builder.Default
    private final Duration dnsCacheTtl = Duration.ofSeconds(300);
    @Builder.Default
    private final Duration keepAlive = Duration.ofSeconds(60);
    @Builder.Default
    private final Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default
    private final Duration readTimeout = Duration.ofSeconds(60);
    /** Upper bound for a whole request including connect and body; the request is cancelled after it. */
    @Builder.Default
    private final Duration totalTimeout = Duration.ofSeconds(90);

    public static PoolConfig defaults() {
        return PoolConfig.builder().build();
    }

    /**
     * Tuned for the org REST API: fewer connections, longer-lived and more patient.
     */
    public static PoolConfig restApi() {
        return PoolConfig.builder()
            .maxTotal(50)
            .maxPerRoute(20)
            .keepAlive(Duration.ofSeconds(90))
            .connectTimeout(Duration.ofSeconds(15))
            .readTimeout(Duration.ofSeconds(90))
            .totalTimeout(Duration.ofSeconds(120))
            .build();
    }
}
