package com.reportpull.auth.session;

import java.util.concurrent.TimeUnit;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;

/**
 * Pooled Apache clients: connection limits, cached DNS, bounded keep-alive and timeouts from {@link PoolConfig}.
 */
public class PooledHttpClientFactory implements HttpClientFactory {

    @Override
    public CloseableHttpClient create(PoolConfig config) {
        PoolingHttpClientConnectionManager manager = PoolingHttpClientConnectionManagerBuilder.create()
            .setMaxConnTotal(config.getMaxTotal())
            .setMaxConnPerRoute(config.getMaxPerRoute())
            .setDnsResolver(new CachingDnsResolver(config.getDnsCacheTtl()))
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .setSocketTimeout(Timeout.of(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .setTimeToLive(TimeValue.of(config.getKeepAlive().toMillis(), TimeUnit.MILLISECONDS))
                .build())
            .build();

        TimeValue keepAlive = TimeValue.of(config.getKeepAlive().toMillis(), TimeUnit.MILLISECONDS);
        return HttpClients.custom()
            .setConnectionManager(manager)
            .setKeepAliveStrategy((response, context) -> keepAlive)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .setResponseTimeout(Timeout.of(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .build())
            .evictExpiredConnections()
            .evictIdleConnections(keepAlive)
            .build();
    }
}
