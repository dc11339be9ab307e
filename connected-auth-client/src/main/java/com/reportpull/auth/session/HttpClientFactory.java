package com.reportpull.auth.session;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;

@FunctionalInterface
public interface HttpClientFactory {

    CloseableHttpClient create(PoolConfig config);
}
