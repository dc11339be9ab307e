package com.reportpull.auth.session;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;

import org.apache.hc.client5.http.DnsResolver;
import org.apache.hc.client5.http.SystemDefaultDnsResolver;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Caches successful lookups for a fixed TTL. Failures are not cached.
 */
public class CachingDnsResolver implements DnsResolver {

    private final DnsResolver delegate;
    private final Cache<String, InetAddress[]> cache;

    public CachingDnsResolver(Duration ttl) {
        this(SystemDefaultDnsResolver.INSTANCE, ttl);
    }

    public CachingDnsResolver(DnsResolver delegate, Duration ttl) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(ttl)
            .build();
    }

    @Override
    public InetAddress[] resolve(String host) throws UnknownHostException {
        InetAddress[] cached = cache.getIfPresent(host);
        if (cached != null) {
            return cached.clone();
        }
        InetAddress[] resolved = delegate.resolve(host);
        cache.put(host, resolved.clone());
        return resolved;
    }

    @Override
    public String resolveCanonicalHostname(String host) throws UnknownHostException {
        return delegate.resolveCanonicalHostname(host);
    }

    long size() {
        return cache.estimatedSize();
    }
}
