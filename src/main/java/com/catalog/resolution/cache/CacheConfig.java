package com.catalog.resolution.cache;

import java.time.Duration;

/**
 * Sizing of a resolver's result cache.
 *
 * <p>The TTL is the only bound on how long a result computed concurrently with a catalog
 * write can be served, so keep it short.</p>
 *
 * @param maxSize ranked result lists kept per resolver
 * @param ttl     how long a result list stays valid after it was computed
 * @param enabled false to resolve every query against the store
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public static final int DEFAULT_MAX_SIZE = 10_000;
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0, got " + maxSize);
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
    }

    public static CacheConfig ofSeconds(int maxSize, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got " + ttlSeconds);
        }
        return new CacheConfig(maxSize, Duration.ofSeconds(ttlSeconds), true);
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, DEFAULT_TTL, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, DEFAULT_TTL, false);
    }
}
