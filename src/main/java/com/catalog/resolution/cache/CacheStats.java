package com.catalog.resolution.cache;

/**
 * Point-in-time counters of a {@link ResolutionCache}.
 *
 * @param hits      lookups answered from the cache
 * @param misses    lookups that fell through to the store
 * @param evictions entries dropped for size or age
 * @param entries   approximate number of cached result lists
 */
public record CacheStats(long hits, long misses, long evictions, long entries) {

    static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    public long lookups() {
        return hits + misses;
    }

    public double hitRate() {
        return lookups() == 0 ? 0.0 : (double) hits / lookups();
    }
}
