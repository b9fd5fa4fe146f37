package com.catalog.resolution.cache;

import com.catalog.resolution.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Stand-in when caching is off: every lookup misses and nothing is kept.
 */
public enum NoOpResolutionCache implements ResolutionCache {
    INSTANCE;

    @Override
    public Optional<List<MatchCandidate>> get(ResolutionCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(ResolutionCacheKey key, List<MatchCandidate> matches, long observedGeneration) {
        // not cached
    }

    @Override
    public long generation() {
        return 0;
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats stats() {
        return CacheStats.EMPTY;
    }
}
