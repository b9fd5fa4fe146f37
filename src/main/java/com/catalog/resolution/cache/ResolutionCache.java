package com.catalog.resolution.cache;

import com.catalog.resolution.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Holds ranked result lists keyed by everything a resolution depends on.
 * A cached list must be exactly what an uncached call would return.
 */
public interface ResolutionCache {

    Optional<List<MatchCandidate>> get(ResolutionCacheKey key);

    /**
     * Stores a ranked list. Empty lists are stored too, so repeated misspellings
     * do not hit the store.
     */
    default void put(ResolutionCacheKey key, List<MatchCandidate> matches) {
        put(key, matches, generation());
    }

    /**
     * Stores a ranked list computed while the catalog was at {@code observedGeneration}.
     * The list is dropped if the catalog changed since then.
     */
    void put(ResolutionCacheKey key, List<MatchCandidate> matches, long observedGeneration);

    /**
     * Counter bumped on every catalog change. Read it before computing a result that
     * will be cached.
     */
    long generation();

    /** Drops every cached list. Called after any catalog write. */
    void invalidateAll();

    CacheStats stats();
}
