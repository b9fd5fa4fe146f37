package com.catalog.resolution.cache;

import com.catalog.resolution.core.model.MatchCandidate;
import com.catalog.resolution.store.CatalogChangeListener;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed resolution cache.
 *
 * <p>Registered as a {@link CatalogChangeListener}, it drops every entry on any catalog
 * mutation. Targeted invalidation is not possible here: a new alias can pull an entity
 * into the results of queries that never returned it before.</p>
 *
 * <p>Each change bumps a generation counter. A result computed under an older generation
 * is never kept, so a write racing with a resolution cannot leave a stale list behind.</p>
 */
public class CaffeineResolutionCache implements ResolutionCache, CatalogChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<ResolutionCacheKey, List<MatchCandidate>> cache;
    private final AtomicLong generation = new AtomicLong();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttl().toSeconds());
    }

    @Override
    public Optional<List<MatchCandidate>> get(ResolutionCacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(ResolutionCacheKey key, List<MatchCandidate> matches, long observedGeneration) {
        if (generation.get() != observedGeneration) {
            log.debug("cache.stalePutDropped observed={} current={}", observedGeneration, generation.get());
            return;
        }
        List<MatchCandidate> copy = List.copyOf(matches);
        cache.put(key, copy);
        // a change may have landed between the check and the put
        if (generation.get() != observedGeneration) {
            cache.asMap().remove(key, copy);
        }
    }

    @Override
    public long generation() {
        return generation.get();
    }

    @Override
    public void invalidateAll() {
        long dropped = cache.estimatedSize();
        cache.invalidateAll();
        log.debug("cache.invalidated entries={}", dropped);
    }

    @Override
    public CacheStats stats() {
        var counters = cache.stats();
        return new CacheStats(counters.hitCount(), counters.missCount(), counters.evictionCount(),
                cache.estimatedSize());
    }

    @Override
    public void onCatalogChanged(String entityId) {
        long current = generation.incrementAndGet();
        log.debug("cache.catalogChanged entityId={} generation={}", entityId, current);
        invalidateAll();
    }
}
