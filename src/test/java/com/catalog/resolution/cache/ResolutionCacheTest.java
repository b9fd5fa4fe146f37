package com.catalog.resolution.cache;

import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.MatchCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCacheTest {

    private static ResolutionCacheKey key(EntityKind kind, String query) {
        return new ResolutionCacheKey(kind, query, "en", 25, 0.0);
    }

    private static List<MatchCandidate> matches(String entityId, String displayName) {
        return List.of(MatchCandidate.canonical(entityId, displayName, 1.0));
    }

    @Nested
    @DisplayName("NoOpResolutionCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpResolutionCache cache = NoOpResolutionCache.INSTANCE;
            cache.put(key(EntityKind.FOOD, "egg"), matches("e1", "Egg, whole, raw"));
            assertTrue(cache.get(key(EntityKind.FOOD, "egg")).isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = NoOpResolutionCache.INSTANCE.stats();
            assertEquals(0, stats.hits());
            assertEquals(0, stats.misses());
            assertEquals(0, stats.entries());
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineResolutionCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache and retrieve results")
        void testPutAndGet() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(key(EntityKind.EXERCISE, "lat pulldown"), matches("lat", "Lat Pulldown (Selectorized)"));

            Optional<List<MatchCandidate>> cached = cache.get(key(EntityKind.EXERCISE, "lat pulldown"));

            assertTrue(cached.isPresent());
            assertEquals("lat", cached.get().get(0).entityId());
        }

        @Test
        @DisplayName("Should cache empty result lists")
        void testEmptyListCached() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(key(EntityKind.EXERCISE, "xyzzy"), List.of());

            Optional<List<MatchCandidate>> cached = cache.get(key(EntityKind.EXERCISE, "xyzzy"));
            assertTrue(cached.isPresent());
            assertTrue(cached.get().isEmpty());
        }

        @Test
        @DisplayName("Should separate entries by every key component")
        void testKeyComponents() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(key(EntityKind.FOOD, "egg"), matches("e1", "Egg, whole, raw"));

            assertTrue(cache.get(key(EntityKind.EXERCISE, "egg")).isEmpty());
            assertTrue(cache.get(new ResolutionCacheKey(EntityKind.FOOD, "egg", "fr", 25, 0.0)).isEmpty());
            assertTrue(cache.get(new ResolutionCacheKey(EntityKind.FOOD, "egg", "en", 5, 0.0)).isEmpty());
            assertTrue(cache.get(new ResolutionCacheKey(EntityKind.FOOD, "egg", "en", 25, 0.3)).isEmpty());
        }

        @Test
        @DisplayName("Stored lists are not affected by later changes to the caller's list")
        void testDefensiveCopy() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            List<MatchCandidate> source = new ArrayList<>(matches("e1", "Egg, whole, raw"));
            cache.put(key(EntityKind.FOOD, "egg"), source);
            source.clear();

            assertEquals(1, cache.get(key(EntityKind.FOOD, "egg")).orElseThrow().size());
        }

        @Test
        @DisplayName("Any catalog change drops every entry")
        void testInvalidateOnChange() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(key(EntityKind.FOOD, "egg"), matches("e1", "Egg, whole, raw"));
            cache.put(key(EntityKind.FOOD, "yogurt"), matches("y1", "Greek yogurt, plain"));

            cache.onCatalogChanged("some-other-entity");

            assertTrue(cache.get(key(EntityKind.FOOD, "egg")).isEmpty());
            assertTrue(cache.get(key(EntityKind.FOOD, "yogurt")).isEmpty());
        }

        @Test
        @DisplayName("A result computed before a catalog change is not kept")
        void testStalePutDropped() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            long observed = cache.generation();

            cache.onCatalogChanged("e1");
            cache.put(key(EntityKind.FOOD, "egg"), matches("e1", "Egg, whole, raw"), observed);

            assertEquals(observed + 1, cache.generation());
            assertTrue(cache.get(key(EntityKind.FOOD, "egg")).isEmpty());

            cache.put(key(EntityKind.FOOD, "egg"), matches("e1", "Egg, whole, raw"), cache.generation());
            assertTrue(cache.get(key(EntityKind.FOOD, "egg")).isPresent());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(key(EntityKind.FOOD, "egg"), matches("e1", "Egg, whole, raw"));

            cache.get(key(EntityKind.FOOD, "egg"));
            cache.get(key(EntityKind.FOOD, "egg"));
            cache.get(key(EntityKind.FOOD, "milk"));

            CacheStats stats = cache.stats();
            assertEquals(2, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(3, stats.lookups());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Defaults hold 10,000 entries for 60 seconds")
        void testDefaults() {
            CacheConfig config = CacheConfig.defaults();
            assertEquals(10_000, config.maxSize());
            assertEquals(Duration.ofSeconds(60), config.ttl());
            assertTrue(config.enabled());
            assertFalse(CacheConfig.disabled().enabled());
        }

        @Test
        @DisplayName("Should reject non-positive bounds")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, Duration.ofSeconds(60), true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
            assertThrows(IllegalArgumentException.class, () -> CacheConfig.ofSeconds(10, 0));
        }

        @Test
        @DisplayName("ofSeconds builds an enabled config")
        void testOfSeconds() {
            CacheConfig config = CacheConfig.ofSeconds(500, 15);
            assertEquals(500, config.maxSize());
            assertEquals(Duration.ofSeconds(15), config.ttl());
            assertTrue(config.enabled());
        }
    }
}
