package com.catalog.resolution.cdi;

import com.catalog.resolution.api.CatalogSearchService;
import com.catalog.resolution.cache.CaffeineResolutionCache;
import com.catalog.resolution.cache.NoOpResolutionCache;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.graph.GraphConnection;
import com.catalog.resolution.store.InMemoryCandidateStore;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("CatalogResolutionProducer Tests")
class CatalogResolutionProducerTest {

    private CatalogResolutionProducer producer;
    private Instance<GraphConnection> connection;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        producer = new CatalogResolutionProducer();
        producer.storeType = CatalogResolutionProducer.STORE_MEMORY;
        producer.defaultLocale = "en";
        producer.defaultMaxResults = 10;
        producer.defaultMinScore = 0.2;
        producer.parallelScoring = false;
        producer.asyncTimeoutMs = 30_000;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.metricsEnabled = false;
        producer.tracingEnabled = false;
        producer.exerciseSeed = Optional.of("catalog/exercises.json");
        producer.foodSeed = Optional.empty();
        connection = mock(Instance.class);
    }

    @Test
    @DisplayName("Memory store wiring seeds configured catalogs and never touches the graph")
    void memoryWiring() {
        CatalogSearchService service = producer.catalogSearchService(connection);

        assertTrue(service.supports(EntityKind.EXERCISE));
        assertTrue(service.supports(EntityKind.FOOD));
        assertInstanceOf(InMemoryCandidateStore.class, service.resolverFor(EntityKind.EXERCISE).getCandidateStore());
        assertEquals(7, ((InMemoryCandidateStore) service.resolverFor(EntityKind.EXERCISE).getCandidateStore()).entityCount());
        assertEquals(0, ((InMemoryCandidateStore) service.resolverFor(EntityKind.FOOD).getCandidateStore()).entityCount());
        assertEquals("ex-selectorized-lat-pulldown", service.search(EntityKind.EXERCISE, "lat pulldown").get(0).entityId());
        verifyNoInteractions(connection);
    }

    @Test
    @DisplayName("Configured defaults reach every resolver")
    void defaultsApplied() {
        CatalogSearchService service = producer.catalogSearchService(connection);

        assertEquals(10, service.resolverFor(EntityKind.FOOD).getDefaultOptions().getMaxResults());
        assertEquals(0.2, service.resolverFor(EntityKind.EXERCISE).getDefaultOptions().getMinScore());
        assertInstanceOf(CaffeineResolutionCache.class, service.resolverFor(EntityKind.FOOD).getCache());
        assertNotSame(service.resolverFor(EntityKind.FOOD).getCache(),
                service.resolverFor(EntityKind.EXERCISE).getCache());
    }

    @Test
    @DisplayName("Disabled cache wires the no-op cache")
    void cacheDisabled() {
        producer.cacheEnabled = false;

        CatalogSearchService service = producer.catalogSearchService(connection);

        assertInstanceOf(NoOpResolutionCache.class, service.resolverFor(EntityKind.EXERCISE).getCache());
    }

    @Test
    @DisplayName("Missing seed resource fails startup")
    void missingSeed() {
        producer.foodSeed = Optional.of("catalog/missing.json");

        assertThrows(UncheckedIOException.class, () -> producer.catalogSearchService(connection));
    }
}
