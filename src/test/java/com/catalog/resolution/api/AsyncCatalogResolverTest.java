package com.catalog.resolution.api;

import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.MatchCandidate;
import com.catalog.resolution.store.InMemoryCandidateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncCatalogResolverTest {

    private CatalogResolver resolver;
    private AsyncCatalogResolver async;

    @BeforeEach
    void setUp() {
        InMemoryCandidateStore store = new InMemoryCandidateStore(EntityKind.EXERCISE);
        for (String name : List.of("Chest Press (Plate-Loaded)", "Lat Pulldown (Selectorized)", "Treadmill Run")) {
            store.saveEntity(CatalogEntity.builder()
                    .kind(EntityKind.EXERCISE)
                    .displayName(name)
                    .build());
        }
        resolver = CatalogResolver.builder()
                .candidateStore(store)
                .build();
        async = resolver.async();
    }

    @AfterEach
    void tearDown() {
        async.close();
    }

    @Test
    @DisplayName("Should resolve asynchronously with the same result as a direct call")
    void testResolveAsync() throws Exception {
        List<MatchCandidate> matches = async.resolveAsync("chest press").get(10, TimeUnit.SECONDS);

        assertFalse(matches.isEmpty());
        assertEquals(resolver.resolve("chest press"), matches);
    }

    @Test
    @DisplayName("Should honor explicit options")
    void testResolveAsyncWithOptions() throws Exception {
        List<MatchCandidate> matches = async.resolveAsync("run", ResolutionOptions.of("en", 1, 0.0))
                .get(10, TimeUnit.SECONDS);

        assertEquals(1, matches.size());
        assertEquals("Treadmill Run", matches.get(0).displayName());
    }

    @Test
    @DisplayName("Should resolve a batch, preserving request order")
    void testResolveBatchAsync() throws Exception {
        List<ResolutionRequest> requests = List.of(
                ResolutionRequest.of("treadmill"),
                ResolutionRequest.of("pulldown"),
                new ResolutionRequest("chest", ResolutionOptions.of("en", 1, 0.0)));

        List<List<MatchCandidate>> results = async.resolveBatchAsync(requests).get(10, TimeUnit.SECONDS);

        assertEquals(3, results.size());
        assertEquals("Treadmill Run", results.get(0).get(0).displayName());
        assertEquals("Lat Pulldown (Selectorized)", results.get(1).get(0).displayName());
        assertEquals(1, results.get(2).size());
    }

    @Test
    @DisplayName("Should resolve a batch under a concurrency limit")
    void testResolveBatchWithLimit() throws Exception {
        List<ResolutionRequest> requests = List.of(
                ResolutionRequest.of("press"),
                ResolutionRequest.of("run"),
                ResolutionRequest.of("lat"),
                ResolutionRequest.of("xyzzy"));

        List<List<MatchCandidate>> results = async.resolveBatchAsync(requests, 2).get(10, TimeUnit.SECONDS);

        assertEquals(4, results.size());
        assertTrue(results.get(3).isEmpty());
    }

    @Test
    @DisplayName("Should reject a non-positive concurrency limit")
    void testInvalidConcurrency() {
        assertThrows(InvalidArgumentException.class,
                () -> async.resolveBatchAsync(List.of(ResolutionRequest.of("press")), 0));
    }

    @Test
    @DisplayName("Should complete exceptionally on an invalid query")
    void testInvalidQueryFailsFuture() {
        CompletableFuture<List<MatchCandidate>> future = async.resolveAsync("   ");

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        assertInstanceOf(InvalidQueryException.class, e.getCause());
    }
}
