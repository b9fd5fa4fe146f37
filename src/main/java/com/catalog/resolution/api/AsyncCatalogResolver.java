package com.catalog.resolution.api;

import com.catalog.resolution.core.model.MatchCandidate;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Async interface for catalog resolution.
 * All methods return {@link CompletableFuture} for non-blocking operation.
 */
public interface AsyncCatalogResolver extends AutoCloseable {

    /**
     * Asynchronously resolves a query with the default options.
     */
    CompletableFuture<List<MatchCandidate>> resolveAsync(String query);

    /**
     * Asynchronously resolves a query with custom options.
     * The future fails with a {@link java.util.concurrent.TimeoutException} once the
     * options' async timeout elapses.
     */
    CompletableFuture<List<MatchCandidate>> resolveAsync(String query, ResolutionOptions options);

    /**
     * Resolves a batch of requests. Results are in request order.
     */
    CompletableFuture<List<List<MatchCandidate>>> resolveBatchAsync(List<ResolutionRequest> requests);

    /**
     * Resolves a batch of requests with bounded concurrency.
     *
     * @param requests       the resolution requests
     * @param maxConcurrency maximum number of concurrent resolutions
     */
    CompletableFuture<List<List<MatchCandidate>>> resolveBatchAsync(List<ResolutionRequest> requests,
                                                                    int maxConcurrency);

    @Override
    void close();
}
