package com.catalog.resolution.api;

import com.catalog.resolution.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link AsyncCatalogResolver} running on a fixed pool of daemon threads.
 * A timeout fails the returned future; the resolution itself runs to completion.
 */
public class AsyncCatalogResolverImpl implements AsyncCatalogResolver {
    private static final Logger log = LoggerFactory.getLogger(AsyncCatalogResolverImpl.class);

    private final CatalogResolver resolver;
    private final ResolutionOptions defaultOptions;
    private final ExecutorService executor;

    public AsyncCatalogResolverImpl(CatalogResolver resolver, ResolutionOptions defaultOptions) {
        this(resolver, defaultOptions, Runtime.getRuntime().availableProcessors());
    }

    public AsyncCatalogResolverImpl(CatalogResolver resolver, ResolutionOptions defaultOptions, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.resolver = resolver;
        this.defaultOptions = defaultOptions;
        this.executor = Executors.newFixedThreadPool(threads, new ResolverThreadFactory(resolver.getKind().getLabel()));
    }

    @Override
    public CompletableFuture<List<MatchCandidate>> resolveAsync(String query) {
        return resolveAsync(query, defaultOptions);
    }

    @Override
    public CompletableFuture<List<MatchCandidate>> resolveAsync(String query, ResolutionOptions options) {
        return CompletableFuture.supplyAsync(
                () -> resolver.resolve(query, options),
                executor
        ).orTimeout(options.getAsyncTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<List<MatchCandidate>>> resolveBatchAsync(List<ResolutionRequest> requests) {
        List<CompletableFuture<List<MatchCandidate>>> futures = requests.stream()
                .map(req -> resolveAsync(req.query(), optionsFor(req)))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public CompletableFuture<List<List<MatchCandidate>>> resolveBatchAsync(List<ResolutionRequest> requests,
                                                                           int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new InvalidArgumentException("maxConcurrency must be > 0");
        }

        Semaphore semaphore = new Semaphore(maxConcurrency);
        log.debug("resolveBatch.started requests={} maxConcurrency={}", requests.size(), maxConcurrency);

        List<CompletableFuture<List<MatchCandidate>>> futures = requests.stream()
                .map(req -> {
                    ResolutionOptions opts = optionsFor(req);
                    return CompletableFuture.supplyAsync(() -> {
                        try {
                            semaphore.acquire();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new CompletionException(e);
                        }
                        try {
                            return resolver.resolve(req.query(), opts);
                        } finally {
                            semaphore.release();
                        }
                    }, executor).orTimeout(opts.getAsyncTimeoutMs(), TimeUnit.MILLISECONDS);
                })
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    private ResolutionOptions optionsFor(ResolutionRequest request) {
        return request.options() != null ? request.options() : defaultOptions;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class ResolverThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private ResolverThreadFactory(String label) {
            this.prefix = "catalog-resolver-" + label.toLowerCase(Locale.ROOT) + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
