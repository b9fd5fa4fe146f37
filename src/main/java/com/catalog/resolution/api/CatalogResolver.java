package com.catalog.resolution.api;

import com.catalog.resolution.cache.NoOpResolutionCache;
import com.catalog.resolution.cache.ResolutionCache;
import com.catalog.resolution.cache.ResolutionCacheKey;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.MatchCandidate;
import com.catalog.resolution.core.model.MatchSource;
import com.catalog.resolution.core.model.ResolutionOutcome;
import com.catalog.resolution.logging.LogContext;
import com.catalog.resolution.metrics.MetricsService;
import com.catalog.resolution.metrics.NoOpMetricsService;
import com.catalog.resolution.normalization.TextNormalizer;
import com.catalog.resolution.similarity.BlockingKeyStrategy;
import com.catalog.resolution.similarity.TrigramBlockingKeyStrategy;
import com.catalog.resolution.similarity.TrigramProfile;
import com.catalog.resolution.similarity.TrigramSimilarity;
import com.catalog.resolution.store.AliasCandidate;
import com.catalog.resolution.store.CandidateHint;
import com.catalog.resolution.store.CandidateStore;
import com.catalog.resolution.store.CanonicalCandidate;
import com.catalog.resolution.store.CatalogChangeListener;
import com.catalog.resolution.store.CatalogWriter;
import com.catalog.resolution.store.StoreUnavailableException;
import com.catalog.resolution.tracing.NoOpTracingService;
import com.catalog.resolution.tracing.Span;
import com.catalog.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Resolves free text to the entities of one catalog.
 *
 * <p>A call normalizes the query, pulls canonical and alias candidates from the
 * {@link CandidateStore}, scores each with trigram similarity, keeps the best hit per
 * entity and returns the hits ranked by score, then display name, then entity id.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CatalogResolver resolver = CatalogResolver.builder()
 *     .candidateStore(store)
 *     .build();
 *
 * List&lt;MatchCandidate&gt; matches = resolver.resolve("hammer strength chest press");
 * List&lt;MatchCandidate&gt; top3 = resolver.resolve("lat pulldown", "en", 3, 0.3);
 * </pre>
 *
 * <p>The resolver holds no per-call state and is safe to share between threads.</p>
 */
public class CatalogResolver {
    private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);

    public static final int MAX_QUERY_LENGTH = 1000;

    /**
     * Picks the hit kept for an entity that matched more than once.
     * Brand and model only break ties between otherwise identical alias hits.
     */
    static final Comparator<MatchCandidate> PREFERENCE = Comparator
            .<MatchCandidate>comparingDouble(MatchCandidate::score).reversed()
            .thenComparing(MatchCandidate::source)
            .thenComparing(MatchCandidate::matchedText)
            .thenComparing(MatchCandidate::brand, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(MatchCandidate::model, Comparator.nullsFirst(Comparator.naturalOrder()));

    static final Comparator<MatchCandidate> RANKING = Comparator
            .<MatchCandidate>comparingDouble(MatchCandidate::score).reversed()
            .thenComparing(MatchCandidate::displayName)
            .thenComparing(MatchCandidate::entityId);

    private final CandidateStore store;
    private final EntityKind kind;
    private final TrigramSimilarity similarity;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ResolutionOptions defaultOptions;
    private final ResolutionCache cache;
    private final boolean cachingEnabled;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private CatalogResolver(Builder builder) {
        this.store = builder.candidateStore;
        this.kind = builder.candidateStore.kind();
        this.similarity = builder.similarity;
        this.blockingKeyStrategy = builder.blockingKeyStrategy;
        this.defaultOptions = builder.defaultOptions;
        this.cache = builder.resolutionCache;
        this.cachingEnabled = !(builder.resolutionCache instanceof NoOpResolutionCache);
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;

        if (cache instanceof CatalogChangeListener listener && store instanceof CatalogWriter writer) {
            writer.addChangeListener(listener);
        }
    }

    /**
     * Resolves a query with the default options.
     */
    public List<MatchCandidate> resolve(String rawQuery) {
        return resolve(rawQuery, defaultOptions);
    }

    /**
     * Resolves a query.
     *
     * @param rawQuery   free text as typed by the user
     * @param locale     locale of the aliases to consider
     * @param maxResults upper bound on the number of results, must be positive
     * @param minScore   score floor in [0,1]; hits scoring below it are dropped
     * @return ranked matches, at most one per entity, possibly empty
     * @throws InvalidQueryException     if the query is empty after trimming or too long
     * @throws InvalidArgumentException  if an argument is out of range
     * @throws StoreUnavailableException if the candidate store cannot be read
     */
    public List<MatchCandidate> resolve(String rawQuery, String locale, int maxResults, double minScore) {
        validateQuery(rawQuery);
        ResolutionOptions options = ResolutionOptions.builder(defaultOptions)
                .locale(locale)
                .maxResults(maxResults)
                .minScore(minScore)
                .build();
        return resolve(rawQuery, options);
    }

    /**
     * Resolves a query with explicit options.
     */
    public List<MatchCandidate> resolve(String rawQuery, ResolutionOptions options) {
        Objects.requireNonNull(options, "options is required");
        long start = System.nanoTime();
        String correlationId = LogContext.generateCorrelationId();

        try (LogContext ctx = LogContext.forResolution(correlationId, kind, options.getLocale());
             Span span = tracingService.startSpan(TracingService.RESOLVE_SPAN,
                     Map.of("catalog.kind", kind.name(), "catalog.locale", options.getLocale()))) {
            try {
                String query = validateQuery(rawQuery);
                ResolutionCacheKey cacheKey = new ResolutionCacheKey(kind, query, options.getLocale(),
                        options.getMaxResults(), options.getMinScore());

                boolean useCache = cachingEnabled && options.isUseCache();
                if (useCache) {
                    Optional<List<MatchCandidate>> cached = cache.get(cacheKey);
                    if (cached.isPresent()) {
                        List<MatchCandidate> hit = cached.get();
                        metricsService.recordCacheHit();
                        metricsService.recordResolutionDuration(kind, outcomeOf(hit),
                                Duration.ofNanos(System.nanoTime() - start));
                        metricsService.recordResultCount(hit.size());
                        span.setAttribute("cache.hit", "true");
                        span.setAttribute("result.count", hit.size());
                        span.setStatus(Span.SpanStatus.OK);
                        log.debug("resolve.cacheHit query={} results={}", query, hit.size());
                        return hit;
                    }
                    metricsService.recordCacheMiss();
                }

                long generation = useCache ? cache.generation() : 0L;
                List<MatchCandidate> matches = computeMatches(query, options, span);

                if (useCache) {
                    cache.put(cacheKey, matches, generation);
                }

                ResolutionOutcome outcome = outcomeOf(matches);
                metricsService.recordResolutionDuration(kind, outcome, Duration.ofNanos(System.nanoTime() - start));
                metricsService.recordResultCount(matches.size());
                if (!matches.isEmpty()) {
                    MatchCandidate top = matches.get(0);
                    metricsService.recordSimilarityScore(top.score());
                    if (top.isAliasMatch()) {
                        metricsService.incrementAliasMatched(kind);
                    }
                    span.setAttribute("top.score", top.score());
                }
                span.setAttribute("result.count", matches.size());
                span.setStatus(Span.SpanStatus.OK);
                log.debug("resolve.completed query={} results={} outcome={}", query, matches.size(), outcome);
                return matches;
            } catch (InvalidQueryException | InvalidArgumentException e) {
                metricsService.recordResolutionDuration(kind, ResolutionOutcome.INVALID_INPUT,
                        Duration.ofNanos(System.nanoTime() - start));
                span.setStatus(Span.SpanStatus.ERROR);
                log.debug("resolve.rejected reason={}", e.getMessage());
                throw e;
            } catch (StoreUnavailableException e) {
                metricsService.recordResolutionDuration(kind, ResolutionOutcome.STORE_UNAVAILABLE,
                        Duration.ofNanos(System.nanoTime() - start));
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.warn("resolve.storeUnavailable error={}", e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Returns an async view of this resolver backed by its own bounded executor.
     * The caller owns the returned resolver and must close it.
     */
    public AsyncCatalogResolver async() {
        return new AsyncCatalogResolverImpl(this, defaultOptions);
    }

    public EntityKind getKind() {
        return kind;
    }

    public ResolutionOptions getDefaultOptions() {
        return defaultOptions;
    }

    public CandidateStore getCandidateStore() {
        return store;
    }

    public ResolutionCache getCache() {
        return cache;
    }

    /**
     * Checks the raw query and returns its normalized form.
     */
    private static String validateQuery(String rawQuery) {
        if (rawQuery == null) {
            throw new InvalidQueryException("query is required");
        }
        if (rawQuery.length() > MAX_QUERY_LENGTH) {
            throw new InvalidQueryException("query exceeds " + MAX_QUERY_LENGTH + " characters");
        }
        String normalized = TextNormalizer.normalize(rawQuery);
        if (normalized.isEmpty()) {
            throw new InvalidQueryException("query must not be empty");
        }
        return normalized;
    }

    private static ResolutionOutcome outcomeOf(List<MatchCandidate> matches) {
        return matches.isEmpty() ? ResolutionOutcome.NO_MATCH : ResolutionOutcome.MATCHED;
    }

    private List<MatchCandidate> computeMatches(String query, ResolutionOptions options, Span span) {
        TrigramProfile queryProfile = TrigramProfile.of(query);
        CandidateHint hint = new CandidateHint(query, blockingKeyStrategy.generateKeys(query));
        double minScore = options.getMinScore();
        AtomicInteger scored = new AtomicInteger();

        List<MatchCandidate> canonicalHits;
        try (Stream<CanonicalCandidate> rows = store.canonicalCandidates(true, hint)) {
            canonicalHits = maybeParallel(rows, options)
                    .map(row -> scoreCanonical(queryProfile, row, minScore, scored))
                    .filter(Objects::nonNull)
                    .toList();
        }

        List<MatchCandidate> aliasHits;
        try (Stream<AliasCandidate> rows = store.aliasCandidates(options.getLocale(), true, hint)) {
            aliasHits = maybeParallel(rows, options)
                    .map(row -> scoreAlias(queryProfile, row, minScore, scored))
                    .filter(Objects::nonNull)
                    .toList();
        }

        Map<String, MatchCandidate> best = new LinkedHashMap<>();
        mergeBest(best, canonicalHits);
        mergeBest(best, aliasHits);

        List<MatchCandidate> ranked = best.values().stream()
                .sorted(RANKING)
                .limit(options.getMaxResults())
                .toList();

        metricsService.recordCandidatesScored(kind, scored.get());
        span.setAttribute("candidates.scored", scored.get());
        log.debug("resolve.scored query={} canonicalHits={} aliasHits={} entities={}",
                query, canonicalHits.size(), aliasHits.size(), best.size());
        return ranked;
    }

    private MatchCandidate scoreCanonical(TrigramProfile query, CanonicalCandidate row,
                                          double minScore, AtomicInteger scored) {
        TrigramProfile candidate = TrigramProfile.of(row.normalizedName());
        if (!similarity.isScorable(query, candidate)) {
            return null;
        }
        scored.incrementAndGet();
        double score = similarity.compute(query, candidate);
        if (score <= 0.0 || score < minScore) {
            return null;
        }
        return new MatchCandidate(row.entityId(), row.rawName(), row.rawName(),
                MatchSource.CANONICAL, score, null, null);
    }

    private MatchCandidate scoreAlias(TrigramProfile query, AliasCandidate row,
                                      double minScore, AtomicInteger scored) {
        TrigramProfile candidate = TrigramProfile.of(row.normalizedAlias());
        if (!similarity.isScorable(query, candidate)) {
            return null;
        }
        scored.incrementAndGet();
        double score = similarity.compute(query, candidate);
        if (score <= 0.0 || score < minScore) {
            return null;
        }
        return new MatchCandidate(row.entityId(), row.displayName(), row.rawAlias(),
                MatchSource.ALIAS, score, row.brand(), row.model());
    }

    private static void mergeBest(Map<String, MatchCandidate> best, List<MatchCandidate> hits) {
        for (MatchCandidate hit : hits) {
            best.merge(hit.entityId(), hit,
                    (current, challenger) -> PREFERENCE.compare(challenger, current) < 0 ? challenger : current);
        }
    }

    private static <T> Stream<T> maybeParallel(Stream<T> rows, ResolutionOptions options) {
        return options.isParallelScoring() ? rows.parallel() : rows;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for CatalogResolver.
     */
    public static class Builder {
        private CandidateStore candidateStore;
        private TrigramSimilarity similarity = new TrigramSimilarity();
        private BlockingKeyStrategy blockingKeyStrategy = new TrigramBlockingKeyStrategy();
        private ResolutionOptions defaultOptions = ResolutionOptions.defaults();
        private ResolutionCache resolutionCache = NoOpResolutionCache.INSTANCE;
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();

        public Builder candidateStore(CandidateStore candidateStore) {
            this.candidateStore = candidateStore;
            return this;
        }

        public Builder similarity(TrigramSimilarity similarity) {
            this.similarity = similarity;
            return this;
        }

        /**
         * Sets the strategy producing the prefilter keys handed to the store.
         * Every row sharing a trigram with the query must share a key with it.
         */
        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder defaultOptions(ResolutionOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        /**
         * Sets the result cache. A cache that is also a {@link CatalogChangeListener}
         * is registered with the store when the store accepts writes.
         */
        public Builder resolutionCache(ResolutionCache resolutionCache) {
            this.resolutionCache = resolutionCache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public CatalogResolver build() {
            if (candidateStore == null) {
                throw new IllegalStateException("Candidate store is required");
            }
            Objects.requireNonNull(similarity, "similarity is required");
            Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
            Objects.requireNonNull(defaultOptions, "defaultOptions is required");
            Objects.requireNonNull(resolutionCache, "resolutionCache is required");
            Objects.requireNonNull(metricsService, "metricsService is required");
            Objects.requireNonNull(tracingService, "tracingService is required");
            return new CatalogResolver(this);
        }
    }
}
