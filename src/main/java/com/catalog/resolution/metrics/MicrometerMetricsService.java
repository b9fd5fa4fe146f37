package com.catalog.resolution.metrics;

import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ResolutionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes resolver measurements to a Micrometer {@link MeterRegistry}.
 *
 * <table>
 *   <caption>Meters</caption>
 *   <tr><th>Name</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>catalog.resolution.duration</td><td>timer</td><td>kind, outcome</td></tr>
 *   <tr><td>catalog.candidates.scored</td><td>summary</td><td>kind</td></tr>
 *   <tr><td>catalog.matched.alias</td><td>counter</td><td>kind</td></tr>
 *   <tr><td>catalog.similarity.score</td><td>summary</td><td></td></tr>
 *   <tr><td>catalog.result.count</td><td>summary</td><td></td></tr>
 *   <tr><td>catalog.cache.hit, catalog.cache.miss</td><td>counter</td><td></td></tr>
 * </table>
 *
 * <p>Tagged meters are registered the first time a kind or outcome is seen, so a
 * deployment that only serves foods never exports exercise series.</p>
 */
public class MicrometerMetricsService implements MetricsService {

    private static final String TAG_KIND = "kind";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final Map<DurationKey, Timer> durations = new ConcurrentHashMap<>();
    private final Map<EntityKind, DistributionSummary> scoredPerKind = new ConcurrentHashMap<>();
    private final Map<EntityKind, Counter> aliasWinsPerKind = new ConcurrentHashMap<>();
    private final DistributionSummary topScores;
    private final DistributionSummary resultCounts;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.topScores = DistributionSummary.builder("catalog.similarity.score")
                .description("Best similarity score of each resolution that matched")
                .register(registry);
        this.resultCounts = DistributionSummary.builder("catalog.result.count")
                .description("Matches returned per resolution")
                .register(registry);
        this.cacheHits = Counter.builder("catalog.cache.hit")
                .description("Resolutions answered from the result cache")
                .register(registry);
        this.cacheMisses = Counter.builder("catalog.cache.miss")
                .description("Resolutions that had to query the catalog store")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(EntityKind kind, ResolutionOutcome outcome, Duration duration) {
        durations.computeIfAbsent(new DurationKey(kind, outcome), key ->
                Timer.builder("catalog.resolution.duration")
                        .description("Time spent resolving a free-text query")
                        .tag(TAG_KIND, key.kind().name())
                        .tag(TAG_OUTCOME, key.outcome().name())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordCandidatesScored(EntityKind kind, int count) {
        scoredPerKind.computeIfAbsent(kind, k ->
                DistributionSummary.builder("catalog.candidates.scored")
                        .description("Canonical and alias rows scored per resolution")
                        .tag(TAG_KIND, k.name())
                        .register(registry))
                .record(count);
    }

    @Override
    public void incrementAliasMatched(EntityKind kind) {
        aliasWinsPerKind.computeIfAbsent(kind, k ->
                Counter.builder("catalog.matched.alias")
                        .description("Resolutions whose top match came from an alias")
                        .tag(TAG_KIND, k.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        topScores.record(score);
    }

    @Override
    public void recordResultCount(int count) {
        resultCounts.record(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    private record DurationKey(EntityKind kind, ResolutionOutcome outcome) {}
}
