package com.catalog.resolution.metrics;

import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ResolutionOutcome;

import java.time.Duration;

/**
 * Measurements taken by a {@link com.catalog.resolution.api.CatalogResolver} on every call.
 * Resolvers default to {@link NoOpMetricsService}, so Micrometer is only needed on the
 * classpath when {@link MicrometerMetricsService} is wired in.
 */
public interface MetricsService {

    /** Wall time of one resolve call, including cache lookup and ranking. */
    void recordResolutionDuration(EntityKind kind, ResolutionOutcome outcome, Duration duration);

    /** Rows that passed the trigram prefilter and were scored. */
    void recordCandidatesScored(EntityKind kind, int count);

    /** The top-ranked hit came from an alias rather than the canonical name. */
    void incrementAliasMatched(EntityKind kind);

    void recordSimilarityScore(double score);

    void recordResultCount(int count);

    void recordCacheHit();

    void recordCacheMiss();
}
