package com.catalog.resolution.metrics;

import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ResolutionOutcome;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(EntityKind kind, ResolutionOutcome outcome, Duration duration) {
        // discarded
    }

    @Override
    public void recordCandidatesScored(EntityKind kind, int count) {
        // discarded
    }

    @Override
    public void incrementAliasMatched(EntityKind kind) {
        // discarded
    }

    @Override
    public void recordSimilarityScore(double score) {
        // discarded
    }

    @Override
    public void recordResultCount(int count) {
        // discarded
    }

    @Override
    public void recordCacheHit() {
        // discarded
    }

    @Override
    public void recordCacheMiss() {
        // discarded
    }
}
