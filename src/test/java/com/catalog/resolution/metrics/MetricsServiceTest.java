package com.catalog.resolution.metrics;

import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.core.model.ResolutionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolutionDuration(EntityKind.FOOD, ResolutionOutcome.MATCHED, Duration.ofMillis(3));
                noOp.recordCandidatesScored(EntityKind.FOOD, 12);
                noOp.incrementAliasMatched(EntityKind.EXERCISE);
                noOp.recordSimilarityScore(0.85);
                noOp.recordResultCount(4);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per kind and outcome")
        void recordResolutionDuration() {
            metrics.recordResolutionDuration(EntityKind.EXERCISE, ResolutionOutcome.MATCHED, Duration.ofMillis(15));
            metrics.recordResolutionDuration(EntityKind.EXERCISE, ResolutionOutcome.MATCHED, Duration.ofMillis(25));
            metrics.recordResolutionDuration(EntityKind.EXERCISE, ResolutionOutcome.NO_MATCH, Duration.ofMillis(5));

            Timer matched = registry.find("catalog.resolution.duration")
                    .tag("kind", "EXERCISE")
                    .tag("outcome", "MATCHED")
                    .timer();

            assertNotNull(matched);
            assertEquals(2, matched.count());
            assertEquals(40, matched.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertNull(registry.find("catalog.resolution.duration").tag("kind", "FOOD").timer());
        }

        @Test
        @DisplayName("Should summarize scored candidates per kind")
        void recordCandidatesScored() {
            metrics.recordCandidatesScored(EntityKind.FOOD, 10);
            metrics.recordCandidatesScored(EntityKind.FOOD, 30);

            DistributionSummary summary = registry.find("catalog.candidates.scored").tag("kind", "FOOD").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(40.0, summary.totalAmount(), 0.001);
        }

        @Test
        @DisplayName("Should count alias wins per kind")
        void incrementAliasMatched() {
            metrics.incrementAliasMatched(EntityKind.EXERCISE);
            metrics.incrementAliasMatched(EntityKind.EXERCISE);
            metrics.incrementAliasMatched(EntityKind.FOOD);

            Counter exercise = registry.find("catalog.matched.alias").tag("kind", "EXERCISE").counter();
            Counter food = registry.find("catalog.matched.alias").tag("kind", "FOOD").counter();

            assertEquals(2.0, exercise.count());
            assertEquals(1.0, food.count());
        }

        @Test
        @DisplayName("Should summarize top scores and result counts")
        void recordScoresAndCounts() {
            metrics.recordSimilarityScore(0.5);
            metrics.recordSimilarityScore(1.0);
            metrics.recordResultCount(0);
            metrics.recordResultCount(25);

            DistributionSummary scores = registry.find("catalog.similarity.score").summary();
            DistributionSummary counts = registry.find("catalog.result.count").summary();

            assertEquals(2, scores.count());
            assertEquals(1.0, scores.max(), 0.001);
            assertEquals(25.0, counts.totalAmount(), 0.001);
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("catalog.cache.hit").counter().count());
            assertEquals(1.0, registry.find("catalog.cache.miss").counter().count());
        }
    }
}
