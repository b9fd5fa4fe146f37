package com.catalog.resolution.cdi;

import com.catalog.resolution.api.CatalogResolver;
import com.catalog.resolution.api.CatalogSearchService;
import com.catalog.resolution.api.ResolutionOptions;
import com.catalog.resolution.cache.CacheConfig;
import com.catalog.resolution.cache.CaffeineResolutionCache;
import com.catalog.resolution.cache.NoOpResolutionCache;
import com.catalog.resolution.cache.ResolutionCache;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.graph.FalkorDBConnection;
import com.catalog.resolution.graph.GraphCandidateStore;
import com.catalog.resolution.graph.GraphConnection;
import com.catalog.resolution.metrics.MetricsService;
import com.catalog.resolution.metrics.MicrometerMetricsService;
import com.catalog.resolution.metrics.NoOpMetricsService;
import com.catalog.resolution.seed.JsonCatalogSeedLoader;
import com.catalog.resolution.seed.SeedResult;
import com.catalog.resolution.store.CandidateStore;
import com.catalog.resolution.store.CatalogWriter;
import com.catalog.resolution.store.InMemoryCandidateStore;
import com.catalog.resolution.tracing.NoOpTracingService;
import com.catalog.resolution.tracing.OpenTelemetryTracingService;
import com.catalog.resolution.tracing.TracingService;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * CDI producer that wires the catalog resolvers from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * catalog-resolution.store.type=falkordb        # or memory
 * catalog-resolution.falkordb.host=localhost
 * catalog-resolution.falkordb.port=6379
 * catalog-resolution.falkordb.graph-name=catalog
 * catalog-resolution.seed.exercises=catalog/exercises.json
 * </pre>
 *
 * <p>Inject {@link CatalogSearchService} to search both catalogs.</p>
 */
@ApplicationScoped
public class CatalogResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(CatalogResolutionProducer.class);

    static final String STORE_FALKORDB = "falkordb";
    static final String STORE_MEMORY = "memory";

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-resolution.store.type", defaultValue = STORE_FALKORDB)
    String storeType;

    @Inject
    @ConfigProperty(name = "catalog-resolution.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "catalog-resolution.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "catalog-resolution.falkordb.graph-name", defaultValue = "catalog")
    String falkordbGraphName;

    // ── Resolution defaults ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-resolution.resolution.locale", defaultValue = "en")
    String defaultLocale;

    @Inject
    @ConfigProperty(name = "catalog-resolution.resolution.max-results", defaultValue = "25")
    int defaultMaxResults;

    @Inject
    @ConfigProperty(name = "catalog-resolution.resolution.min-score", defaultValue = "0.0")
    double defaultMinScore;

    @Inject
    @ConfigProperty(name = "catalog-resolution.resolution.parallel-scoring", defaultValue = "false")
    boolean parallelScoring;

    @Inject
    @ConfigProperty(name = "catalog-resolution.resolution.async-timeout-ms", defaultValue = "30000")
    long asyncTimeoutMs;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "catalog-resolution.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "catalog-resolution.cache.ttl-seconds", defaultValue = "60")
    int cacheTtlSeconds;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-resolution.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "catalog-resolution.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    // ── Seed data ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-resolution.seed.exercises")
    Optional<String> exerciseSeed;

    @Inject
    @ConfigProperty(name = "catalog-resolution.seed.foods")
    Optional<String> foodSeed;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        FalkorDBConnection connection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
        if (!connection.ping()) {
            log.warn("producer.graphUnreachable graph={} host={} port={}",
                    connection.graphName(), falkordbHost, falkordbPort);
        }
        connection.ensureCatalogIndexes();
        return connection;
    }

    public void closeConnection(@Disposes GraphConnection connection) {
        log.info("producer.closingGraph graph={}", connection.graphName());
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public CatalogSearchService catalogSearchService(Instance<GraphConnection> connection) {
        ResolutionOptions options = ResolutionOptions.builder()
                .locale(defaultLocale)
                .maxResults(defaultMaxResults)
                .minScore(defaultMinScore)
                .parallelScoring(parallelScoring)
                .asyncTimeoutMs(asyncTimeoutMs)
                .build();
        MetricsService metrics = metricsEnabled
                ? new MicrometerMetricsService(Metrics.globalRegistry)
                : new NoOpMetricsService();
        TracingService tracing = tracingEnabled
                ? new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer("catalog-resolution"))
                : new NoOpTracingService();

        Map<EntityKind, CatalogResolver> resolvers = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            CandidateStore store = createStore(kind, connection);
            seed(kind, store);
            resolvers.put(kind, CatalogResolver.builder()
                    .candidateStore(store)
                    .defaultOptions(options)
                    .resolutionCache(createCache())
                    .metricsService(metrics)
                    .tracingService(tracing)
                    .build());
        }
        log.info("Catalog search ready: store={} cache={} metrics={} tracing={}",
                storeType, cacheEnabled, metricsEnabled, tracingEnabled);
        return new CatalogSearchService(resolvers);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private CandidateStore createStore(EntityKind kind, Instance<GraphConnection> connection) {
        if (STORE_MEMORY.equalsIgnoreCase(storeType)) {
            return new InMemoryCandidateStore(kind);
        }
        if (!STORE_FALKORDB.equalsIgnoreCase(storeType)) {
            log.warn("Unknown store type '{}', falling back to {}", storeType, STORE_FALKORDB);
        }
        return new GraphCandidateStore(connection.get(), kind);
    }

    private ResolutionCache createCache() {
        if (!cacheEnabled) {
            return NoOpResolutionCache.INSTANCE;
        }
        return new CaffeineResolutionCache(CacheConfig.ofSeconds(cacheMaxSize, cacheTtlSeconds));
    }

    private void seed(EntityKind kind, CandidateStore store) {
        Optional<String> resource = kind == EntityKind.EXERCISE ? exerciseSeed : foodSeed;
        if (resource.isEmpty() || !(store instanceof CatalogWriter writer)) {
            return;
        }
        try {
            SeedResult result = new JsonCatalogSeedLoader().loadResource(resource.get(), writer);
            log.info("Seeded {} catalog from {}: {}", kind, resource.get(), result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load seed " + resource.get(), e);
        }
    }
}
