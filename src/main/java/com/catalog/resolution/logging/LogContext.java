package com.catalog.resolution.logging;

import com.catalog.resolution.core.model.EntityKind;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scopes catalog fields onto the SLF4J MDC for the length of a try block.
 * On close each key gets back the value it had before, so a seed load running inside a
 * request keeps the request's fields afterwards.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, EntityKind.EXERCISE, "en")) {
 *     log.info("resolve.completed results={}", matches.size());
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String CATALOG_KIND = "catalogKind";
    public static final String LOCALE = "locale";
    public static final String OPERATION = "operation";
    public static final String SEED_ID = "seedId";

    // key -> value it replaced, null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, EntityKind kind, String locale) {
        return new LogContext()
                .bind(CORRELATION_ID, correlationId)
                .bind(CATALOG_KIND, kind.name())
                .bind(LOCALE, locale)
                .bind(OPERATION, "resolve");
    }

    public static LogContext forSeed(String seedId, EntityKind kind) {
        return new LogContext()
                .bind(SEED_ID, seedId)
                .bind(CATALOG_KIND, kind.name())
                .bind(OPERATION, "seed");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private LogContext bind(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
