package com.catalog.resolution.tracing;

import java.util.Map;

/**
 * Opens spans around catalog operations.
 * Resolvers emit one {@link #RESOLVE_SPAN} per call, tagged with the catalog kind and locale.
 */
public interface TracingService {

    String RESOLVE_SPAN = "catalog.resolve";

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
