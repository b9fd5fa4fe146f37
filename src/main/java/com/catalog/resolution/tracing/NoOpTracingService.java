package com.catalog.resolution.tracing;

import java.util.Map;

/**
 * Used when no tracer is configured. Hands out one shared inert span.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
            // ignored
        }

        @Override
        public void setAttribute(String key, long value) {
            // ignored
        }

        @Override
        public void setAttribute(String key, double value) {
            // ignored
        }

        @Override
        public void setStatus(SpanStatus status) {
            // ignored
        }

        @Override
        public void recordException(Throwable t) {
            // ignored
        }

        @Override
        public void close() {
            // nothing to end
        }
    }
}
