package com.catalog.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Emits catalog spans through an OpenTelemetry {@link Tracer}.
 * Export is left to whatever SDK the host application registered for that tracer.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder spanBuilder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            for (Map.Entry<String, String> tag : attributes.entrySet()) {
                spanBuilder.setAttribute(tag.getKey(), tag.getValue());
            }
        }
        return new OtelSpan(spanBuilder.startSpan());
    }

    private record OtelSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.ERROR ? StatusCode.ERROR : StatusCode.OK);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
