package com.catalog.resolution.tracing;

/**
 * Handle on an open span. Closing it ends the span, so resolvers hold it in the
 * same try-with-resources block as their log context:
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, kind, locale);
 *      Span span = tracingService.startSpan(TracingService.RESOLVE_SPAN, tags)) {
 *     span.setAttribute("result.count", matches.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /** Ends the span. Never throws. */
    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
