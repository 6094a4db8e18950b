package com.telemetry.activity.tracing;

import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.core.model.SpanStatus;

import java.util.Map;

/**
 * Handle to a unit of work in a trace.
 * Implements {@link AutoCloseable} so spans can be used in try-with-resources blocks,
 * which stops the span when the block exits.
 *
 * <p>Example usage:</p>
 * <pre>
 * try (Span span = tracingService.startSpan("checkout", SpanKind.SERVER)) {
 *     span.setTag("order.id", orderId);
 *     // ... do work ...
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 *
 * <p>Once a span is stopped its content is frozen: {@link #setTag}, {@link #setStatus} and
 * {@link #recordException} on a stopped span are silently ignored rather than raising,
 * so instrumentation cannot break the calling code.</p>
 */
public interface Span extends AutoCloseable {

    String traceId();

    String spanId();

    /**
     * @return the parent span id, or null for a root span
     */
    String parentSpanId();

    String name();

    SpanKind kind();

    SpanContext spanContext();

    /**
     * @return false for the no-op span handed out before initialization
     */
    boolean isRecording();

    boolean isStopped();

    /**
     * Sets a tag, replacing any earlier value for the same key. Ignored once stopped.
     */
    void setTag(String key, String value);

    /**
     * @return a copy of the tags in insertion order
     */
    Map<String, String> tags();

    void setStatus(SpanStatus status);

    void setStatus(SpanStatus status, String description);

    void recordException(Throwable t);

    /**
     * Stops the span. Calling it more than once has no further effect.
     */
    @Override
    void close();
}
