package com.telemetry.activity.tracing;

import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanKind;

import java.util.Map;
import java.util.Optional;

/**
 * Creates, tags and stops spans, tracking the current span of each call chain.
 * The {@link NoOpTracingService} hands out {@link NoOpSpan} and records nothing.
 *
 * <p>None of these methods throw for runtime conditions. The only failure is an
 * unknown kind passed as text, reported with
 * {@link com.telemetry.activity.core.model.InvalidArgumentException}.</p>
 */
public interface TracingService {

    /**
     * Starts an {@link SpanKind#INTERNAL} span under the current span.
     */
    default Span startSpan(String name) {
        return startSpan(name, SpanKind.INTERNAL);
    }

    default Span startSpan(String name, Map<String, String> tags) {
        Span span = startSpan(name);
        if (tags != null) {
            tags.forEach(span::setTag);
        }
        return span;
    }

    /**
     * Starts a span under the current span, or as a new root if there is none.
     */
    Span startSpan(String name, SpanKind kind);

    /**
     * Starts a span under an explicit parent. A null parent means the current span;
     * a non-recording parent starts a new trace.
     */
    Span startSpan(String name, SpanKind kind, Span parent);

    /**
     * Starts a span under a parent known only by its identity, for example one extracted
     * from an incoming {@code traceparent} header. A null or invalid context starts a new trace.
     */
    Span startSpan(String name, SpanKind kind, SpanContext parent);

    default Span startSpan(String name, String kind, Span parent) {
        return startSpan(name, SpanKind.parse(kind), parent);
    }

    /**
     * Sets a tag on an open span. Tags set after the span stopped are dropped.
     */
    default void setTag(Span span, String key, String value) {
        if (span != null) {
            span.setTag(key, value);
        }
    }

    /**
     * Stops the span. Idempotent.
     */
    void stopSpan(Span span);

    /**
     * Stops the current span, if any.
     */
    void stopCurrentSpan();

    Optional<Span> currentSpan();
}
