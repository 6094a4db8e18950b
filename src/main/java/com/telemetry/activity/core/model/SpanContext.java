package com.telemetry.activity.core.model;

/**
 * Identity of a span, usable as a parent reference.
 *
 * @param traceId 32 hex chars
 * @param spanId  16 hex chars
 * @param remote  true when the context was extracted from another process
 */
public record SpanContext(String traceId, String spanId, boolean remote) {

    public static final SpanContext INVALID =
            new SpanContext("00000000000000000000000000000000", "0000000000000000", false);

    public static SpanContext local(String traceId, String spanId) {
        return new SpanContext(traceId, spanId, false);
    }

    public static SpanContext remote(String traceId, String spanId) {
        return new SpanContext(traceId, spanId, true);
    }

    public boolean isValid() {
        return Ids.isValidTraceId(traceId) && Ids.isValidSpanId(spanId);
    }
}
