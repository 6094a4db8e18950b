package com.telemetry.activity.tracing;

import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.core.model.SpanStatus;

import java.util.Map;

/**
 * Sentinel span returned when nothing is recording. Every method is safe to call and does nothing.
 */
public final class NoOpSpan implements Span {

    public static final NoOpSpan INSTANCE = new NoOpSpan();

    private NoOpSpan() {
    }

    @Override
    public String traceId() {
        return SpanContext.INVALID.traceId();
    }

    @Override
    public String spanId() {
        return SpanContext.INVALID.spanId();
    }

    @Override
    public String parentSpanId() {
        return null;
    }

    @Override
    public String name() {
        return "";
    }

    @Override
    public SpanKind kind() {
        return SpanKind.INTERNAL;
    }

    @Override
    public SpanContext spanContext() {
        return SpanContext.INVALID;
    }

    @Override
    public boolean isRecording() {
        return false;
    }

    @Override
    public boolean isStopped() {
        return true;
    }

    @Override
    public void setTag(String key, String value) {
    }

    @Override
    public Map<String, String> tags() {
        return Map.of();
    }

    @Override
    public void setStatus(SpanStatus status) {
    }

    @Override
    public void setStatus(SpanStatus status, String description) {
    }

    @Override
    public void recordException(Throwable t) {
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "NoOpSpan";
    }
}
