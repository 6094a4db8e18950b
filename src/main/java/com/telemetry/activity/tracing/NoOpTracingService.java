package com.telemetry.activity.tracing;

import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanKind;

import java.util.Optional;

/**
 * No-op implementation of {@link TracingService}.
 * All start methods return the shared {@link NoOpSpan}.
 */
public class NoOpTracingService implements TracingService {

    public static final NoOpTracingService INSTANCE = new NoOpTracingService();

    @Override
    public Span startSpan(String name, SpanKind kind) {
        return NoOpSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String name, SpanKind kind, Span parent) {
        return NoOpSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String name, SpanKind kind, SpanContext parent) {
        return NoOpSpan.INSTANCE;
    }

    @Override
    public void stopSpan(Span span) {
    }

    @Override
    public void stopCurrentSpan() {
    }

    @Override
    public Optional<Span> currentSpan() {
        return Optional.empty();
    }
}
