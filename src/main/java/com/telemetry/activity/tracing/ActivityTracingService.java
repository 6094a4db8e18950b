package com.telemetry.activity.tracing;

import com.telemetry.activity.context.ContextStack;
import com.telemetry.activity.core.model.Clock;
import com.telemetry.activity.core.model.Ids;
import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanData;
import com.telemetry.activity.core.model.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Recording implementation of {@link TracingService}.
 *
 * <p>Started spans are pushed onto the {@link ContextStack}; stopping a span pops it
 * (only if it is current) and hands the finished {@link SpanData} to the sink given at
 * construction, normally the export pipeline.</p>
 */
public class ActivityTracingService implements TracingService {
    private static final Logger log = LoggerFactory.getLogger(ActivityTracingService.class);

    private static final String UNNAMED = "unnamed";

    private final ContextStack contextStack;
    private final Clock clock;
    private final Consumer<SpanData> finishedSpans;

    public ActivityTracingService(ContextStack contextStack, Consumer<SpanData> finishedSpans) {
        this(contextStack, Clock.SYSTEM, finishedSpans);
    }

    public ActivityTracingService(ContextStack contextStack, Clock clock, Consumer<SpanData> finishedSpans) {
        this.contextStack = contextStack;
        this.clock = clock;
        this.finishedSpans = finishedSpans;
    }

    @Override
    public Span startSpan(String name, SpanKind kind) {
        return startSpan(name, kind, (Span) null);
    }

    @Override
    public Span startSpan(String name, SpanKind kind, Span parent) {
        Span effectiveParent = parent != null ? parent : contextStack.current().orElse(null);
        SpanContext parentContext = effectiveParent != null && effectiveParent.isRecording()
                ? effectiveParent.spanContext()
                : null;
        return start(name, kind, parentContext);
    }

    @Override
    public Span startSpan(String name, SpanKind kind, SpanContext parent) {
        return start(name, kind, parent);
    }

    @Override
    public void stopSpan(Span span) {
        if (!(span instanceof ActivitySpan)) {
            return;
        }
        ActivitySpan activitySpan = (ActivitySpan) span;
        if (activitySpan.owner() != this) {
            // started by a runtime that has since been replaced
            activitySpan.owner().stopSpan(activitySpan);
            return;
        }
        SpanData finished = activitySpan.end(clock.nowEpochNanos());
        if (finished == null) {
            return;
        }
        contextStack.pop(activitySpan);
        log.debug("Span stopped name={} traceId={} spanId={} duration={}",
                finished.name(), finished.traceId(), finished.spanId(), finished.duration());
        try {
            finishedSpans.accept(finished);
        } catch (RuntimeException e) {
            log.warn("Failed to hand off finished span {}: {}", finished.spanId(), e.getMessage());
        }
    }

    @Override
    public void stopCurrentSpan() {
        contextStack.current().ifPresent(this::stopSpan);
    }

    @Override
    public Optional<Span> currentSpan() {
        return contextStack.current();
    }

    public ContextStack contextStack() {
        return contextStack;
    }

    long now() {
        return clock.nowEpochNanos();
    }

    private Span start(String name, SpanKind kind, SpanContext parent) {
        SpanKind effectiveKind = kind != null ? kind : SpanKind.INTERNAL;
        String effectiveName = name == null || name.isBlank() ? UNNAMED : name;
        boolean hasParent = parent != null && parent.isValid();
        String traceId = hasParent ? parent.traceId() : Ids.newTraceId();
        String parentSpanId = hasParent ? parent.spanId() : null;

        ActivitySpan span = new ActivitySpan(this, traceId, Ids.newSpanId(), parentSpanId,
                effectiveName, effectiveKind, clock.nowEpochNanos());
        contextStack.push(span);
        log.debug("Span started name={} kind={} traceId={} spanId={} parentSpanId={}",
                effectiveName, effectiveKind, traceId, span.spanId(), parentSpanId);
        return span;
    }
}
