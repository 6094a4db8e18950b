package com.telemetry.activity.tracing;

import com.telemetry.activity.core.model.ErrorInfo;
import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanData;
import com.telemetry.activity.core.model.SpanEvent;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.core.model.SpanStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recording span created by {@link ActivityTracingService}.
 * Mutators and {@link #end(long)} synchronize on the span, so it may be tagged and
 * stopped from different threads.
 */
final class ActivitySpan implements Span {

    private final ActivityTracingService owner;
    private final SpanContext spanContext;
    private final String parentSpanId;
    private final String name;
    private final SpanKind kind;
    private final long startEpochNanos;

    private final Map<String, String> tags = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();
    private SpanStatus status = SpanStatus.UNSET;
    private String statusDescription;
    private boolean stopped;

    ActivitySpan(ActivityTracingService owner, String traceId, String spanId, String parentSpanId,
                 String name, SpanKind kind, long startEpochNanos) {
        this.owner = owner;
        this.spanContext = SpanContext.local(traceId, spanId);
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.kind = kind;
        this.startEpochNanos = startEpochNanos;
    }

    ActivityTracingService owner() {
        return owner;
    }

    @Override
    public String traceId() {
        return spanContext.traceId();
    }

    @Override
    public String spanId() {
        return spanContext.spanId();
    }

    @Override
    public String parentSpanId() {
        return parentSpanId;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SpanKind kind() {
        return kind;
    }

    @Override
    public SpanContext spanContext() {
        return spanContext;
    }

    @Override
    public boolean isRecording() {
        return true;
    }

    @Override
    public synchronized boolean isStopped() {
        return stopped;
    }

    @Override
    public synchronized void setTag(String key, String value) {
        if (stopped || key == null) {
            return;
        }
        tags.put(key, value != null ? value : "");
    }

    @Override
    public synchronized Map<String, String> tags() {
        return new LinkedHashMap<>(tags);
    }

    @Override
    public void setStatus(SpanStatus status) {
        setStatus(status, null);
    }

    @Override
    public synchronized void setStatus(SpanStatus status, String description) {
        if (stopped || status == null) {
            return;
        }
        this.status = status;
        this.statusDescription = status == SpanStatus.ERROR ? description : null;
    }

    @Override
    public void recordException(Throwable t) {
        if (t == null) {
            return;
        }
        SpanEvent event = SpanEvent.exception(ErrorInfo.from(t), owner.now());
        synchronized (this) {
            if (!stopped) {
                events.add(event);
            }
        }
    }

    @Override
    public void close() {
        owner.stopSpan(this);
    }

    /**
     * Freezes the span.
     *
     * @return the finished snapshot, or null if the span had already been stopped
     */
    synchronized SpanData end(long endEpochNanos) {
        if (stopped) {
            return null;
        }
        stopped = true;
        return new SpanData(spanContext.traceId(), spanContext.spanId(), parentSpanId, name, kind,
                startEpochNanos, Math.max(endEpochNanos, startEpochNanos), tags, events, status, statusDescription);
    }

    @Override
    public String toString() {
        return "ActivitySpan{name='" + name + "', traceId=" + traceId() + ", spanId=" + spanId() + '}';
    }
}
