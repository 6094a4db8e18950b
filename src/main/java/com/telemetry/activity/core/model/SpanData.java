package com.telemetry.activity.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a stopped span, as handed to the export pipeline.
 *
 * @param parentSpanId null for root spans
 * @param attributes   tags in insertion order
 */
public record SpanData(
        String traceId,
        String spanId,
        String parentSpanId,
        String name,
        SpanKind kind,
        long startEpochNanos,
        long endEpochNanos,
        Map<String, String> attributes,
        List<SpanEvent> events,
        SpanStatus status,
        String statusDescription
) {

    public SpanData {
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
        events = events != null ? List.copyOf(events) : List.of();
        status = status != null ? status : SpanStatus.UNSET;
    }

    public boolean hasParent() {
        return parentSpanId != null;
    }

    public Duration duration() {
        return Duration.ofNanos(endEpochNanos - startEpochNanos);
    }
}
