package com.telemetry.activity.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timestamped annotation on a span.
 */
public record SpanEvent(String name, long epochNanos, Map<String, String> attributes) {

    public SpanEvent {
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    public static SpanEvent exception(ErrorInfo error, long epochNanos) {
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, "exception.type", error.type());
        putIfPresent(attributes, "exception.message", error.message());
        putIfPresent(attributes, "exception.stacktrace", error.stackTrace());
        return new SpanEvent("exception", epochNanos, attributes);
    }

    private static void putIfPresent(Map<String, String> attributes, String key, String value) {
        if (value != null) {
            attributes.put(key, value);
        }
    }
}
