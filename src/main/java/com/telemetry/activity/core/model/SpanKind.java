package com.telemetry.activity.core.model;

import java.util.Locale;

/**
 * Role of a span in a trace. Values map one-to-one onto the OTLP span kinds.
 */
public enum SpanKind {
    INTERNAL,
    SERVER,
    CLIENT,
    PRODUCER,
    CONSUMER;

    /**
     * Parses a kind name, ignoring case.
     *
     * @throws InvalidArgumentException if the name is null or not one of the known kinds
     */
    public static SpanKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Span kind must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (SpanKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new InvalidArgumentException("Unknown span kind '" + name + "'");
    }
}
