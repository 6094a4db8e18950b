package com.telemetry.activity.core.model;

/**
 * A single log entry, optionally correlated to the span that was active when it was written.
 *
 * @param error   null when no error is attached
 * @param traceId null when uncorrelated
 * @param spanId  null when uncorrelated
 */
public record LogRecord(
        long epochNanos,
        LogLevel level,
        String message,
        ErrorInfo error,
        String traceId,
        String spanId
) {

    public LogRecord {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        message = message != null ? message : "";
    }

    public boolean isCorrelated() {
        return traceId != null && spanId != null;
    }
}
