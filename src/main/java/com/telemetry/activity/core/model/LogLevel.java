package com.telemetry.activity.core.model;

import java.util.Locale;

/**
 * Ordered severity of a log record, lowest first.
 * Each level carries the OTLP severity number at the base of its range.
 */
public enum LogLevel {
    TRACE(1, "TRACE"),
    DEBUG(5, "DEBUG"),
    INFORMATION(9, "INFO"),
    WARNING(13, "WARN"),
    ERROR(17, "ERROR"),
    CRITICAL(21, "FATAL");

    private final int severityNumber;
    private final String severityText;

    LogLevel(int severityNumber, String severityText) {
        this.severityNumber = severityNumber;
        this.severityText = severityText;
    }

    public int severityNumber() {
        return severityNumber;
    }

    public String severityText() {
        return severityText;
    }

    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a level name, ignoring case. Accepts the enum names and the
     * OTLP severity texts ({@code INFO}, {@code WARN}, {@code FATAL}).
     *
     * @throws InvalidArgumentException if the name is not recognised
     */
    public static LogLevel parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Log level must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(normalized) || level.severityText.equals(normalized)) {
                return level;
            }
        }
        throw new InvalidArgumentException("Unknown log level '" + name + "'");
    }
}
