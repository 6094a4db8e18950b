package com.telemetry.activity.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @ParameterizedTest
    @CsvSource({
            "Trace, TRACE",
            "debug, DEBUG",
            "Information, INFORMATION",
            "info, INFORMATION",
            "Warning, WARNING",
            "WARN, WARNING",
            "error, ERROR",
            "Critical, CRITICAL",
            "fatal, CRITICAL"
    })
    @DisplayName("Should parse level names and OTLP severity texts")
    void parsesLevels(String input, LogLevel expected) {
        assertEquals(expected, LogLevel.parse(input));
    }

    @Test
    @DisplayName("Should reject unknown level")
    void rejectsUnknown() {
        assertThrows(InvalidArgumentException.class, () -> LogLevel.parse("Verbose"));
    }

    @Test
    @DisplayName("Levels should be ordered from Trace to Critical")
    void levelsAreOrdered() {
        assertTrue(LogLevel.CRITICAL.isAtLeast(LogLevel.ERROR));
        assertTrue(LogLevel.WARNING.isAtLeast(LogLevel.INFORMATION));
        assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFORMATION));
        assertTrue(LogLevel.TRACE.compareTo(LogLevel.DEBUG) < 0);
    }

    @Test
    @DisplayName("Severity numbers should follow the OTLP ranges")
    void severityNumbers() {
        assertEquals(1, LogLevel.TRACE.severityNumber());
        assertEquals(9, LogLevel.INFORMATION.severityNumber());
        assertEquals(21, LogLevel.CRITICAL.severityNumber());
        assertEquals("WARN", LogLevel.WARNING.severityText());
    }
}
