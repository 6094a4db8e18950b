package com.telemetry.activity.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SpanKindTest {

    @ParameterizedTest
    @CsvSource({
            "Internal, INTERNAL",
            "server, SERVER",
            "CLIENT, CLIENT",
            " Producer , PRODUCER",
            "consumer, CONSUMER"
    })
    @DisplayName("Should parse kind names ignoring case")
    void parsesKnownKinds(String input, SpanKind expected) {
        assertEquals(expected, SpanKind.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Interna", "span", "SERVER_SIDE", " "})
    @DisplayName("Should reject unknown kinds with InvalidArgumentException")
    void rejectsUnknownKinds(String input) {
        assertThrows(InvalidArgumentException.class, () -> SpanKind.parse(input));
    }

    @Test
    @DisplayName("Should reject null kind")
    void rejectsNull() {
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> SpanKind.parse(null));
        assertTrue(e.getMessage().contains("blank"));
    }
}
