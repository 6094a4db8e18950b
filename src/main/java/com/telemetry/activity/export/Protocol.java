package com.telemetry.activity.export;

import java.util.Locale;
import java.util.Optional;

/**
 * OTLP transport protocols supported by the export pipeline.
 */
public enum Protocol {
    GRPC("grpc"),
    HTTP_PROTOBUF("http-protobuf");

    private final String wireName;

    Protocol(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a protocol by name, ignoring case. {@code http/protobuf}, the spelling used by
     * {@code OTEL_EXPORTER_OTLP_PROTOCOL}, is accepted for {@link #HTTP_PROTOBUF}.
     */
    public static Optional<Protocol> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('/', '-');
        for (Protocol protocol : values()) {
            if (protocol.wireName.equals(normalized)) {
                return Optional.of(protocol);
            }
        }
        return Optional.empty();
    }
}
