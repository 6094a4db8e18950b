package com.telemetry.activity.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.core.model.SpanData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints finished spans and log records as single-line JSON, for watching telemetry
 * locally while it is also being exported.
 */
public class ConsoleEcho {
    private static final Logger log = LoggerFactory.getLogger(ConsoleEcho.class);

    private final String serviceName;
    private final PrintStream out;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ConsoleEcho(String serviceName) {
        this(serviceName, System.out);
    }

    public ConsoleEcho(String serviceName, PrintStream out) {
        this.serviceName = serviceName;
        this.out = out;
    }

    public void echo(SpanData span) {
        print(toFields(span));
    }

    public void echo(LogRecord record) {
        print(toFields(record));
    }

    Map<String, Object> toFields(SpanData span) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "span");
        fields.put("service", serviceName);
        fields.put("name", span.name());
        fields.put("kind", span.kind().name());
        fields.put("traceId", span.traceId());
        fields.put("spanId", span.spanId());
        if (span.hasParent()) {
            fields.put("parentSpanId", span.parentSpanId());
        }
        fields.put("start", toInstant(span.startEpochNanos()).toString());
        fields.put("durationMs", span.duration().toNanos() / 1_000_000.0);
        fields.put("status", span.status().name());
        if (span.statusDescription() != null) {
            fields.put("statusDescription", span.statusDescription());
        }
        if (!span.attributes().isEmpty()) {
            fields.put("tags", span.attributes());
        }
        return fields;
    }

    Map<String, Object> toFields(LogRecord record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "log");
        fields.put("service", serviceName);
        fields.put("timestamp", toInstant(record.epochNanos()).toString());
        fields.put("level", record.level().name());
        fields.put("message", record.message());
        if (record.isCorrelated()) {
            fields.put("traceId", record.traceId());
            fields.put("spanId", record.spanId());
        }
        if (record.error() != null) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("type", record.error().type());
            error.put("message", record.error().message());
            fields.put("error", error);
        }
        return fields;
    }

    private synchronized void print(Map<String, Object> fields) {
        try {
            out.println(objectMapper.writeValueAsString(fields));
        } catch (JsonProcessingException e) {
            log.warn("Failed to render console echo: {}", e.getMessage());
        }
    }

    private static Instant toInstant(long epochNanos) {
        return Instant.ofEpochSecond(0, epochNanos);
    }
}
