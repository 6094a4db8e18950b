package com.telemetry.activity.logging;

import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.tracing.Span;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forSpan(span)) {
 *     log.info("payment.authorized amount={}", amount);
 * } // traceId and spanId are removed from the MDC again
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context carrying the identifiers of a recording span.
     * A null or non-recording span yields an empty context.
     */
    public static LogContext forSpan(Span span) {
        LogContext ctx = new LogContext();
        if (span != null && span.isRecording()) {
            ctx.put(TRACE_ID, span.traceId());
            ctx.put(SPAN_ID, span.spanId());
        }
        return ctx;
    }

    /**
     * Creates a log context carrying the correlation of a log record, if it has one.
     */
    public static LogContext forRecord(LogRecord record) {
        LogContext ctx = new LogContext();
        if (record.isCorrelated()) {
            ctx.put(TRACE_ID, record.traceId());
            ctx.put(SPAN_ID, record.spanId());
        }
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
