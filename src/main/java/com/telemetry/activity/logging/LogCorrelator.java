package com.telemetry.activity.logging;

import com.telemetry.activity.context.ContextStack;
import com.telemetry.activity.core.model.Clock;
import com.telemetry.activity.core.model.ErrorInfo;
import com.telemetry.activity.core.model.LogLevel;
import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.tracing.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Builds log records and stamps them with the trace and span id of the span they belong to:
 * the span passed explicitly, otherwise the current span of the calling thread.
 * Records written outside any open span are left uncorrelated.
 */
public class LogCorrelator {
    private static final Logger log = LoggerFactory.getLogger(LogCorrelator.class);

    private final ContextStack contextStack;
    private final Clock clock;
    private final Consumer<LogRecord> sink;

    public LogCorrelator(ContextStack contextStack, Consumer<LogRecord> sink) {
        this(contextStack, Clock.SYSTEM, sink);
    }

    public LogCorrelator(ContextStack contextStack, Clock clock, Consumer<LogRecord> sink) {
        this.contextStack = contextStack;
        this.clock = clock;
        this.sink = sink;
    }

    public LogRecord write(String message, LogLevel level) {
        return write(message, level, (ErrorInfo) null, null);
    }

    public LogRecord write(String message, LogLevel level, Throwable error) {
        return write(message, level, error != null ? ErrorInfo.from(error) : null, null);
    }

    /**
     * @param error optional error payload
     * @param span  optional span to correlate with; the current span when null
     */
    public LogRecord write(String message, LogLevel level, ErrorInfo error, Span span) {
        Span target = span != null ? span : contextStack.current().orElse(null);
        boolean correlated = target != null && !target.isStopped();
        LogRecord record = new LogRecord(
                clock.nowEpochNanos(),
                level != null ? level : LogLevel.INFORMATION,
                message,
                error,
                correlated ? target.traceId() : null,
                correlated ? target.spanId() : null);
        try {
            sink.accept(record);
        } catch (RuntimeException e) {
            log.warn("Failed to hand off log record: {}", e.getMessage());
        }
        return record;
    }
}
