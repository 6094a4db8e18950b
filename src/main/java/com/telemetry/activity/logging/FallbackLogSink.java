package com.telemetry.activity.logging;

import com.telemetry.activity.core.model.ErrorInfo;
import com.telemetry.activity.core.model.LogLevel;
import com.telemetry.activity.core.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.function.Consumer;

/**
 * Local destination for log records written while no runtime is initialized.
 * Records go to the SLF4J logger {@value #LOGGER_NAME} with trace/span ids in the MDC,
 * so they are not lost even though nothing is exported.
 */
public class FallbackLogSink implements Consumer<LogRecord> {

    public static final String LOGGER_NAME = "com.telemetry.activity.fallback";

    private final Logger logger;

    public FallbackLogSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    FallbackLogSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void accept(LogRecord record) {
        try (LogContext ignored = LogContext.forRecord(record)) {
            logger.atLevel(toSlf4j(record.level())).log(render(record));
        }
    }

    static Level toSlf4j(LogLevel level) {
        return switch (level) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFORMATION -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR, CRITICAL -> Level.ERROR;
        };
    }

    static String render(LogRecord record) {
        ErrorInfo error = record.error();
        if (error == null) {
            return record.message();
        }
        StringBuilder text = new StringBuilder(record.message());
        text.append(" [");
        if (error.type() != null) {
            text.append(error.type()).append(": ");
        }
        text.append(error.message() != null ? error.message() : "").append(']');
        if (error.stackTrace() != null) {
            text.append(System.lineSeparator()).append(error.stackTrace());
        }
        return text.toString();
    }
}
