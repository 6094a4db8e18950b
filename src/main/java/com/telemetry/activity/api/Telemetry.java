package com.telemetry.activity.api;

import com.telemetry.activity.context.TraceContextPropagation;
import com.telemetry.activity.core.model.Clock;
import com.telemetry.activity.core.model.ErrorInfo;
import com.telemetry.activity.core.model.LogLevel;
import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.export.PipelineState;
import com.telemetry.activity.logging.FallbackLogSink;
import com.telemetry.activity.tracing.NoOpSpan;
import com.telemetry.activity.tracing.NoOpTracingService;
import com.telemetry.activity.tracing.Span;
import com.telemetry.activity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide entry point holding at most one active {@link TelemetryRuntime}.
 *
 * <pre>
 * Telemetry.initialize("checkout", "http://localhost:4317", "grpc", false);
 * Span request = Telemetry.startSpan("handle-request", SpanKind.SERVER);
 * Telemetry.writeLog("cart loaded", LogLevel.INFORMATION);
 * Telemetry.stopSpan(request);
 * Telemetry.shutdown();
 * </pre>
 *
 * <p>Only {@code initialize} can fail. Every other call is safe before initialization:
 * spans are {@link NoOpSpan}, logs go to the {@link FallbackLogSink}, and a single warning
 * is logged for the whole process.</p>
 */
public final class Telemetry {
    private static final Logger log = LoggerFactory.getLogger(Telemetry.class);

    private static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private static final Object LOCK = new Object();
    private static final AtomicBoolean uninitializedWarningLogged = new AtomicBoolean(false);
    private static final FallbackLogSink fallback = new FallbackLogSink();
    private static volatile TelemetryRuntime runtime;

    private Telemetry() {
    }

    /**
     * Sets up telemetry, replacing (and shutting down) any runtime initialized earlier.
     *
     * @param protocol {@code grpc} or {@code http-protobuf}
     * @throws ConfigException if the endpoint is not a valid http(s) URI or the protocol is unknown
     */
    public static void initialize(String serviceName, String endpoint, String protocol, boolean consoleEcho)
            throws ConfigException {
        initialize(TelemetryConfig.of(serviceName, endpoint, protocol, consoleEcho));
    }

    public static void initialize(TelemetryConfig config) throws ConfigException {
        install(TelemetryRuntime.create(config));
    }

    /**
     * Installs a runtime built by the caller, for example one with a custom transport.
     */
    public static void initialize(TelemetryRuntime newRuntime) {
        install(newRuntime);
    }

    public static boolean isInitialized() {
        return runtime != null;
    }

    public static PipelineState state() {
        TelemetryRuntime current = runtime;
        return current == null ? PipelineState.UNINITIALIZED : current.getPipeline().getState();
    }

    public static Optional<TelemetryRuntime> runtime() {
        return Optional.ofNullable(runtime);
    }

    /**
     * The active tracing service, or {@link NoOpTracingService} before initialization.
     */
    public static TracingService tracing() {
        TelemetryRuntime current = runtime;
        return current == null ? NoOpTracingService.INSTANCE : current.getTracing();
    }

    public static Span startSpan(String name) {
        return startSpan(name, SpanKind.INTERNAL);
    }

    public static Span startSpan(String name, String kind) {
        return startSpan(name, SpanKind.parse(kind));
    }

    public static Span startSpan(String name, String kind, Span parent) {
        return startSpan(name, SpanKind.parse(kind), parent);
    }

    public static Span startSpan(String name, SpanKind kind) {
        TelemetryRuntime current = runtime;
        if (current == null) {
            warnUninitialized();
            return NoOpSpan.INSTANCE;
        }
        return current.startSpan(name, kind);
    }

    public static Span startSpan(String name, SpanKind kind, Span parent) {
        TelemetryRuntime current = runtime;
        if (current == null) {
            warnUninitialized();
            return NoOpSpan.INSTANCE;
        }
        return current.startSpan(name, kind, parent);
    }

    /**
     * Starts a span continuing a trace from another process.
     */
    public static Span startSpan(String name, SpanKind kind, SpanContext remoteParent) {
        TelemetryRuntime current = runtime;
        if (current == null) {
            warnUninitialized();
            return NoOpSpan.INSTANCE;
        }
        return current.startSpan(name, kind, remoteParent);
    }

    /**
     * Sets a tag on the span. Tags on stopped spans are dropped without error.
     */
    public static void setTag(Span span, String key, String value) {
        if (span != null) {
            span.setTag(key, value);
        }
    }

    /**
     * Stops the current span, if any.
     */
    public static void stopSpan() {
        TelemetryRuntime current = runtime;
        if (current == null) {
            warnUninitialized();
            return;
        }
        current.stopSpan(null);
    }

    /**
     * Stops the given span, or the current span when {@code span} is null. Idempotent.
     */
    public static void stopSpan(Span span) {
        if (span == null) {
            stopSpan();
            return;
        }
        span.close();
    }

    public static Optional<Span> currentSpan() {
        TelemetryRuntime current = runtime;
        return current == null ? Optional.empty() : current.currentSpan();
    }

    public static void writeLog(String message, LogLevel level) {
        writeLog(message, level, (ErrorInfo) null, null);
    }

    public static void writeLog(String message, String level) {
        writeLog(message, LogLevel.parse(level), (ErrorInfo) null, null);
    }

    public static void writeLog(String message, LogLevel level, Throwable error) {
        writeLog(message, level, error != null ? ErrorInfo.from(error) : null, null);
    }

    /**
     * Writes a log record correlated with {@code span}, or with the current span when null.
     */
    public static void writeLog(String message, LogLevel level, ErrorInfo error, Span span) {
        TelemetryRuntime current = runtime;
        if (current != null) {
            current.writeLog(message, level, error, span);
            return;
        }
        warnUninitialized();
        boolean correlated = span != null && !span.isStopped();
        fallback.accept(new LogRecord(Clock.SYSTEM.nowEpochNanos(),
                level != null ? level : LogLevel.INFORMATION, message, error,
                correlated ? span.traceId() : null, correlated ? span.spanId() : null));
    }

    public static Runnable wrap(Runnable task) {
        TelemetryRuntime current = runtime;
        return current == null ? task : current.wrap(task);
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        TelemetryRuntime current = runtime;
        return current == null ? task : current.wrap(task);
    }

    public static void inject(Span span, Map<String, String> carrier) {
        if (span != null) {
            TraceContextPropagation.inject(span.spanContext(), carrier);
        }
    }

    public static Optional<SpanContext> extract(Map<String, String> carrier) {
        return TraceContextPropagation.extract(carrier);
    }

    /**
     * Exports everything buffered so far, waiting up to ten seconds.
     *
     * @return false when uninitialized or when the flush did not finish in time
     */
    public static boolean flush() {
        TelemetryRuntime current = runtime;
        return current != null && current.flush(DEFAULT_FLUSH_TIMEOUT);
    }

    /**
     * Flushes and stops the active runtime. Later calls behave as uninitialized.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            TelemetryRuntime previous = runtime;
            runtime = null;
            if (previous != null) {
                previous.shutdown();
            }
        }
    }

    static void resetUninitializedWarning() {
        uninitializedWarningLogged.set(false);
    }

    private static void install(TelemetryRuntime next) {
        synchronized (LOCK) {
            TelemetryRuntime previous = runtime;
            runtime = null;
            if (previous != null) {
                log.info("Replacing telemetry runtime for service '{}'", previous.getConfig().getServiceName());
                previous.shutdown();
            }
            next.start();
            runtime = next;
        }
    }

    private static void warnUninitialized() {
        if (uninitializedWarningLogged.compareAndSet(false, true)) {
            log.warn("Telemetry is not initialized: spans are not recorded and logs go to the '{}' logger. "
                    + "Call Telemetry.initialize(...) first. This warning is logged once.", FallbackLogSink.LOGGER_NAME);
        }
    }
}
