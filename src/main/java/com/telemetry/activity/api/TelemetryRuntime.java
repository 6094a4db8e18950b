package com.telemetry.activity.api;

import com.telemetry.activity.context.ContextSnapshot;
import com.telemetry.activity.context.ContextStack;
import com.telemetry.activity.context.TraceContextPropagation;
import com.telemetry.activity.core.model.ErrorInfo;
import com.telemetry.activity.core.model.LogLevel;
import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.core.model.SpanContext;
import com.telemetry.activity.core.model.SpanData;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.export.ExportPipeline;
import com.telemetry.activity.export.OtlpEncoder;
import com.telemetry.activity.export.OtlpTransport;
import com.telemetry.activity.export.OtlpTransports;
import com.telemetry.activity.export.Sleeper;
import com.telemetry.activity.health.ExportPipelineHealthCheck;
import com.telemetry.activity.health.HealthCheck;
import com.telemetry.activity.logging.ConsoleEcho;
import com.telemetry.activity.logging.LogCorrelator;
import com.telemetry.activity.tracing.ActivityTracingService;
import com.telemetry.activity.tracing.Span;
import com.telemetry.activity.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * One configured telemetry instance: a context stack, a tracing service, a log correlator
 * and the export pipeline they feed. {@link Telemetry} keeps a single process-wide runtime,
 * but runtimes can also be created and used directly.
 */
public class TelemetryRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TelemetryRuntime.class);

    private final TelemetryConfig config;
    private final ContextStack contextStack;
    private final ExportPipeline pipeline;
    private final ActivityTracingService tracing;
    private final LogCorrelator logs;
    private final ConsoleEcho echo;

    /**
     * Creates a runtime exporting through the transport selected by the config's protocol.
     *
     * @throws ConfigException if the transport cannot be built for the configured endpoint
     */
    public static TelemetryRuntime create(TelemetryConfig config) throws ConfigException {
        OtlpTransport transport;
        try {
            transport = OtlpTransports.create(config.getProtocol(), config.getEndpoint(),
                    config.getPipelineConfig().exportTimeout(), config.getHeaders());
        } catch (RuntimeException e) {
            throw new ConfigException("Cannot create " + config.getProtocol().wireName() + " transport for "
                    + config.getEndpoint() + ": " + e.getMessage(), e);
        }
        return new TelemetryRuntime(config, transport);
    }

    public TelemetryRuntime(TelemetryConfig config, OtlpTransport transport) {
        this(config, transport, Sleeper.SYSTEM);
    }

    TelemetryRuntime(TelemetryConfig config, OtlpTransport transport, Sleeper sleeper) {
        this.config = config;
        this.contextStack = new ContextStack();
        OtlpEncoder encoder = new OtlpEncoder(config.getServiceName(), config.getResourceAttributes());
        this.pipeline = new ExportPipeline(config.getPipelineConfig(), transport, encoder, config.getMetrics(), sleeper);
        this.echo = config.isConsoleEcho() ? new ConsoleEcho(config.getServiceName()) : null;
        this.tracing = new ActivityTracingService(contextStack, this::onSpanFinished);
        this.logs = new LogCorrelator(contextStack, this::onLogWritten);
    }

    /**
     * Starts the export pipeline.
     *
     * @return this runtime
     */
    public TelemetryRuntime start() {
        if (pipeline.start()) {
            log.info("Telemetry started: {}", config);
        }
        return this;
    }

    public Span startSpan(String name, SpanKind kind) {
        return tracing.startSpan(name, kind);
    }

    public Span startSpan(String name, SpanKind kind, Span parent) {
        return tracing.startSpan(name, kind, parent);
    }

    public Span startSpan(String name, SpanKind kind, SpanContext parent) {
        return tracing.startSpan(name, kind, parent);
    }

    public void setTag(Span span, String key, String value) {
        tracing.setTag(span, key, value);
    }

    public void stopSpan(Span span) {
        if (span == null) {
            tracing.stopCurrentSpan();
        } else {
            tracing.stopSpan(span);
        }
    }

    public Optional<Span> currentSpan() {
        return tracing.currentSpan();
    }

    public LogRecord writeLog(String message, LogLevel level, ErrorInfo error, Span span) {
        return logs.write(message, level, error, span);
    }

    /**
     * Captures the calling thread's current span for use on another thread.
     */
    public ContextSnapshot captureContext() {
        return contextStack.capture();
    }

    public Runnable wrap(Runnable task) {
        return contextStack.capture().wrap(task);
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        return contextStack.capture().wrap(task);
    }

    /**
     * Writes the W3C {@code traceparent} header of {@code span} into {@code carrier}.
     */
    public void inject(Span span, Map<String, String> carrier) {
        if (span != null) {
            TraceContextPropagation.inject(span.spanContext(), carrier);
        }
    }

    public Optional<SpanContext> extract(Map<String, String> carrier) {
        return TraceContextPropagation.extract(carrier);
    }

    public boolean flush(Duration timeout) {
        return pipeline.forceFlush(timeout);
    }

    public void shutdown() {
        pipeline.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    public HealthCheck healthCheck() {
        return new ExportPipelineHealthCheck(pipeline);
    }

    public TelemetryConfig getConfig() {
        return config;
    }

    public TracingService getTracing() {
        return tracing;
    }

    public LogCorrelator getLogs() {
        return logs;
    }

    public ExportPipeline getPipeline() {
        return pipeline;
    }

    public ContextStack getContextStack() {
        return contextStack;
    }

    private void onSpanFinished(SpanData span) {
        pipeline.enqueueSpan(span);
        if (echo != null) {
            echo.echo(span);
        }
    }

    private void onLogWritten(LogRecord record) {
        pipeline.enqueueLog(record);
        if (echo != null) {
            echo.echo(record);
        }
    }
}
