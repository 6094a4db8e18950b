package com.telemetry.activity.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.telemetry.activity.core.model.InvalidArgumentException;
import com.telemetry.activity.core.model.LogLevel;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.export.PipelineState;
import com.telemetry.activity.export.RecordingTransport;
import com.telemetry.activity.logging.CapturingAppender;
import com.telemetry.activity.logging.FallbackLogSink;
import com.telemetry.activity.tracing.NoOpSpan;
import com.telemetry.activity.tracing.NoOpTracingService;
import com.telemetry.activity.tracing.Span;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Telemetry Facade Tests")
class TelemetryTest {

    @BeforeEach
    void setUp() {
        Telemetry.shutdown();
        Telemetry.resetUninitializedWarning();
    }

    @AfterEach
    void tearDown() {
        Telemetry.runtime().ifPresent(r -> r.getContextStack().clear());
        Telemetry.shutdown();
    }

    private static RecordingTransport initializeRecording(String serviceName) throws ConfigException {
        RecordingTransport transport = new RecordingTransport();
        Telemetry.initialize(new TelemetryRuntime(TelemetryRuntimeTest.testConfig(serviceName).build(), transport));
        return transport;
    }

    @Nested
    @DisplayName("Initialize")
    class InitializeTests {

        @Test
        @DisplayName("Parent and child should share a trace and the current span should clear after both stop")
        void parentChildExample() throws ConfigException {
            Telemetry.initialize("svc", "http://localhost:4317", "grpc", false);
            assertEquals(PipelineState.RUNNING, Telemetry.state());

            Span a = Telemetry.startSpan("A", "Internal");
            Span b = Telemetry.startSpan("B", "Internal", a);

            assertEquals(a.traceId(), b.traceId());
            assertEquals(a.spanId(), b.parentSpanId());
            assertSame(b, Telemetry.currentSpan().orElseThrow());

            Telemetry.stopSpan(b);
            Telemetry.stopSpan(a);

            assertTrue(Telemetry.currentSpan().isEmpty());
        }

        @Test
        @DisplayName("Invalid settings should raise ConfigException and leave telemetry uninitialized")
        void invalidSettings() {
            assertThrows(ConfigException.class,
                    () -> Telemetry.initialize("svc", "localhost:4317", "grpc", false));
            assertThrows(ConfigException.class,
                    () -> Telemetry.initialize("svc", "http://localhost:4317", "zipkin", false));

            assertFalse(Telemetry.isInitialized());
            assertEquals(PipelineState.UNINITIALIZED, Telemetry.state());
        }

        @Test
        @DisplayName("Re-initializing should shut the previous runtime down first")
        void replacesRuntime() throws ConfigException {
            RecordingTransport first = initializeRecording("first");
            TelemetryRuntime firstRuntime = Telemetry.runtime().orElseThrow();
            Span open = Telemetry.startSpan("open", SpanKind.INTERNAL);

            RecordingTransport second = initializeRecording("second");

            assertTrue(first.isClosed());
            assertEquals(PipelineState.STOPPED, firstRuntime.getPipeline().getState());
            assertTrue(Telemetry.currentSpan().isEmpty());
            assertEquals("second", Telemetry.runtime().orElseThrow().getConfig().getServiceName());

            assertDoesNotThrow(() -> Telemetry.stopSpan(open));
            assertTrue(open.isStopped());
            assertTrue(Telemetry.flush());
            assertTrue(second.exportedSpans().isEmpty());
            firstRuntime.getContextStack().clear();
        }
    }

    @Nested
    @DisplayName("Instrumentation")
    class InstrumentationTests {

        @Test
        @DisplayName("Spans and logs should be exported through the active runtime")
        void exportsThroughRuntime() throws ConfigException {
            RecordingTransport transport = initializeRecording("checkout");

            Span span = Telemetry.startSpan("pay", SpanKind.CLIENT);
            Telemetry.setTag(span, "amount", "12.50");
            Telemetry.writeLog("charging card", "Warning");
            Telemetry.stopSpan();
            Telemetry.setTag(span, "late", "ignored");

            assertTrue(Telemetry.flush());

            io.opentelemetry.proto.trace.v1.Span exported = transport.exportedSpans().get(0);
            assertEquals("pay", exported.getName());
            assertEquals(1, exported.getAttributesCount());
            io.opentelemetry.proto.logs.v1.LogRecord log = transport.exportedLogs().get(0);
            assertEquals("WARN", log.getSeverityText());
            assertEquals(exported.getSpanId(), log.getSpanId());
        }

        @Test
        @DisplayName("Stopping the same span twice should export it once")
        void stopTwice() throws ConfigException {
            RecordingTransport transport = initializeRecording("idempotent");
            Span span = Telemetry.startSpan("once");

            Telemetry.stopSpan(span);
            Telemetry.stopSpan(span);

            assertTrue(Telemetry.flush());
            assertEquals(1, transport.exportedSpans().size());
        }

        @Test
        @DisplayName("Unknown kind or level text should raise InvalidArgumentException")
        void invalidArguments() throws ConfigException {
            initializeRecording("invalid");

            assertThrows(InvalidArgumentException.class, () -> Telemetry.startSpan("x", "Sideways"));
            assertThrows(InvalidArgumentException.class, () -> Telemetry.writeLog("x", "Loud"));
            assertTrue(Telemetry.currentSpan().isEmpty());
        }

        @Test
        @DisplayName("Wrapped tasks and propagation headers should carry the trace")
        void wrapAndPropagate() throws Exception {
            initializeRecording("carry");
            Span parent = Telemetry.startSpan("parent", SpanKind.SERVER);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<String> seen = executor.submit(Telemetry.wrap(
                        () -> Telemetry.currentSpan().map(Span::spanId).orElse("none")));
                assertEquals(parent.spanId(), seen.get(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            Map<String, String> headers = new HashMap<>();
            Telemetry.inject(parent, headers);
            Span remoteChild = Telemetry.startSpan("remote", SpanKind.SERVER,
                    Telemetry.extract(headers).orElseThrow());
            assertEquals(parent.traceId(), remoteChild.traceId());
            assertEquals(parent.spanId(), remoteChild.parentSpanId());
        }
    }

    @Nested
    @DisplayName("Uninitialized")
    class UninitializedTests {

        @Test
        @DisplayName("Calls should be safe no-ops returning the no-op span")
        void safeNoOps() {
            Span span = Telemetry.startSpan("ignored", "Server");

            assertSame(NoOpSpan.INSTANCE, span);
            assertSame(NoOpTracingService.INSTANCE, Telemetry.tracing());
            assertDoesNotThrow(() -> {
                Telemetry.setTag(span, "k", "v");
                Telemetry.stopSpan(span);
                Telemetry.stopSpan();
                Telemetry.stopSpan(null);
            });
            assertTrue(Telemetry.currentSpan().isEmpty());
            assertFalse(Telemetry.flush());
            assertFalse(Telemetry.isInitialized());
        }

        @Test
        @DisplayName("Warning should be logged once however many calls are made")
        void warnsOnce() {
            try (CapturingAppender appender = CapturingAppender.attach(Telemetry.class)) {
                Telemetry.startSpan("one");
                Telemetry.startSpan("two", SpanKind.CLIENT);
                Telemetry.stopSpan();
                Telemetry.writeLog("three", LogLevel.INFORMATION);

                List<ILoggingEvent> warnings = appender.events(Level.WARN);
                assertEquals(1, warnings.size());
                assertTrue(warnings.get(0).getFormattedMessage().contains("not initialized"));
            }
        }

        @Test
        @DisplayName("Logs should go to the fallback logger instead of being dropped")
        void fallbackLogging() {
            try (CapturingAppender appender = CapturingAppender.attach(FallbackLogSink.LOGGER_NAME)) {
                Telemetry.writeLog("written early", LogLevel.ERROR, new IllegalStateException("boom"));

                assertEquals(1, appender.list.size());
                ILoggingEvent event = appender.list.get(0);
                assertEquals(Level.ERROR, event.getLevel());
                assertTrue(event.getFormattedMessage().startsWith("written early [java.lang.IllegalStateException: boom]"));
            }
        }

        @Test
        @DisplayName("Unknown kind text should be rejected even before initialization")
        void invalidKindUninitialized() {
            assertThrows(InvalidArgumentException.class, () -> Telemetry.startSpan("x", "Interna"));
        }

        @Test
        @DisplayName("Shutdown should return the facade to the uninitialized state")
        void shutdownResets() throws ConfigException {
            RecordingTransport transport = initializeRecording("short-lived");
            Telemetry.startSpan("s").close();

            Telemetry.shutdown();

            assertFalse(Telemetry.isInitialized());
            assertEquals(1, transport.exportedSpans().size());
            assertSame(NoOpSpan.INSTANCE, Telemetry.startSpan("after"));
            Telemetry.shutdown();
        }
    }
}
