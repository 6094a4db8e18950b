package com.telemetry.activity.export;

import com.telemetry.activity.core.model.LogLevel;
import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.core.model.SpanData;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.core.model.SpanStatus;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ServerCalls;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.ExportTracePartialSuccess;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GrpcOtlpTransport Tests")
class GrpcOtlpTransportTest {

    private static final Metadata.Key<String> API_KEY = Metadata.Key.of("x-api-key", Metadata.ASCII_STRING_MARSHALLER);

    private final OtlpEncoder encoder = new OtlpEncoder("grpc-test", Map.of());
    private final List<ExportTraceServiceRequest> traceRequests = new CopyOnWriteArrayList<>();
    private final List<ExportLogsServiceRequest> logRequests = new CopyOnWriteArrayList<>();
    private final List<String> apiKeys = new CopyOnWriteArrayList<>();
    private final AtomicReference<Status> failWith = new AtomicReference<>();
    private final AtomicReference<ExportTraceServiceResponse> traceResponse =
            new AtomicReference<>(ExportTraceServiceResponse.getDefaultInstance());

    private Server server;
    private GrpcOtlpTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        String name = InProcessServerBuilder.generateName();

        ServerServiceDefinition traceService = ServerServiceDefinition.builder(GrpcOtlpTransport.TRACE_SERVICE)
                .addMethod(GrpcOtlpTransport.TRACE_EXPORT, ServerCalls.asyncUnaryCall((request, observer) -> {
                    Status status = failWith.get();
                    if (status != null) {
                        observer.onError(status.asRuntimeException());
                        return;
                    }
                    traceRequests.add(request);
                    observer.onNext(traceResponse.get());
                    observer.onCompleted();
                }))
                .build();
        ServerServiceDefinition logsService = ServerServiceDefinition.builder(GrpcOtlpTransport.LOGS_SERVICE)
                .addMethod(GrpcOtlpTransport.LOGS_EXPORT, ServerCalls.asyncUnaryCall((request, observer) -> {
                    logRequests.add(request);
                    observer.onNext(ExportLogsServiceResponse.getDefaultInstance());
                    observer.onCompleted();
                }))
                .build();

        ServerInterceptor captureHeaders = new ServerInterceptor() {
            @Override
            public <Q, R> ServerCall.Listener<Q> interceptCall(ServerCall<Q, R> call, Metadata headers,
                                                               ServerCallHandler<Q, R> next) {
                String apiKey = headers.get(API_KEY);
                apiKeys.add(apiKey != null ? apiKey : "");
                return next.startCall(call, headers);
            }
        };

        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.intercept(traceService, captureHeaders))
                .addService(logsService)
                .build()
                .start();
        ManagedChannel channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        transport = new GrpcOtlpTransport(channel, Duration.ofSeconds(5), Map.of("x-api-key", "secret"));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        transport.close();
        server.shutdownNow();
        server.awaitTermination(5, TimeUnit.SECONDS);
    }

    private ExportTraceServiceRequest spanRequest() {
        return encoder.encodeSpans(List.of(new SpanData("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7",
                null, "consume", SpanKind.CONSUMER, 1L, 2L, Map.of(), List.of(), SpanStatus.UNSET, null)));
    }

    @Test
    @DisplayName("Spans should reach the trace service with the configured headers")
    void exportsSpans() throws Exception {
        ExportTraceServiceRequest request = spanRequest();

        transport.exportSpans(request);

        assertEquals(List.of(request), traceRequests);
        assertEquals(List.of("secret"), apiKeys);
    }

    @Test
    @DisplayName("Logs should reach the logs service")
    void exportsLogs() throws Exception {
        ExportLogsServiceRequest request = encoder.encodeLogs(
                List.of(new LogRecord(1L, LogLevel.ERROR, "failed", null, null, null)));

        transport.exportLogs(request);

        assertEquals(List.of(request), logRequests);
    }

    @Test
    @DisplayName("Partial success should not be treated as a failure")
    void partialSuccess() {
        traceResponse.set(ExportTraceServiceResponse.newBuilder()
                .setPartialSuccess(ExportTracePartialSuccess.newBuilder()
                        .setRejectedSpans(1)
                        .setErrorMessage("span too large"))
                .build());

        assertDoesNotThrow(() -> transport.exportSpans(spanRequest()));
    }

    @ParameterizedTest
    @EnumSource(value = Status.Code.class, names = {
            "CANCELLED", "DEADLINE_EXCEEDED", "RESOURCE_EXHAUSTED", "ABORTED", "OUT_OF_RANGE", "UNAVAILABLE", "DATA_LOSS"})
    @DisplayName("Transient status codes should be retryable")
    void retryableCodes(Status.Code code) {
        failWith.set(Status.fromCode(code));

        TransportException e = assertThrows(TransportException.class, () -> transport.exportSpans(spanRequest()));

        assertTrue(e.isRetryable());
    }

    @ParameterizedTest
    @EnumSource(value = Status.Code.class, names = {
            "INVALID_ARGUMENT", "UNAUTHENTICATED", "PERMISSION_DENIED", "UNIMPLEMENTED", "INTERNAL"})
    @DisplayName("Other status codes should be permanent failures")
    void permanentCodes(Status.Code code) {
        failWith.set(Status.fromCode(code));

        TransportException e = assertThrows(TransportException.class, () -> transport.exportSpans(spanRequest()));

        assertFalse(e.isRetryable());
    }
}
