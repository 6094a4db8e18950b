package com.telemetry.activity.export;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.ProtoUtils;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * OTLP/gRPC transport using unary calls to the collector's trace and logs services.
 *
 * <p>{@code http} endpoints use a plaintext channel, {@code https} endpoints use TLS.
 * Without an explicit port the OTLP default 4317 is used (443 for {@code https}).</p>
 */
public class GrpcOtlpTransport implements OtlpTransport {
    private static final Logger log = LoggerFactory.getLogger(GrpcOtlpTransport.class);

    static final String TRACE_SERVICE = "opentelemetry.proto.collector.trace.v1.TraceService";
    static final String LOGS_SERVICE = "opentelemetry.proto.collector.logs.v1.LogsService";
    static final int DEFAULT_PORT = 4317;

    static final MethodDescriptor<ExportTraceServiceRequest, ExportTraceServiceResponse> TRACE_EXPORT =
            MethodDescriptor.<ExportTraceServiceRequest, ExportTraceServiceResponse>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(TRACE_SERVICE, "Export"))
                    .setRequestMarshaller(ProtoUtils.marshaller(ExportTraceServiceRequest.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(ExportTraceServiceResponse.getDefaultInstance()))
                    .build();

    static final MethodDescriptor<ExportLogsServiceRequest, ExportLogsServiceResponse> LOGS_EXPORT =
            MethodDescriptor.<ExportLogsServiceRequest, ExportLogsServiceResponse>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(LOGS_SERVICE, "Export"))
                    .setRequestMarshaller(ProtoUtils.marshaller(ExportLogsServiceRequest.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(ExportLogsServiceResponse.getDefaultInstance()))
                    .build();

    // retryable status codes for OTLP/gRPC
    private static final Set<Status.Code> RETRYABLE_CODES = EnumSet.of(
            Status.Code.CANCELLED,
            Status.Code.DEADLINE_EXCEEDED,
            Status.Code.RESOURCE_EXHAUSTED,
            Status.Code.ABORTED,
            Status.Code.OUT_OF_RANGE,
            Status.Code.UNAVAILABLE,
            Status.Code.DATA_LOSS);

    private final ManagedChannel channel;
    private final Channel callChannel;
    private final Duration timeout;
    private final String target;

    public GrpcOtlpTransport(ManagedChannel channel, Duration timeout, Map<String, String> headers) {
        this.channel = channel;
        this.timeout = timeout;
        this.target = channel.authority();
        Metadata metadata = new Metadata();
        if (headers != null) {
            headers.forEach((key, value) ->
                    metadata.put(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER), value));
        }
        this.callChannel = ClientInterceptors.intercept(channel, MetadataUtils.newAttachHeadersInterceptor(metadata));
    }

    public static GrpcOtlpTransport create(URI endpoint, Duration timeout, Map<String, String> headers) {
        boolean secure = "https".equalsIgnoreCase(endpoint.getScheme());
        int port = endpoint.getPort() != -1 ? endpoint.getPort() : (secure ? 443 : DEFAULT_PORT);
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forAddress(endpoint.getHost(), port);
        if (secure) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        return new GrpcOtlpTransport(builder.build(), timeout, headers);
    }

    @Override
    public void exportSpans(ExportTraceServiceRequest request) throws TransportException {
        ExportTraceServiceResponse response = call(TRACE_EXPORT, request);
        if (response.hasPartialSuccess() && response.getPartialSuccess().getRejectedSpans() > 0) {
            log.warn("Collector rejected {} span(s): {}", response.getPartialSuccess().getRejectedSpans(),
                    response.getPartialSuccess().getErrorMessage());
        }
    }

    @Override
    public void exportLogs(ExportLogsServiceRequest request) throws TransportException {
        ExportLogsServiceResponse response = call(LOGS_EXPORT, request);
        if (response.hasPartialSuccess() && response.getPartialSuccess().getRejectedLogRecords() > 0) {
            log.warn("Collector rejected {} log record(s): {}",
                    response.getPartialSuccess().getRejectedLogRecords(),
                    response.getPartialSuccess().getErrorMessage());
        }
    }

    @Override
    public String getName() {
        return "otlp-grpc/" + target;
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <Q, R> R call(MethodDescriptor<Q, R> method, Q request) throws TransportException {
        CallOptions options = CallOptions.DEFAULT.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            return ClientCalls.blockingUnaryCall(callChannel, method, options, request);
        } catch (StatusRuntimeException e) {
            Status status = e.getStatus();
            throw new TransportException("gRPC export to " + target + " failed: " + status,
                    RETRYABLE_CODES.contains(status.getCode()), e);
        }
    }
}
