package com.telemetry.activity.export;

import com.google.protobuf.ByteString;
import com.telemetry.activity.core.model.ErrorInfo;
import com.telemetry.activity.core.model.Ids;
import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.core.model.SpanData;
import com.telemetry.activity.core.model.SpanEvent;
import com.telemetry.activity.core.model.SpanKind;
import com.telemetry.activity.core.model.SpanStatus;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.InstrumentationScope;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.logs.v1.SeverityNumber;
import io.opentelemetry.proto.resource.v1.Resource;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.Status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts finished spans and log records into OTLP protobuf export requests.
 * Every request carries one resource (service name plus configured attributes)
 * and one instrumentation scope.
 */
public class OtlpEncoder {

    public static final String SCOPE_NAME = "com.telemetry.activity";
    public static final String SCOPE_VERSION = "1.0.0";

    private final Resource resource;
    private final InstrumentationScope scope;

    public OtlpEncoder(String serviceName, Map<String, String> resourceAttributes) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (resourceAttributes != null) {
            attributes.putAll(resourceAttributes);
        }
        attributes.put("service.name", serviceName);
        attributes.put("telemetry.sdk.name", "activity-telemetry");
        attributes.put("telemetry.sdk.language", "java");
        attributes.put("telemetry.sdk.version", SCOPE_VERSION);

        Resource.Builder resourceBuilder = Resource.newBuilder();
        attributes.forEach((key, value) -> resourceBuilder.addAttributes(keyValue(key, value)));
        this.resource = resourceBuilder.build();
        this.scope = InstrumentationScope.newBuilder()
                .setName(SCOPE_NAME)
                .setVersion(SCOPE_VERSION)
                .build();
    }

    public Resource getResource() {
        return resource;
    }

    public ExportTraceServiceRequest encodeSpans(List<SpanData> spans) {
        ScopeSpans.Builder scopeSpans = ScopeSpans.newBuilder().setScope(scope);
        for (SpanData span : spans) {
            scopeSpans.addSpans(toProto(span));
        }
        return ExportTraceServiceRequest.newBuilder()
                .addResourceSpans(ResourceSpans.newBuilder()
                        .setResource(resource)
                        .addScopeSpans(scopeSpans))
                .build();
    }

    public ExportLogsServiceRequest encodeLogs(List<LogRecord> records) {
        ScopeLogs.Builder scopeLogs = ScopeLogs.newBuilder().setScope(scope);
        for (LogRecord record : records) {
            scopeLogs.addLogRecords(toProto(record));
        }
        return ExportLogsServiceRequest.newBuilder()
                .addResourceLogs(ResourceLogs.newBuilder()
                        .setResource(resource)
                        .addScopeLogs(scopeLogs))
                .build();
    }

    static Span toProto(SpanData span) {
        Span.Builder builder = Span.newBuilder()
                .setTraceId(idBytes(span.traceId()))
                .setSpanId(idBytes(span.spanId()))
                .setName(span.name())
                .setKind(toProto(span.kind()))
                .setStartTimeUnixNano(span.startEpochNanos())
                .setEndTimeUnixNano(span.endEpochNanos());
        if (span.hasParent()) {
            builder.setParentSpanId(idBytes(span.parentSpanId()));
        }
        span.attributes().forEach((key, value) -> builder.addAttributes(keyValue(key, value)));
        for (SpanEvent event : span.events()) {
            Span.Event.Builder eventBuilder = Span.Event.newBuilder()
                    .setName(event.name())
                    .setTimeUnixNano(event.epochNanos());
            event.attributes().forEach((key, value) -> eventBuilder.addAttributes(keyValue(key, value)));
            builder.addEvents(eventBuilder);
        }
        Status.Builder status = Status.newBuilder().setCode(toProto(span.status()));
        if (span.statusDescription() != null) {
            status.setMessage(span.statusDescription());
        }
        return builder.setStatus(status).build();
    }

    static io.opentelemetry.proto.logs.v1.LogRecord toProto(LogRecord record) {
        io.opentelemetry.proto.logs.v1.LogRecord.Builder builder = io.opentelemetry.proto.logs.v1.LogRecord.newBuilder()
                .setTimeUnixNano(record.epochNanos())
                .setObservedTimeUnixNano(record.epochNanos())
                .setSeverityNumber(SeverityNumber.forNumber(record.level().severityNumber()))
                .setSeverityText(record.level().severityText())
                .setBody(AnyValue.newBuilder().setStringValue(record.message()));
        if (record.isCorrelated()) {
            builder.setTraceId(idBytes(record.traceId()))
                    .setSpanId(idBytes(record.spanId()));
        }
        ErrorInfo error = record.error();
        if (error != null) {
            addIfPresent(builder, "exception.type", error.type());
            addIfPresent(builder, "exception.message", error.message());
            addIfPresent(builder, "exception.stacktrace", error.stackTrace());
        }
        return builder.build();
    }

    static Span.SpanKind toProto(SpanKind kind) {
        return switch (kind) {
            case INTERNAL -> Span.SpanKind.SPAN_KIND_INTERNAL;
            case SERVER -> Span.SpanKind.SPAN_KIND_SERVER;
            case CLIENT -> Span.SpanKind.SPAN_KIND_CLIENT;
            case PRODUCER -> Span.SpanKind.SPAN_KIND_PRODUCER;
            case CONSUMER -> Span.SpanKind.SPAN_KIND_CONSUMER;
        };
    }

    static Status.StatusCode toProto(SpanStatus status) {
        return switch (status) {
            case UNSET -> Status.StatusCode.STATUS_CODE_UNSET;
            case OK -> Status.StatusCode.STATUS_CODE_OK;
            case ERROR -> Status.StatusCode.STATUS_CODE_ERROR;
        };
    }

    private static void addIfPresent(io.opentelemetry.proto.logs.v1.LogRecord.Builder builder, String key, String value) {
        if (value != null) {
            builder.addAttributes(keyValue(key, value));
        }
    }

    private static KeyValue keyValue(String key, String value) {
        return KeyValue.newBuilder()
                .setKey(key)
                .setValue(AnyValue.newBuilder().setStringValue(value))
                .build();
    }

    private static ByteString idBytes(String hexId) {
        return ByteString.copyFrom(Ids.toBytes(hexId));
    }
}
