package com.telemetry.activity.export;

import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;

/**
 * Sends encoded OTLP requests to a collector.
 * Calls are blocking and are only made from the export pipeline's own thread.
 */
public interface OtlpTransport extends AutoCloseable {

    void exportSpans(ExportTraceServiceRequest request) throws TransportException;

    void exportLogs(ExportLogsServiceRequest request) throws TransportException;

    String getName();

    @Override
    void close();
}
