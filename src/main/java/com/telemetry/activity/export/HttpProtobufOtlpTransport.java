package com.telemetry.activity.export;

import com.google.protobuf.InvalidProtocolBufferException;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * OTLP/HTTP transport sending binary protobuf bodies.
 *
 * <p>Requests go to {@code {endpoint}/v1/traces} and {@code {endpoint}/v1/logs}.
 * Status 429, 502, 503, 504 and connection failures are retryable; other
 * non-2xx statuses are not.</p>
 */
public class HttpProtobufOtlpTransport implements OtlpTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpProtobufOtlpTransport.class);

    static final String TRACES_PATH = "/v1/traces";
    static final String LOGS_PATH = "/v1/logs";
    static final String CONTENT_TYPE = "application/x-protobuf";

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(429, 502, 503, 504);

    private final URI tracesUri;
    private final URI logsUri;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final HttpClient httpClient;

    public HttpProtobufOtlpTransport(URI endpoint, Duration timeout, Map<String, String> headers) {
        this.tracesUri = resolve(endpoint, TRACES_PATH);
        this.logsUri = resolve(endpoint, LOGS_PATH);
        this.timeout = timeout;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void exportSpans(ExportTraceServiceRequest request) throws TransportException {
        byte[] body = post(tracesUri, request.toByteArray());
        try {
            ExportTraceServiceResponse response = ExportTraceServiceResponse.parseFrom(body);
            if (response.hasPartialSuccess() && response.getPartialSuccess().getRejectedSpans() > 0) {
                log.warn("Collector rejected {} span(s): {}", response.getPartialSuccess().getRejectedSpans(),
                        response.getPartialSuccess().getErrorMessage());
            }
        } catch (InvalidProtocolBufferException e) {
            log.debug("Ignoring unparseable trace export response: {}", e.getMessage());
        }
    }

    @Override
    public void exportLogs(ExportLogsServiceRequest request) throws TransportException {
        byte[] body = post(logsUri, request.toByteArray());
        try {
            ExportLogsServiceResponse response = ExportLogsServiceResponse.parseFrom(body);
            if (response.hasPartialSuccess() && response.getPartialSuccess().getRejectedLogRecords() > 0) {
                log.warn("Collector rejected {} log record(s): {}",
                        response.getPartialSuccess().getRejectedLogRecords(),
                        response.getPartialSuccess().getErrorMessage());
            }
        } catch (InvalidProtocolBufferException e) {
            log.debug("Ignoring unparseable log export response: {}", e.getMessage());
        }
    }

    @Override
    public String getName() {
        return "otlp-http/" + tracesUri.getHost();
    }

    @Override
    public void close() {
    }

    URI getTracesUri() {
        return tracesUri;
    }

    URI getLogsUri() {
        return logsUri;
    }

    private byte[] post(URI uri, byte[] body) throws TransportException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(builder::header);

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new TransportException("POST " + uri + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while posting to " + uri, false, e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.debug("POST {} -> {} ({} bytes sent)", uri, status, body.length);
            return response.body();
        }
        throw new TransportException("Collector returned status " + status + " for " + uri,
                RETRYABLE_STATUS.contains(status));
    }

    static URI resolve(URI endpoint, String path) {
        String base = endpoint.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.endsWith(path)) {
            return URI.create(base);
        }
        return URI.create(base + path);
    }
}
