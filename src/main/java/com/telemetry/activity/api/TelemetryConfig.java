package com.telemetry.activity.api;

import com.telemetry.activity.export.PipelineConfig;
import com.telemetry.activity.export.Protocol;
import com.telemetry.activity.export.RetryPolicy;
import com.telemetry.activity.metrics.ExportMetrics;
import com.telemetry.activity.metrics.NoOpExportMetrics;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Settings for a {@link TelemetryRuntime}.
 *
 * <p>Usage:</p>
 * <pre>
 * TelemetryConfig config = TelemetryConfig.builder()
 *     .serviceName("billing")
 *     .endpoint("http://collector:4318")
 *     .protocol("http-protobuf")
 *     .flushInterval(Duration.ofSeconds(2))
 *     .build();
 * </pre>
 */
public class TelemetryConfig {

    public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

    private final String serviceName;
    private final URI endpoint;
    private final Protocol protocol;
    private final boolean consoleEcho;
    private final Map<String, String> headers;
    private final Map<String, String> resourceAttributes;
    private final PipelineConfig pipelineConfig;
    private final ExportMetrics metrics;

    private TelemetryConfig(String serviceName, URI endpoint, Protocol protocol, PipelineConfig pipelineConfig,
                            Builder builder) {
        this.serviceName = serviceName;
        this.endpoint = endpoint;
        this.protocol = protocol;
        this.consoleEcho = builder.consoleEcho;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.resourceAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.resourceAttributes));
        this.pipelineConfig = pipelineConfig;
        this.metrics = builder.metrics;
    }

    public String getServiceName() { return serviceName; }
    public URI getEndpoint() { return endpoint; }
    public Protocol getProtocol() { return protocol; }
    public boolean isConsoleEcho() { return consoleEcho; }
    public Map<String, String> getHeaders() { return headers; }
    public Map<String, String> getResourceAttributes() { return resourceAttributes; }
    public PipelineConfig getPipelineConfig() { return pipelineConfig; }
    public ExportMetrics getMetrics() { return metrics; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shortcut for the four settings every caller has to choose.
     */
    public static TelemetryConfig of(String serviceName, String endpoint, String protocol, boolean consoleEcho)
            throws ConfigException {
        return builder()
                .serviceName(serviceName)
                .endpoint(endpoint)
                .protocol(protocol)
                .consoleEcho(consoleEcho)
                .build();
    }

    /**
     * Creates a builder pre-populated from the standard OpenTelemetry environment variables
     * ({@code OTEL_SERVICE_NAME}, {@code OTEL_EXPORTER_OTLP_ENDPOINT},
     * {@code OTEL_EXPORTER_OTLP_PROTOCOL}, {@code OTEL_EXPORTER_OTLP_HEADERS},
     * {@code OTEL_EXPORTER_OTLP_TIMEOUT}, {@code OTEL_BSP_SCHEDULE_DELAY},
     * {@code OTEL_BSP_MAX_QUEUE_SIZE}, {@code OTEL_BSP_MAX_EXPORT_BATCH_SIZE},
     * {@code OTEL_RESOURCE_ATTRIBUTES}). Unset variables keep the builder defaults.
     *
     * @throws ConfigException if a numeric variable cannot be parsed
     */
    public static Builder fromEnvironment(Map<String, String> env) throws ConfigException {
        Builder builder = builder();
        String serviceName = env.get("OTEL_SERVICE_NAME");
        if (serviceName != null) {
            builder.serviceName(serviceName);
        }
        String endpoint = env.get("OTEL_EXPORTER_OTLP_ENDPOINT");
        if (endpoint != null) {
            builder.endpoint(endpoint);
        }
        String protocol = env.get("OTEL_EXPORTER_OTLP_PROTOCOL");
        if (protocol != null) {
            builder.protocol(protocol);
        }
        builder.headers(parseKeyValueList(env.get("OTEL_EXPORTER_OTLP_HEADERS")));
        parseKeyValueList(env.get("OTEL_RESOURCE_ATTRIBUTES")).forEach(builder::resourceAttribute);

        try {
            String timeout = env.get("OTEL_EXPORTER_OTLP_TIMEOUT");
            if (timeout != null) {
                builder.exportTimeout(Duration.ofMillis(parseLong("OTEL_EXPORTER_OTLP_TIMEOUT", timeout)));
            }
            String delay = env.get("OTEL_BSP_SCHEDULE_DELAY");
            if (delay != null) {
                builder.flushInterval(Duration.ofMillis(parseLong("OTEL_BSP_SCHEDULE_DELAY", delay)));
            }
            String queueSize = env.get("OTEL_BSP_MAX_QUEUE_SIZE");
            if (queueSize != null) {
                builder.maxQueueSize((int) parseLong("OTEL_BSP_MAX_QUEUE_SIZE", queueSize));
            }
            String batchSize = env.get("OTEL_BSP_MAX_EXPORT_BATCH_SIZE");
            if (batchSize != null) {
                builder.maxBatchSize((int) parseLong("OTEL_BSP_MAX_EXPORT_BATCH_SIZE", batchSize));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        return builder;
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: '" + value + "'");
        }
    }

    static Map<String, String> parseKeyValueList(String value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return result;
        }
        for (String pair : value.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).trim();
            String val = URLDecoder.decode(pair.substring(eq + 1).trim(), StandardCharsets.UTF_8);
            if (!key.isEmpty()) {
                result.put(key, val);
            }
        }
        return result;
    }

    public static class Builder {
        private String serviceName;
        private String endpoint = DEFAULT_ENDPOINT;
        private String protocol = Protocol.GRPC.wireName();
        private boolean consoleEcho = false;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> resourceAttributes = new LinkedHashMap<>();
        private Duration flushInterval = PipelineConfig.defaults().flushInterval();
        private int maxBatchSize = PipelineConfig.defaults().maxBatchSize();
        private int maxQueueSize = PipelineConfig.defaults().maxQueueSize();
        private Duration exportTimeout = PipelineConfig.defaults().exportTimeout();
        private Duration shutdownTimeout = PipelineConfig.defaults().shutdownTimeout();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private ExportMetrics metrics = NoOpExportMetrics.INSTANCE;

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol != null ? protocol.wireName() : null;
            return this;
        }

        public Builder consoleEcho(boolean consoleEcho) {
            this.consoleEcho = consoleEcho;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder resourceAttribute(String key, String value) {
            this.resourceAttributes.put(key, value);
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
                throw new IllegalArgumentException("flushInterval must be > 0");
            }
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            if (maxQueueSize <= 0) throw new IllegalArgumentException("maxQueueSize must be > 0");
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder exportTimeout(Duration exportTimeout) {
            if (exportTimeout == null || exportTimeout.isZero() || exportTimeout.isNegative()) {
                throw new IllegalArgumentException("exportTimeout must be > 0");
            }
            this.exportTimeout = exportTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must be >= 0");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            if (retryPolicy == null) throw new IllegalArgumentException("retryPolicy must not be null");
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(ExportMetrics metrics) {
            this.metrics = metrics != null ? metrics : NoOpExportMetrics.INSTANCE;
            return this;
        }

        /**
         * Validates the settings.
         *
         * @throws ConfigException if the service name is blank, the endpoint is not an absolute
         *                         http(s) URI with a host, the protocol is unknown, a header or
         *                         resource attribute has a null or blank key or a null value, or
         *                         the queue is smaller than a batch
         */
        public TelemetryConfig build() throws ConfigException {
            if (serviceName == null || serviceName.isBlank()) {
                throw new ConfigException("serviceName must not be blank");
            }
            URI uri = parseEndpoint(endpoint);
            Protocol parsedProtocol = Protocol.fromName(protocol)
                    .orElseThrow(() -> new ConfigException(
                            "Unsupported protocol '" + protocol + "', expected 'grpc' or 'http-protobuf'"));
            checkEntries("header", headers);
            checkEntries("resource attribute", resourceAttributes);
            if (maxQueueSize < maxBatchSize) {
                throw new ConfigException("maxQueueSize (" + maxQueueSize + ") cannot be smaller than maxBatchSize ("
                        + maxBatchSize + ")");
            }
            PipelineConfig pipelineConfig = new PipelineConfig(flushInterval, maxBatchSize, maxQueueSize,
                    exportTimeout, shutdownTimeout, retryPolicy);
            return new TelemetryConfig(serviceName.trim(), uri, parsedProtocol, pipelineConfig, this);
        }

        private static void checkEntries(String kind, Map<String, String> entries) throws ConfigException {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank()) {
                    throw new ConfigException(kind + " name must not be blank");
                }
                if (entry.getValue() == null) {
                    throw new ConfigException(kind + " '" + entry.getKey() + "' must have a value");
                }
            }
        }

        private static URI parseEndpoint(String endpoint) throws ConfigException {
            if (endpoint == null || endpoint.isBlank()) {
                throw new ConfigException("endpoint must not be blank");
            }
            URI uri;
            try {
                uri = new URI(endpoint.trim());
            } catch (java.net.URISyntaxException e) {
                throw new ConfigException("Malformed endpoint '" + endpoint + "': " + e.getMessage(), e);
            }
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
            if (!uri.isAbsolute() || !("http".equals(scheme) || "https".equals(scheme))) {
                throw new ConfigException("Endpoint '" + endpoint + "' must be an absolute http or https URI");
            }
            if (uri.getHost() == null) {
                throw new ConfigException("Endpoint '" + endpoint + "' has no host");
            }
            return uri;
        }
    }

    @Override
    public String toString() {
        return "TelemetryConfig{" +
                "serviceName='" + serviceName + '\'' +
                ", endpoint=" + endpoint +
                ", protocol=" + protocol.wireName() +
                ", consoleEcho=" + consoleEcho +
                ", headers=" + headers.keySet() +
                ", resourceAttributes=" + resourceAttributes +
                ", pipeline=" + pipelineConfig +
                '}';
    }
}
