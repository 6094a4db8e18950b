package com.telemetry.activity.export;

import java.time.Duration;

/**
 * Batching, buffering and retry settings for {@link ExportPipeline}.
 *
 * @param flushInterval   how often the background flush runs
 * @param maxBatchSize    most items sent in one request; a buffer reaching it triggers a flush
 * @param maxQueueSize    capacity of each buffer; items beyond it are dropped
 * @param exportTimeout   deadline for a single export request
 * @param shutdownTimeout upper bound for the final flush on shutdown
 * @param retryPolicy     retry settings for failed requests
 */
public record PipelineConfig(
        Duration flushInterval,
        int maxBatchSize,
        int maxQueueSize,
        Duration exportTimeout,
        Duration shutdownTimeout,
        RetryPolicy retryPolicy
) {

    public PipelineConfig {
        if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be > 0");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        if (maxQueueSize < maxBatchSize) {
            throw new IllegalArgumentException("maxQueueSize must be >= maxBatchSize");
        }
        if (exportTimeout == null || exportTimeout.isZero() || exportTimeout.isNegative()) {
            throw new IllegalArgumentException("exportTimeout must be > 0");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy must not be null");
        }
    }

    /**
     * Default configuration: flush every 5s, batches of 512, queue of 2048,
     * 10s export timeout, 5s shutdown timeout, default retry policy.
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig(Duration.ofSeconds(5), 512, 2048,
                Duration.ofSeconds(10), Duration.ofSeconds(5), RetryPolicy.defaults());
    }
}
