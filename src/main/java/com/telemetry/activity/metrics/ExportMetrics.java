package com.telemetry.activity.metrics;

import com.telemetry.activity.core.model.Signal;

import java.time.Duration;

/**
 * Interface for recording export pipeline metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpExportMetrics} does nothing, so the pipeline works
 * without a meter registry.
 */
public interface ExportMetrics {

    void recordExported(Signal signal, int count);

    void recordDropped(Signal signal);

    void recordLost(Signal signal, int count);

    void recordRetry(Signal signal);

    void recordExportDuration(Signal signal, Duration duration, boolean success);
}
