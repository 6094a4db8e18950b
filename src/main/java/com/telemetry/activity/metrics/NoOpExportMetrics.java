package com.telemetry.activity.metrics;

import com.telemetry.activity.core.model.Signal;

import java.time.Duration;

/**
 * No-op implementation of {@link ExportMetrics}.
 */
public class NoOpExportMetrics implements ExportMetrics {

    public static final NoOpExportMetrics INSTANCE = new NoOpExportMetrics();

    @Override
    public void recordExported(Signal signal, int count) {
    }

    @Override
    public void recordDropped(Signal signal) {
    }

    @Override
    public void recordLost(Signal signal, int count) {
    }

    @Override
    public void recordRetry(Signal signal) {
    }

    @Override
    public void recordExportDuration(Signal signal, Duration duration, boolean success) {
    }
}
