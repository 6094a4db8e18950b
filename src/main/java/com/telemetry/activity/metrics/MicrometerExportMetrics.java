package com.telemetry.activity.metrics;

import com.telemetry.activity.core.model.Signal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link ExportMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code activity.export.items} - Counter (tag: signal)</li>
 *   <li>{@code activity.export.dropped} - Counter (tag: signal), items refused by a full buffer</li>
 *   <li>{@code activity.export.lost} - Counter (tag: signal), items in batches given up on</li>
 *   <li>{@code activity.export.retries} - Counter (tag: signal)</li>
 *   <li>{@code activity.export.duration} - Timer (tags: signal, outcome)</li>
 * </ul>
 */
public class MicrometerExportMetrics implements ExportMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();

    public MicrometerExportMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordExported(Signal signal, int count) {
        counter("activity.export.items", "Number of telemetry items delivered to the collector", signal)
                .increment(count);
    }

    @Override
    public void recordDropped(Signal signal) {
        counter("activity.export.dropped", "Number of telemetry items refused because the buffer was full", signal)
                .increment();
    }

    @Override
    public void recordLost(Signal signal, int count) {
        counter("activity.export.lost", "Number of telemetry items in batches that could not be delivered", signal)
                .increment(count);
    }

    @Override
    public void recordRetry(Signal signal) {
        counter("activity.export.retries", "Number of export retries", signal)
                .increment();
    }

    @Override
    public void recordExportDuration(Signal signal, Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = signal.name() + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("activity.export.duration")
                        .description("Duration of single export attempts")
                        .tag("signal", signal.tagValue())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    private Counter counter(String name, String description, Signal signal) {
        String key = name + ":" + signal.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("signal", signal.tagValue())
                        .register(registry));
    }
}
