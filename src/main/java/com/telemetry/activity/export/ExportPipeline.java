package com.telemetry.activity.export;

import com.telemetry.activity.core.model.LogRecord;
import com.telemetry.activity.core.model.Signal;
import com.telemetry.activity.core.model.SpanData;
import com.telemetry.activity.metrics.ExportMetrics;
import com.telemetry.activity.metrics.NoOpExportMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Buffers finished spans and log records and ships them to a collector in batches.
 *
 * <p>Producers call {@link #enqueueSpan} and {@link #enqueueLog} from any thread; both return
 * immediately. When a buffer is full the new item is dropped and counted (drop-new).
 * All exporting happens on one daemon thread, woken every {@code flushInterval} or as soon
 * as a buffer holds {@code maxBatchSize} items, so flushes never overlap. A size trigger
 * arriving while one is already pending is coalesced.</p>
 *
 * <p>Failed requests are retried per {@link RetryPolicy}; once the attempts are used up, or on
 * a non-retryable failure, the batch is dropped and counted as lost. Transport errors never
 * reach producers.</p>
 *
 * <p>Lifecycle: {@code CONFIGURED -> RUNNING -> DRAINING -> STOPPED}. Items are only accepted
 * while {@code RUNNING}; {@link #shutdown()} performs one final flush bounded by
 * {@code shutdownTimeout} and then releases the transport.</p>
 */
public class ExportPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    private final PipelineConfig config;
    private final OtlpTransport transport;
    private final OtlpEncoder encoder;
    private final ExportMetrics metrics;
    private final Sleeper sleeper;

    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.CONFIGURED);
    private final BoundedBuffer<SpanData> spanBuffer;
    private final BoundedBuffer<LogRecord> logBuffer;
    private final SignalCounters spanCounters = new SignalCounters();
    private final SignalCounters logCounters = new SignalCounters();
    private final AtomicLong retries = new AtomicLong(0);
    private final AtomicBoolean flushPending = new AtomicBoolean(false);
    private final AtomicBoolean dropWarningLogged = new AtomicBoolean(false);
    private final ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> ticker;

    public ExportPipeline(PipelineConfig config, OtlpTransport transport, OtlpEncoder encoder) {
        this(config, transport, encoder, NoOpExportMetrics.INSTANCE, Sleeper.SYSTEM);
    }

    public ExportPipeline(PipelineConfig config, OtlpTransport transport, OtlpEncoder encoder,
                          ExportMetrics metrics, Sleeper sleeper) {
        this.config = config;
        this.transport = transport;
        this.encoder = encoder;
        this.metrics = metrics != null ? metrics : NoOpExportMetrics.INSTANCE;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.spanBuffer = new BoundedBuffer<>(config.maxQueueSize());
        this.logBuffer = new BoundedBuffer<>(config.maxQueueSize());
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "activity-export");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts accepting items and schedules the periodic flush.
     *
     * @return false if the pipeline was not in {@code CONFIGURED} state
     */
    public boolean start() {
        if (!state.compareAndSet(PipelineState.CONFIGURED, PipelineState.RUNNING)) {
            return false;
        }
        long intervalMs = config.flushInterval().toMillis();
        ticker = executor.scheduleWithFixedDelay(this::scheduledFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Export pipeline started (transport={}, flushInterval={}, maxBatchSize={}, maxQueueSize={})",
                transport.getName(), config.flushInterval(), config.maxBatchSize(), config.maxQueueSize());
        return true;
    }

    /**
     * Offers a finished span for export. Never blocks.
     *
     * @return true if the span was buffered
     */
    public boolean enqueueSpan(SpanData span) {
        return enqueue(span, spanBuffer, spanCounters, Signal.SPANS);
    }

    /**
     * Offers a log record for export. Never blocks.
     *
     * @return true if the record was buffered
     */
    public boolean enqueueLog(LogRecord record) {
        return enqueue(record, logBuffer, logCounters, Signal.LOGS);
    }

    /**
     * Exports everything buffered so far and waits for it, up to {@code timeout}.
     *
     * @return true if the flush completed within the timeout
     */
    public boolean forceFlush(Duration timeout) {
        if (state.get() != PipelineState.RUNNING) {
            return false;
        }
        Future<?> flush;
        try {
            flush = executor.submit(this::flushSafely);
        } catch (RejectedExecutionException e) {
            return false;
        }
        try {
            flush.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.debug("Flush still running after {}", timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("Flush failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        }
    }

    /**
     * Stops the pipeline: no new items are accepted, buffered items get one final flush
     * bounded by {@code shutdownTimeout}, then the transport is closed. Safe to call while a
     * flush is in progress and safe to call more than once.
     */
    public void shutdown() {
        if (state.compareAndSet(PipelineState.CONFIGURED, PipelineState.STOPPED)) {
            executor.shutdownNow();
            closeTransport();
            return;
        }
        if (!state.compareAndSet(PipelineState.RUNNING, PipelineState.DRAINING)) {
            return;
        }
        log.info("Export pipeline draining (queuedSpans={}, queuedLogs={})", spanBuffer.size(), logBuffer.size());

        ScheduledFuture<?> currentTicker = ticker;
        if (currentTicker != null) {
            currentTicker.cancel(false);
        }

        Future<?> finalFlush = null;
        try {
            finalFlush = executor.submit(this::flushSafely);
        } catch (RejectedExecutionException e) {
            log.debug("Final flush rejected: {}", e.getMessage());
        }
        executor.shutdown();

        if (finalFlush != null) {
            awaitFinalFlush(finalFlush);
        }

        int abandonedSpans = spanBuffer.clear();
        int abandonedLogs = logBuffer.clear();
        if (abandonedSpans > 0 || abandonedLogs > 0) {
            markLost(Signal.SPANS, abandonedSpans);
            markLost(Signal.LOGS, abandonedLogs);
            log.warn("Discarded {} span(s) and {} log record(s) still buffered at shutdown",
                    abandonedSpans, abandonedLogs);
        }

        closeTransport();
        state.set(PipelineState.STOPPED);
        log.info("Export pipeline stopped: {}", stats());
    }

    @Override
    public void close() {
        shutdown();
    }

    public PipelineState getState() {
        return state.get();
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public PipelineStats stats() {
        return new PipelineStats(
                state.get(),
                spanCounters.accepted.get(),
                spanCounters.exported.get(),
                spanCounters.dropped.get(),
                spanCounters.lost.get(),
                logCounters.accepted.get(),
                logCounters.exported.get(),
                logCounters.dropped.get(),
                logCounters.lost.get(),
                retries.get(),
                spanBuffer.size(),
                logBuffer.size()
        );
    }

    private <T> boolean enqueue(T item, BoundedBuffer<T> buffer, SignalCounters counters, Signal signal) {
        if (item == null || state.get() != PipelineState.RUNNING) {
            return false;
        }
        if (!buffer.offer(item)) {
            counters.dropped.incrementAndGet();
            metrics.recordDropped(signal);
            if (dropWarningLogged.compareAndSet(false, true)) {
                log.warn("Export buffer full ({} items), dropping new {} until the next successful flush",
                        config.maxQueueSize(), signal.tagValue());
            }
            return false;
        }
        counters.accepted.incrementAndGet();
        // shutdown may have started between the state check and the offer
        if (state.get() != PipelineState.RUNNING && buffer.remove(item)) {
            counters.accepted.decrementAndGet();
            return false;
        }
        if (buffer.size() >= config.maxBatchSize()) {
            requestFlush();
        }
        return true;
    }

    private void requestFlush() {
        if (!flushPending.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> {
                flushPending.set(false);
                if (state.get() == PipelineState.RUNNING) {
                    flushSafely();
                }
            });
        } catch (RejectedExecutionException e) {
            flushPending.set(false);
        }
    }

    private void scheduledFlush() {
        if (state.get() == PipelineState.RUNNING) {
            flushSafely();
        }
    }

    // runs on the export thread only
    private void flushSafely() {
        try {
            exportAll(spanBuffer, Signal.SPANS, batch -> transport.exportSpans(encoder.encodeSpans(batch)));
            exportAll(logBuffer, Signal.LOGS, batch -> transport.exportLogs(encoder.encodeLogs(batch)));
        } catch (RuntimeException e) {
            log.error("Unexpected error during export", e);
        }
    }

    // exports at most what was buffered when the pass began, so one signal can't starve the other
    private <T> void exportAll(BoundedBuffer<T> buffer, Signal signal, BatchSender<T> sender) {
        int remaining = buffer.size();
        while (remaining > 0 && !Thread.currentThread().isInterrupted()) {
            List<T> batch = buffer.drain(Math.min(config.maxBatchSize(), remaining));
            if (batch.isEmpty()) {
                return;
            }
            remaining -= batch.size();
            if (sendWithRetry(signal, batch, sender)) {
                dropWarningLogged.set(false);
            }
        }
    }

    private <T> boolean sendWithRetry(Signal signal, List<T> batch, BatchSender<T> sender) {
        RetryPolicy policy = config.retryPolicy();
        int size = batch.size();
        for (int attempt = 1; ; attempt++) {
            long startNanos = System.nanoTime();
            try {
                sender.send(batch);
                metrics.recordExportDuration(signal, Duration.ofNanos(System.nanoTime() - startNanos), true);
                counters(signal).exported.addAndGet(size);
                metrics.recordExported(signal, size);
                log.debug("Exported {} {} via {} (attempt {})", size, signal.tagValue(), transport.getName(), attempt);
                return true;
            } catch (TransportException e) {
                metrics.recordExportDuration(signal, Duration.ofNanos(System.nanoTime() - startNanos), false);
                if (!e.isRetryable() || attempt >= policy.maxAttempts()) {
                    markLost(signal, size);
                    log.warn("Dropping batch of {} {} after {} attempt(s): {}",
                            size, signal.tagValue(), attempt, e.getMessage());
                    return false;
                }
                Duration backoff = policy.backoffAfter(attempt);
                retries.incrementAndGet();
                metrics.recordRetry(signal);
                log.debug("Export attempt {} of {} {} failed ({}), retrying in {}",
                        attempt, size, signal.tagValue(), e.getMessage(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    markLost(signal, size);
                    log.warn("Export of {} {} interrupted during retry backoff", size, signal.tagValue());
                    return false;
                }
            } catch (RuntimeException e) {
                markLost(signal, size);
                log.error("Transport {} failed unexpectedly, dropping {} {}",
                        transport.getName(), size, signal.tagValue(), e);
                return false;
            }
        }
    }

    private void awaitFinalFlush(Future<?> finalFlush) {
        try {
            finalFlush.get(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Final flush did not finish within {}, abandoning it", config.shutdownTimeout());
            forceStopExecutor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceStopExecutor();
        } catch (ExecutionException e) {
            log.warn("Final flush failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    private void forceStopExecutor() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("Export thread did not terminate after interrupt");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeTransport() {
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("Error closing transport {}: {}", transport.getName(), e.getMessage());
        }
    }

    private void markLost(Signal signal, int count) {
        if (count <= 0) {
            return;
        }
        counters(signal).lost.addAndGet(count);
        metrics.recordLost(signal, count);
    }

    private SignalCounters counters(Signal signal) {
        return signal == Signal.SPANS ? spanCounters : logCounters;
    }

    @FunctionalInterface
    private interface BatchSender<T> {
        void send(List<T> batch) throws TransportException;
    }

    private static final class SignalCounters {
        final AtomicLong accepted = new AtomicLong(0);
        final AtomicLong exported = new AtomicLong(0);
        final AtomicLong dropped = new AtomicLong(0);
        final AtomicLong lost = new AtomicLong(0);
    }
}
