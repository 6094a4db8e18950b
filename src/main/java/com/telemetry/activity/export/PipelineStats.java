package com.telemetry.activity.export;

/**
 * Point-in-time counters of an {@link ExportPipeline}.
 *
 * @param accepted items taken into a buffer
 * @param exported items delivered to the collector
 * @param dropped  items refused because the buffer was full
 * @param lost     items in batches abandoned after failed delivery or discarded at shutdown
 */
public record PipelineStats(
        PipelineState state,
        long spansAccepted,
        long spansExported,
        long spansDropped,
        long spansLost,
        long logsAccepted,
        long logsExported,
        long logsDropped,
        long logsLost,
        long retries,
        int queuedSpans,
        int queuedLogs
) {

    public long totalLost() {
        return spansLost + logsLost;
    }

    public long totalDropped() {
        return spansDropped + logsDropped;
    }
}
