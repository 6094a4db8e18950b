package com.telemetry.activity.health;

import com.telemetry.activity.export.ExportPipeline;
import com.telemetry.activity.export.PipelineStats;

/**
 * Reports the export pipeline as:
 * <ul>
 *   <li>DOWN when it is not running (not started, draining or stopped)</li>
 *   <li>DEGRADED when items have been lost or dropped since the previous check</li>
 *   <li>UP otherwise</li>
 * </ul>
 */
public class ExportPipelineHealthCheck implements HealthCheck {

    private final ExportPipeline pipeline;
    private long lastLost;
    private long lastDropped;

    public ExportPipelineHealthCheck(ExportPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public String getName() {
        return "exportPipeline";
    }

    @Override
    public synchronized HealthStatus check() {
        PipelineStats stats = pipeline.stats();
        long newlyLost = stats.totalLost() - lastLost;
        long newlyDropped = stats.totalDropped() - lastDropped;
        lastLost = stats.totalLost();
        lastDropped = stats.totalDropped();

        HealthStatus status;
        switch (stats.state()) {
            case RUNNING -> {
                if (newlyLost > 0 || newlyDropped > 0) {
                    status = HealthStatus.degraded("Lost " + newlyLost + " and dropped " + newlyDropped
                            + " item(s) since last check");
                } else {
                    status = HealthStatus.up("Exporting");
                }
            }
            default -> status = HealthStatus.down("Pipeline is " + stats.state());
        }
        return status
                .withDetail("state", stats.state().name())
                .withDetail("queuedSpans", stats.queuedSpans())
                .withDetail("queuedLogs", stats.queuedLogs())
                .withDetail("spansExported", stats.spansExported())
                .withDetail("logsExported", stats.logsExported())
                .withDetail("lost", stats.totalLost())
                .withDetail("dropped", stats.totalDropped());
    }
}
