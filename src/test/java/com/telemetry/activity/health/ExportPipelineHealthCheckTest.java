package com.telemetry.activity.health;

import com.telemetry.activity.export.ExportPipeline;
import com.telemetry.activity.export.PipelineState;
import com.telemetry.activity.export.PipelineStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ExportPipelineHealthCheck Tests")
class ExportPipelineHealthCheckTest {

    private static PipelineStats stats(PipelineState state, long lost, long dropped) {
        return new PipelineStats(state, 10, 8, dropped, lost, 0, 0, 0, 0, 0, 2, 0);
    }

    @Test
    @DisplayName("Running pipeline without losses should be UP")
    void up() {
        ExportPipeline pipeline = mock(ExportPipeline.class);
        when(pipeline.stats()).thenReturn(stats(PipelineState.RUNNING, 0, 0));

        HealthStatus status = new ExportPipelineHealthCheck(pipeline).check();

        assertTrue(status.isUp());
        assertEquals("RUNNING", status.details().get("state"));
        assertEquals(2, status.details().get("queuedSpans"));
    }

    @Test
    @DisplayName("New losses since the previous check should be DEGRADED")
    void degradedThenRecovered() {
        ExportPipeline pipeline = mock(ExportPipeline.class);
        when(pipeline.stats()).thenReturn(stats(PipelineState.RUNNING, 3, 1));
        ExportPipelineHealthCheck check = new ExportPipelineHealthCheck(pipeline);

        assertEquals(HealthStatus.Status.DEGRADED, check.check().status());
        // no new losses
        assertEquals(HealthStatus.Status.UP, check.check().status());
    }

    @Test
    @DisplayName("Pipeline that is not running should be DOWN")
    void down() {
        ExportPipeline pipeline = mock(ExportPipeline.class);
        when(pipeline.stats()).thenReturn(stats(PipelineState.STOPPED, 0, 0));
        ExportPipelineHealthCheck check = new ExportPipelineHealthCheck(pipeline);

        HealthStatus status = check.check();

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertEquals("exportPipeline", check.getName());
    }
}
