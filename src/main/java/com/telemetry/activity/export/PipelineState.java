package com.telemetry.activity.export;

/**
 * Lifecycle of an {@link ExportPipeline}. Transitions only move forward.
 */
public enum PipelineState {
    UNINITIALIZED,
    CONFIGURED,
    RUNNING,
    DRAINING,
    STOPPED
}
