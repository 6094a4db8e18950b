package com.telemetry.activity.core.model;

/**
 * Kind of telemetry flowing through the export pipeline.
 */
public enum Signal {
    SPANS,
    LOGS;

    public String tagValue() {
        return this == SPANS ? "spans" : "logs";
    }
}
