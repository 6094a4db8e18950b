package com.telemetry.activity.core.model;

import java.time.Instant;

/**
 * Source of wall-clock timestamps in epoch nanoseconds.
 */
@FunctionalInterface
public interface Clock {

    Clock SYSTEM = () -> {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    };

    long nowEpochNanos();
}
