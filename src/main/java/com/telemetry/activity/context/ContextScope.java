package com.telemetry.activity.context;

/**
 * Handle returned when a span is made current on a thread; closing it undoes the attachment.
 */
public interface ContextScope extends AutoCloseable {

    ContextScope NOOP = () -> { };

    @Override
    void close();
}
