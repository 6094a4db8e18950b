package com.telemetry.activity.core.model;

/**
 * Runtime exception thrown when a caller passes a value outside a closed set,
 * such as an unknown span kind or log level name.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
