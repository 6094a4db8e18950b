package com.telemetry.activity.api;

/**
 * Thrown when telemetry cannot be set up from the given settings, for example a malformed
 * collector endpoint or an unsupported protocol. Only initialization raises it.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
