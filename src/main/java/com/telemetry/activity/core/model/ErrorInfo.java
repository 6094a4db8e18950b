package com.telemetry.activity.core.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Error payload attached to a log record or span event.
 *
 * @param type       exception class name, may be null for plain error messages
 * @param message    error message, may be null
 * @param stackTrace rendered stack trace, may be null
 */
public record ErrorInfo(String type, String message, String stackTrace) {

    public static ErrorInfo of(String message) {
        return new ErrorInfo(null, message, null);
    }

    public static ErrorInfo from(Throwable t) {
        StringWriter writer = new StringWriter();
        t.printStackTrace(new PrintWriter(writer));
        return new ErrorInfo(t.getClass().getName(), t.getMessage(), writer.toString());
    }
}
