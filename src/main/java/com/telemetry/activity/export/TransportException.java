package com.telemetry.activity.export;

/**
 * Failure to deliver a batch to the collector. Never leaves the export pipeline.
 */
public class TransportException extends Exception {

    private final boolean retryable;

    public TransportException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TransportException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * @return true if the same batch may succeed when sent again later
     */
    public boolean isRetryable() {
        return retryable;
    }
}
