package com.pubannotator.pipeline;

/**
 * Failure to obtain a response from the annotation service for one attempt.
 * <p>
 * {@link #isRetryable()} tells the scheduler whether another attempt can help (timeouts,
 * throttling, server errors) or not (rejected request, bad credentials).
 */
public class TransportException extends Exception {
    private final boolean retryable;
    private final int statusCode;

    public TransportException(String message, boolean retryable, int statusCode) {
        super(message);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
        this.statusCode = -1;
    }

    public static TransportException retryable(String message) {
        return new TransportException(message, true, -1);
    }

    public static TransportException fatal(String message) {
        return new TransportException(message, false, -1);
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
