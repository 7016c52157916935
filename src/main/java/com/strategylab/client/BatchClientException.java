package com.strategylab.client;

/**
 * A call to the batch API failed. {@code statusCode} is the HTTP status, or 0 when the
 * server could not be reached.
 */
public class BatchClientException extends RuntimeException {

    private final int statusCode;

    public BatchClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return statusCode == 0 || statusCode >= 500;
    }
}
