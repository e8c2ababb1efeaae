package com.cdcbridge.error;

/**
 * A connectivity failure against the log, the schema registry or the warehouse that
 * may succeed when retried.
 */
public class TransientIOException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
