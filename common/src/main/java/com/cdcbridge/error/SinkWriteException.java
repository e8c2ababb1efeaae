package com.cdcbridge.error;

/**
 * Writing a window batch to its destination failed after the sink's retry budget was spent.
 */
public class SinkWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
