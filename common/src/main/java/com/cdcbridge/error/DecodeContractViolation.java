package com.cdcbridge.error;

/**
 * A payload could not be turned into a complete, correctly typed record: the frame is
 * malformed, or a required field is missing, null or of the wrong type.
 */
public class DecodeContractViolation extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public DecodeContractViolation(String message) {
        this(null, message, null);
    }

    public DecodeContractViolation(String message, Throwable cause) {
        this(null, message, cause);
    }

    public DecodeContractViolation(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * The offending field, or {@code null} when the whole payload was unreadable.
     */
    public String getField() {
        return field;
    }
}
