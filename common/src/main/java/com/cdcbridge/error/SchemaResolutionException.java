package com.cdcbridge.error;

/**
 * The schema id embedded in a payload is not known to the registry.
 *
 * <p>Never retried: registry ids are immutable once published, so an unknown id
 * stays unknown and no fallback decoding is attempted.</p>
 */
public class SchemaResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int schemaId;

    public SchemaResolutionException(int schemaId, String message) {
        super(message);
        this.schemaId = schemaId;
    }

    public SchemaResolutionException(int schemaId, String message, Throwable cause) {
        super(message, cause);
        this.schemaId = schemaId;
    }

    public int getSchemaId() {
        return schemaId;
    }
}
