package com.cdcbridge.registry;

import java.io.Closeable;

/**
 * Looks up writer schemas by the id embedded in each payload.
 */
public interface SchemaRegistryClient extends Closeable {

    /**
     * Returns the schema definition text registered under {@code schemaId}.
     *
     * @throws com.cdcbridge.error.SchemaResolutionException if the registry does not know the id
     * @throws com.cdcbridge.error.TransientIOException      if the registry stayed unreachable
     */
    String fetchSchema(int schemaId);

    @Override
    default void close() {
        // nothing to release by default
    }
}
