package com.cdcbridge.testutil;

import com.cdcbridge.error.SchemaResolutionException;
import com.cdcbridge.registry.SchemaRegistryClient;
import org.apache.avro.Schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry double that hands out sequential ids and counts lookups.
 */
public class InMemorySchemaRegistry implements SchemaRegistryClient {

    private final Map<Integer, String> schemas = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final AtomicInteger fetches = new AtomicInteger();
    private volatile boolean closed;

    public int register(Schema schema) {
        int id = nextId.getAndIncrement();
        schemas.put(id, schema.toString());
        return id;
    }

    @Override
    public String fetchSchema(int schemaId) {
        fetches.incrementAndGet();
        String schema = schemas.get(schemaId);
        if (schema == null) {
            throw new SchemaResolutionException(schemaId, "Schema id " + schemaId + " is not registered");
        }
        return schema;
    }

    public int fetchCount() {
        return fetches.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
