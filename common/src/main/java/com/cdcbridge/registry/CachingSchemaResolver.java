package com.cdcbridge.registry;

import com.cdcbridge.error.SchemaResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;

import java.io.Closeable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves Avro writer schemas by id and keeps them for the lifetime of the resolver.
 *
 * <p>Registry schemas never change once published and a topic only ever sees a handful of
 * ids, so entries are never evicted. Reads are lock-free; on a miss the schema is fetched
 * outside any lock and published with {@code putIfAbsent}, so concurrent misses for the
 * same id may fetch twice but always agree on the cached instance.</p>
 */
@Slf4j
public class CachingSchemaResolver implements Closeable {

    private final SchemaRegistryClient client;
    private final ConcurrentMap<Integer, Schema> cache = new ConcurrentHashMap<>();

    public CachingSchemaResolver(SchemaRegistryClient client) {
        this.client = client;
    }

    public Schema resolve(int schemaId) {
        Schema cached = cache.get(schemaId);
        if (cached != null) {
            return cached;
        }
        String definition = client.fetchSchema(schemaId);
        Schema parsed;
        try {
            parsed = new Schema.Parser().parse(definition);
        } catch (SchemaParseException e) {
            throw new SchemaResolutionException(schemaId,
                    "Registry schema id=" + schemaId + " is not a valid Avro schema", e);
        }
        Schema winner = cache.putIfAbsent(schemaId, parsed);
        if (winner == null) {
            log.info("Cached writer schema id={} ({})", schemaId, parsed.getFullName());
            return parsed;
        }
        return winner;
    }

    public int cachedCount() {
        return cache.size();
    }

    @Override
    public void close() {
        cache.clear();
        client.close();
    }
}
