package com.cdcbridge.sink;

import com.cdcbridge.error.SinkWriteException;
import com.cdcbridge.error.TransientIOException;
import com.cdcbridge.model.WindowBatch;
import com.cdcbridge.projection.TableDefinition;
import com.cdcbridge.retry.Retrier;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.connector.sink2.SinkWriter;

/**
 * Appends each window batch to the warehouse table.
 *
 * <p>Writes are at-least-once: a batch whose append failed part-way is appended again on
 * retry or after recovery, so consumers that need exactly-once must deduplicate on
 * {@code (id, __lsn)}.</p>
 */
@Slf4j
public class WarehouseTableWriter implements SinkWriter<WindowBatch> {

    private final WarehouseClient client;
    private final WarehouseTableRef table;
    private final TableDefinition definition;
    private final Retrier retrier;

    public WarehouseTableWriter(WarehouseClient client,
                                WarehouseTableRef table,
                                TableDefinition definition,
                                Retrier retrier) {
        this.client = client;
        this.table = table;
        this.definition = definition;
        this.retrier = retrier;
    }

    /**
     * Creates the table unless it exists. Safe to call from many writers at once: losing the
     * creation race counts as success.
     */
    public void ensureTable() {
        retrier.call("Create table " + table, () -> {
            if (client.tableExists(table)) {
                log.info("Table {} already exists", table);
                return null;
            }
            try {
                client.createTable(table, definition);
                log.info("Created table {} with columns {}", table, definition.columnNames());
            } catch (TableAlreadyExistsException e) {
                log.info("Table {} was created concurrently by another writer", table);
            }
            return null;
        }, TransientIOException.class::isInstance, this::exhausted);
    }

    @Override
    public void write(WindowBatch batch, Context context) {
        if (batch.getRows().isEmpty()) {
            return;
        }
        retrier.call("Append window [" + batch.getWindowStart() + ", " + batch.getWindowEnd()
                        + ") shard=" + batch.getShard() + " to " + table,
                () -> {
                    client.appendRows(table, batch.getRows());
                    return null;
                },
                TransientIOException.class::isInstance,
                this::exhausted);
        log.debug("Appended {} rows for window [{}, {}) shard={}{}", batch.size(),
                batch.getWindowStart(), batch.getWindowEnd(), batch.getShard(), batch.isLate() ? " (late)" : "");
    }

    @Override
    public void flush(boolean endOfInput) {
        // every batch is appended synchronously in write()
    }

    @Override
    public void close() {
        client.close();
    }

    private RuntimeException exhausted(Exception cause) {
        if (cause instanceof SinkWriteException) {
            return (SinkWriteException) cause;
        }
        return new SinkWriteException("Warehouse write to " + table + " failed: " + cause.getMessage(), cause);
    }
}
