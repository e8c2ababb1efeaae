package com.cdcbridge.sink;

import com.cdcbridge.model.Row;
import com.cdcbridge.projection.TableDefinition;

import java.util.List;

/**
 * Minimal warehouse operations the table sink relies on.
 *
 * <p>Implementations report retryable connectivity or quota problems as
 * {@link com.cdcbridge.error.TransientIOException} and permanent rejections as
 * {@link com.cdcbridge.error.SinkWriteException}.</p>
 */
public interface WarehouseClient extends AutoCloseable {

    boolean tableExists(WarehouseTableRef table);

    /**
     * Creates the table with the given columns.
     *
     * @throws TableAlreadyExistsException if the table exists, including when a concurrent
     *                                     caller created it between check and create
     */
    void createTable(WarehouseTableRef table, TableDefinition definition) throws TableAlreadyExistsException;

    /**
     * Appends rows. Existing rows are never modified.
     */
    void appendRows(WarehouseTableRef table, List<Row> rows);

    @Override
    default void close() {
        // nothing to release by default
    }
}
