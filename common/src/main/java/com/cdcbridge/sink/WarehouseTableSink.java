package com.cdcbridge.sink;

import com.cdcbridge.model.WindowBatch;
import com.cdcbridge.projection.TableDefinition;
import com.cdcbridge.retry.Retrier;
import com.cdcbridge.retry.RetryPolicy;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.api.connector.sink2.SinkWriter;
import org.apache.flink.api.connector.sink2.WriterInitContext;

/**
 * Flink sink appending window batches to a warehouse table, creating it if absent.
 */
public class WarehouseTableSink implements Sink<WindowBatch> {

    private static final long serialVersionUID = 1L;

    private final WarehouseClientFactory clientFactory;
    private final WarehouseTableRef table;
    private final TableDefinition definition;
    private final RetryPolicy retryPolicy;

    public WarehouseTableSink(WarehouseClientFactory clientFactory,
                              WarehouseTableRef table,
                              TableDefinition definition,
                              RetryPolicy retryPolicy) {
        this.clientFactory = clientFactory;
        this.table = table;
        this.definition = definition;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public SinkWriter<WindowBatch> createWriter(InitContext context) {
        return openWriter();
    }

    @Override
    public SinkWriter<WindowBatch> createWriter(WriterInitContext context) {
        return openWriter();
    }

    WarehouseTableWriter openWriter() {
        WarehouseTableWriter writer = new WarehouseTableWriter(
                clientFactory.create(), table, definition, new Retrier(retryPolicy));
        writer.ensureTable();
        return writer;
    }
}
