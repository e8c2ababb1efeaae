package com.cdcbridge.sink;

import com.cdcbridge.config.PipelineConfig;
import com.cdcbridge.model.WindowBatch;
import com.cdcbridge.projection.TableDefinition;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.DataStreamSink;

import java.io.Serializable;

/**
 * Attaches the destination selected by configuration: the warehouse table, or windowed
 * files when {@code outputPath} is set. The choice is made once, when the job graph is built.
 */
@Slf4j
public class SinkRouter implements Serializable {

    private static final long serialVersionUID = 1L;

    private final PipelineConfig config;
    private final WarehouseClientFactory warehouseClientFactory;

    public SinkRouter(PipelineConfig config) {
        this(config, BigQueryWarehouseClient.factory(config.getSink().getWarehouse().getProjectId()));
    }

    public SinkRouter(PipelineConfig config, WarehouseClientFactory warehouseClientFactory) {
        this.config = config;
        this.warehouseClientFactory = warehouseClientFactory;
    }

    public DataStreamSink<WindowBatch> attach(DataStream<WindowBatch> batches, TableDefinition definition) {
        SinkKind kind = config.getSinkKind();
        switch (kind) {
            case FILE:
                log.info("Routing window batches to files at {}", config.getOutputPath());
                return batches.sinkTo(new WindowedFileSink(config.getOutputPath()))
                        .name("windowed-file-sink")
                        .uid("windowed-file-sink");
            case TABLE:
                WarehouseTableRef table = config.getSink().getWarehouse().toTableRef();
                log.info("Routing window batches to warehouse table {}", table);
                return batches.sinkTo(new WarehouseTableSink(
                                warehouseClientFactory, table, definition, config.getWarehouseRetryPolicy()))
                        .name("warehouse-table-sink")
                        .uid("warehouse-table-sink");
            default:
                throw new IllegalStateException("Unhandled sink kind " + kind);
        }
    }
}
