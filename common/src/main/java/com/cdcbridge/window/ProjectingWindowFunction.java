package com.cdcbridge.window;

import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.Row;
import com.cdcbridge.model.WindowBatch;
import com.cdcbridge.projection.RowProjector;
import com.cdcbridge.projection.TableDefinition;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects the records of a fired window into rows and emits them as one {@link WindowBatch}
 * per (window, partition).
 */
@Slf4j
public class ProjectingWindowFunction
        extends ProcessWindowFunction<DecodedRecord, WindowBatch, Integer, TimeWindow> {

    private static final long serialVersionUID = 1L;

    private final RowProjector projector;
    private final TableDefinition tableDefinition;

    public ProjectingWindowFunction(RowProjector projector, TableDefinition tableDefinition) {
        this.projector = projector;
        this.tableDefinition = tableDefinition;
    }

    @Override
    public void process(Integer partition,
                        Context context,
                        Iterable<DecodedRecord> records,
                        Collector<WindowBatch> out) {
        List<Row> rows = new ArrayList<>();
        long firstOffset = Long.MAX_VALUE;
        for (DecodedRecord record : records) {
            rows.add(project(projector, tableDefinition, record));
            firstOffset = Math.min(firstOffset, record.getOffset());
        }
        if (rows.isEmpty()) {
            return;
        }
        TimeWindow window = context.window();
        log.debug("Window [{}, {}) partition={} fired with {} rows",
                window.getStart(), window.getEnd(), partition, rows.size());
        out.collect(WindowBatch.builder()
                .shard(partition)
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .late(false)
                .firstOffset(firstOffset)
                .rows(rows)
                .build());
    }

    static Row project(RowProjector projector, TableDefinition tableDefinition, DecodedRecord record) {
        Row row = projector.project(record);
        tableDefinition.checkConforms(row);
        return row;
    }
}
