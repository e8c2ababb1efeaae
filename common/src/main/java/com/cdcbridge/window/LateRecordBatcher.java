package com.cdcbridge.window;

import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.Row;
import com.cdcbridge.model.WindowBatch;
import com.cdcbridge.projection.RowProjector;
import com.cdcbridge.projection.TableDefinition;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.functions.MapFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a record that missed its window into a single-row batch flagged {@code late}.
 */
@Slf4j
public class LateRecordBatcher implements MapFunction<DecodedRecord, WindowBatch> {

    private static final long serialVersionUID = 1L;

    private final FixedWindows windows;
    private final RowProjector projector;
    private final TableDefinition tableDefinition;

    public LateRecordBatcher(FixedWindows windows, RowProjector projector, TableDefinition tableDefinition) {
        this.windows = windows;
        this.projector = projector;
        this.tableDefinition = tableDefinition;
    }

    @Override
    public WindowBatch map(DecodedRecord record) {
        TimeWindow window = windows.windowFor(record.getArrivalTimestamp());
        log.warn("Late record partition={} offset={} for closed window [{}, {})",
                record.getPartition(), record.getOffset(), window.getStart(), window.getEnd());
        List<Row> rows = new ArrayList<>();
        rows.add(ProjectingWindowFunction.project(projector, tableDefinition, record));
        return WindowBatch.builder()
                .shard(record.getPartition())
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .late(true)
                .firstOffset(record.getOffset())
                .rows(rows)
                .build();
    }
}
