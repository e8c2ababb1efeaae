package com.cdcbridge.pipeline;

import com.cdcbridge.config.LatePolicy;
import com.cdcbridge.config.PipelineConfig;
import com.cdcbridge.decode.DecodeFunction;
import com.cdcbridge.kafka.KafkaSourceFactory;
import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.RawEvent;
import com.cdcbridge.model.WindowBatch;
import com.cdcbridge.projection.TableBinding;
import com.cdcbridge.sink.SinkRouter;
import com.cdcbridge.window.ArrivalTimeWatermarks;
import com.cdcbridge.window.FixedWindows;
import com.cdcbridge.window.LateRecordBatcher;
import com.cdcbridge.window.LatenessDeadlineTrigger;
import com.cdcbridge.window.ProjectingWindowFunction;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.OutputTag;

import java.time.Duration;

/**
 * Wires the pipeline once at startup:
 * <pre>
 *   [Kafka topic]
 *       → decode (schema registry + Avro, contract check)
 *       → keyBy(partition) → fixed windows over arrival time
 *       → project rows when a window fires
 *       → warehouse table | windowed files
 * </pre>
 *
 * <p>Partitions are processed independently; each window operator subtask exclusively owns
 * the open windows of the partitions assigned to it.</p>
 */
@Slf4j
public class PipelineOrchestrator {

    static final OutputTag<DecodedRecord> LATE_RECORDS = new OutputTag<>("late-records") {};

    private final PipelineConfig config;
    private final TableBinding binding;
    private final KafkaSourceFactory kafkaSourceFactory;
    private final SinkRouter sinkRouter;

    public PipelineOrchestrator(PipelineConfig config,
                                TableBinding binding,
                                KafkaSourceFactory kafkaSourceFactory,
                                SinkRouter sinkRouter) {
        this.config = config;
        this.binding = binding;
        this.kafkaSourceFactory = kafkaSourceFactory;
        this.sinkRouter = sinkRouter;
    }

    public void build(StreamExecutionEnvironment env) {
        DataStream<RawEvent> raw = env.fromSource(
                kafkaSourceFactory.createRawEventSource(),
                ArrivalTimeWatermarks.forRawEvents(),
                "cdc-source");

        DataStream<DecodedRecord> decoded = raw
                .map(new DecodeFunction(config, binding.getContract()))
                .name("decode")
                .uid("decode");

        sinkRouter.attach(window(decoded), binding.getTableDefinition());
    }

    /**
     * Windows decoded records (already carrying event timestamps) and projects each fired
     * window into a batch. Late records join the output as single-row late batches when the
     * late policy asks for it.
     */
    public DataStream<WindowBatch> window(DataStream<DecodedRecord> decoded) {
        PipelineConfig.WindowSection settings = config.getWindow();
        FixedWindows windows = FixedWindows.ofSeconds(settings.getSizeSeconds());
        Duration allowedLateness = Duration.ofSeconds(settings.getAllowedLatenessSeconds());
        log.info("Windowing: size={}s allowedLateness={}s late={} drain={}",
                settings.getSizeSeconds(), settings.getAllowedLatenessSeconds(),
                settings.getLatePolicy(), settings.getDrainPolicy());

        SingleOutputStreamOperator<WindowBatch> batches = decoded
                .keyBy(DecodedRecord::getPartition)
                .window(windows.assigner())
                .trigger(new LatenessDeadlineTrigger(allowedLateness, settings.getDrainPolicy()))
                .allowedLateness(allowedLateness)
                .sideOutputLateData(LATE_RECORDS)
                .process(new ProjectingWindowFunction(binding.getProjector(), binding.getTableDefinition()))
                .name("window-project")
                .uid("window-project");

        if (settings.getLatePolicy() == LatePolicy.LATE_OUTPUT) {
            DataStream<WindowBatch> late = batches.getSideOutput(LATE_RECORDS)
                    .map(new LateRecordBatcher(windows, binding.getProjector(), binding.getTableDefinition()))
                    .name("late-records")
                    .uid("late-records");
            return batches.union(late);
        }
        return batches;
    }
}
