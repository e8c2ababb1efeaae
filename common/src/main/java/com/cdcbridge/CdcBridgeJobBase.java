package com.cdcbridge;

import com.cdcbridge.config.PipelineConfig;
import com.cdcbridge.kafka.KafkaSourceFactory;
import com.cdcbridge.pipeline.PipelineOrchestrator;
import com.cdcbridge.projection.TableBinding;
import com.cdcbridge.sink.SinkRouter;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.java.utils.ParameterTool;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;

import java.io.IOException;

/**
 * Abstract base for table-specific CDC jobs.
 *
 * <p>Subclasses name their default config resource, the Flink job, and the
 * {@link TableBinding} describing their table. Everything else is driven by the
 * YAML configuration.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class CustomersJob extends CdcBridgeJobBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       protected String getJobName(PipelineConfig c) { return "Customers CDC"; }
 *       protected TableBinding getTableBinding() { return CustomerTable.BINDING; }
 *       public static void main(String[] args) throws Exception { new CustomersJob().run(args); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class CdcBridgeJobBase {

    static final String CONFIG_ARG = "config";

    /**
     * Classpath resource loaded when no {@code --config} path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    /**
     * Display name shown in the Flink dashboard.
     */
    protected abstract String getJobName(PipelineConfig config);

    protected abstract TableBinding getTableBinding();

    /**
     * Runs the pipeline until it is cancelled or fails.
     *
     * @param args {@code --config <path>} plus optional overrides such as
     *             {@code --outputPath}, {@code --windowSizeSeconds}
     */
    public void run(String[] args) throws Exception {
        PipelineConfig config = loadConfig(args);

        log.info("Sink: {}", config.getSinkKind());
        log.info("Topic: {} @ {}", config.getKafka().getTopic(), config.getBootstrapServers());
        log.info("Window: {}s", config.getWindowSizeSeconds());

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setRuntimeMode(RuntimeExecutionMode.STREAMING);
        env.enableCheckpointing(config.getPipeline().getCheckpointIntervalMs(), CheckpointingMode.AT_LEAST_ONCE);
        if (config.getPipeline().getParallelism() > 0) {
            env.setParallelism(config.getPipeline().getParallelism());
        }

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                config, getTableBinding(), new KafkaSourceFactory(config), new SinkRouter(config));
        orchestrator.build(env);

        env.execute(getJobName(config));
    }

    /**
     * Loads the YAML configuration named by {@code --config} (or the classpath default), then
     * applies command-line overrides and validates the result.
     */
    public PipelineConfig loadConfig(String[] args) throws IOException {
        ParameterTool params = ParameterTool.fromArgs(args);
        PipelineConfig config;
        if (params.has(CONFIG_ARG)) {
            log.info("Loading configuration from file: {}", params.get(CONFIG_ARG));
            config = PipelineConfig.load(params.get(CONFIG_ARG));
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = PipelineConfig.loadFromClasspath(resource);
        }
        return config.applyOverrides(params.toMap()).validate();
    }
}
