package com.cdcbridge.config;

import com.cdcbridge.retry.RetryPolicy;
import com.cdcbridge.sink.SinkKind;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Locale;
import java.util.Map;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * under the {@code cdcbridge.*} prefix.  The static {@link #load(String)} and
 * {@link #loadFromClasspath(String)} helpers are used by the Flink entry points and tests.</p>
 */
@Data
@ConfigurationProperties(prefix = "cdcbridge")
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final ObjectMapper YAML_MAPPER = JsonMapper.builder(new YAMLFactory())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    /** Command-line keys that override the loaded configuration. */
    public static final String SCHEMA_REGISTRY_URL = "schemaRegistryUrl";
    public static final String OUTPUT_PATH = "outputPath";
    public static final String OFFSET_RESET_POLICY = "offsetResetPolicy";
    public static final String BOOTSTRAP_SERVERS = "bootstrapServers";
    public static final String WINDOW_SIZE_SECONDS = "windowSizeSeconds";

    private PipelineSection pipeline = new PipelineSection();
    private KafkaSection kafka = new KafkaSection();
    private SchemaRegistryConfig schemaRegistry = new SchemaRegistryConfig();
    private WindowSection window = new WindowSection();
    private SinkSection sink = new SinkSection();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), PipelineConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    /**
     * Applies command-line overrides. Unrecognised keys are ignored.
     */
    public PipelineConfig applyOverrides(Map<String, String> overrides) {
        if (overrides.containsKey(SCHEMA_REGISTRY_URL)) {
            schemaRegistry.setUrl(overrides.get(SCHEMA_REGISTRY_URL));
        }
        if (overrides.containsKey(OUTPUT_PATH)) {
            sink.setOutputPath(overrides.get(OUTPUT_PATH));
        }
        if (overrides.containsKey(OFFSET_RESET_POLICY)) {
            kafka.setOffsetResetPolicy(OffsetResetPolicy.valueOf(
                    overrides.get(OFFSET_RESET_POLICY).trim().toUpperCase(Locale.ROOT)));
        }
        if (overrides.containsKey(BOOTSTRAP_SERVERS)) {
            kafka.setBootstrapServers(overrides.get(BOOTSTRAP_SERVERS));
        }
        if (overrides.containsKey(WINDOW_SIZE_SECONDS)) {
            window.setSizeSeconds(Long.parseLong(overrides.get(WINDOW_SIZE_SECONDS).trim()));
        }
        return this;
    }

    /**
     * Rejects configurations the pipeline cannot run with.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public PipelineConfig validate() {
        require(isSet(kafka.getBootstrapServers()), "kafka.bootstrapServers must be set");
        require(isSet(kafka.getTopic()), "kafka.topic must be set");
        require(isSet(kafka.getConsumerGroup()), "kafka.consumerGroup must be set");
        require(isSet(schemaRegistry.getUrl()), "schemaRegistry.url must be set");
        require(window.getSizeSeconds() > 0, "window.sizeSeconds must be positive");
        require(window.getAllowedLatenessSeconds() >= 0, "window.allowedLatenessSeconds must not be negative");
        if (getSinkKind() == SinkKind.TABLE) {
            WarehouseConfig warehouse = sink.getWarehouse();
            require(isSet(warehouse.getProjectId()) && isSet(warehouse.getDatasetId())
                            && isSet(warehouse.getTableId()),
                    "sink.warehouse projectId, datasetId and tableId must be set when no outputPath is given");
        }
        return this;
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public String getSchemaRegistryUrl() {
        return schemaRegistry.getUrl();
    }

    public String getOutputPath() {
        return sink.getOutputPath();
    }

    public OffsetResetPolicy getOffsetResetPolicy() {
        return kafka.getOffsetResetPolicy();
    }

    public String getBootstrapServers() {
        return kafka.getBootstrapServers();
    }

    public long getWindowSizeSeconds() {
        return window.getSizeSeconds();
    }

    public SinkKind getSinkKind() {
        return SinkKind.resolve(getOutputPath());
    }

    public RetryPolicy getRegistryRetryPolicy() {
        return new RetryPolicy(schemaRegistry.getMaxAttempts(), schemaRegistry.getRetryBackoffMs(),
                schemaRegistry.getMaxRetryBackoffMs(), 2.0);
    }

    public RetryPolicy getWarehouseRetryPolicy() {
        WarehouseConfig warehouse = sink.getWarehouse();
        return new RetryPolicy(warehouse.getMaxAttempts(), warehouse.getRetryBackoffMs(),
                warehouse.getMaxRetryBackoffMs(), 2.0);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class PipelineSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private long checkpointIntervalMs = 60_000;
        /** Operator parallelism; {@code 0} keeps the cluster default. */
        private int parallelism = 0;
    }

    @Data
    public static class KafkaSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private String bootstrapServers = "localhost:9092";
        private String topic;
        private String consumerGroup = "cdc-bridge";
        private OffsetResetPolicy offsetResetPolicy = OffsetResetPolicy.EARLIEST;
        private long reconnectBackoffMs = 500;
        private long reconnectBackoffMaxMs = 30_000;
        private long retryBackoffMs = 500;
    }

    @Data
    public static class WindowSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private long sizeSeconds = 2;
        private long allowedLatenessSeconds = 0;
        private LatePolicy latePolicy = LatePolicy.DROP;
        private DrainPolicy drainPolicy = DrainPolicy.FLUSH;
    }

    @Data
    public static class SinkSection implements Serializable {
        private static final long serialVersionUID = 1L;
        /** When set, rows go to windowed files under this prefix instead of the warehouse. */
        private String outputPath;
        private WarehouseConfig warehouse = new WarehouseConfig();
    }
}
