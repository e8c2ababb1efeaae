package com.cdcbridge.config;

import com.cdcbridge.sink.SinkKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigTest {

    @Test
    void loadsEverySectionFromYaml() throws IOException {
        // when
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        // then
        assertThat(config.getPipeline().getParallelism()).isEqualTo(2);
        assertThat(config.getBootstrapServers()).isEqualTo("kafka:9092");
        assertThat(config.getKafka().getTopic()).isEqualTo("dbserver1.bank.accounts");
        assertThat(config.getOffsetResetPolicy()).isEqualTo(OffsetResetPolicy.LATEST);
        assertThat(config.getSchemaRegistryUrl()).isEqualTo("http://registry:8081");
        assertThat(config.getWindowSizeSeconds()).isEqualTo(5);
        assertThat(config.getWindow().getLatePolicy()).isEqualTo(LatePolicy.LATE_OUTPUT);
        assertThat(config.getWindow().getDrainPolicy()).isEqualTo(DrainPolicy.DISCARD);
        assertThat(config.getSink().getWarehouse().toTableRef()).hasToString("test-project.bank.accounts");
        assertThat(config.getSinkKind()).isEqualTo(SinkKind.TABLE);
        assertThat(config.getWarehouseRetryPolicy().getMaxAttempts()).isEqualTo(4);
        assertThat(config.getRegistryRetryPolicy().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, "kafka:\n  topic: t1\nsink:\n  outputPath: /tmp/rows\n");

        PipelineConfig config = PipelineConfig.load(file.toString());

        assertThat(config.getKafka().getTopic()).isEqualTo("t1");
        assertThat(config.getSinkKind()).isEqualTo(SinkKind.FILE);
        assertThat(config.getWindowSizeSeconds()).isEqualTo(2);
        assertThat(config.getWindow().getLatePolicy()).isEqualTo(LatePolicy.DROP);
        assertThat(config.getWindow().getDrainPolicy()).isEqualTo(DrainPolicy.FLUSH);
    }

    @Test
    void missingClasspathResourceIsAnError() {
        assertThatThrownBy(() -> PipelineConfig.loadFromClasspath("nope.yaml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("nope.yaml");
    }

    @Test
    void commandLineOverridesWin() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        config.applyOverrides(Map.of(
                "schemaRegistryUrl", "http://other:8081",
                "outputPath", "/tmp/customers",
                "offsetResetPolicy", "earliest",
                "bootstrapServers", "broker:29092",
                "windowSizeSeconds", "10",
                "unrelated", "ignored"));

        assertThat(config.getSchemaRegistryUrl()).isEqualTo("http://other:8081");
        assertThat(config.getOutputPath()).isEqualTo("/tmp/customers");
        assertThat(config.getSinkKind()).isEqualTo(SinkKind.FILE);
        assertThat(config.getOffsetResetPolicy()).isEqualTo(OffsetResetPolicy.EARLIEST);
        assertThat(config.getBootstrapServers()).isEqualTo("broker:29092");
        assertThat(config.getWindowSizeSeconds()).isEqualTo(10);
    }

    @Test
    void unknownOffsetResetPolicyIsRejected() {
        PipelineConfig config = new PipelineConfig();

        assertThatThrownBy(() -> config.applyOverrides(Map.of("offsetResetPolicy", "sometimes")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validateAcceptsLoadedConfig() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        assertThat(config.validate()).isSameAs(config);
    }

    @Test
    void validateRejectsNonPositiveWindow() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");
        config.getWindow().setSizeSeconds(0);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window.sizeSeconds");
    }

    @Test
    void validateRejectsMissingTopic() {
        PipelineConfig config = new PipelineConfig();
        config.getSink().setOutputPath("/tmp/out");

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafka.topic");
    }

    @Test
    void tableSinkRequiresTableCoordinates() {
        PipelineConfig config = new PipelineConfig();
        config.getKafka().setTopic("t");

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sink.warehouse");

        config.getSink().setOutputPath("/tmp/out");
        assertThat(config.validate().getSinkKind()).isEqualTo(SinkKind.FILE);
    }

    @Test
    void offsetResetPolicyMapsToKafkaStrategy() {
        assertThat(OffsetResetPolicy.EARLIEST.toKafkaStrategy().name()).isEqualTo("EARLIEST");
        assertThat(OffsetResetPolicy.LATEST.toKafkaStrategy().name()).isEqualTo("LATEST");
    }
}
