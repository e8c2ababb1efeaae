package com.cdcbridge.config;

import com.cdcbridge.kafka.KafkaSourceFactory;
import com.cdcbridge.pipeline.PipelineOrchestrator;
import com.cdcbridge.projection.TableBinding;
import com.cdcbridge.sink.SinkRouter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires the pipeline beans from {@code cdcbridge.*} properties.
 *
 * <p>Beans defined here are <strong>driver-side</strong> only: they build the Flink
 * topology before job submission. Operators running on task managers stay plain
 * serialisable objects. A {@link TableBinding} bean must be supplied by the table module.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class CdcBridgeAutoConfiguration {

    @Bean
    public KafkaSourceFactory kafkaSourceFactory(PipelineConfig config) {
        return new KafkaSourceFactory(config);
    }

    @Bean
    public SinkRouter sinkRouter(PipelineConfig config) {
        return new SinkRouter(config);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineConfig config,
                                                     TableBinding tableBinding,
                                                     KafkaSourceFactory kafkaSourceFactory,
                                                     SinkRouter sinkRouter) {
        return new PipelineOrchestrator(config, tableBinding, kafkaSourceFactory, sinkRouter);
    }
}
