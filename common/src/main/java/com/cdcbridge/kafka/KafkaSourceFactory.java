package com.cdcbridge.kafka;

import com.cdcbridge.config.PipelineConfig;
import com.cdcbridge.model.RawEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.kafka.clients.consumer.ConsumerConfig;

import java.io.Serializable;

/**
 * Creates the {@link KafkaSource} reading change events from the configured topic.
 *
 * <p>Offsets come from the consumer group's commits; the offset reset policy only applies to
 * partitions without one. Offsets are committed back to Kafka when a checkpoint completes,
 * while Flink's own checkpoint holds the authoritative position for recovery.</p>
 */
@Slf4j
public class KafkaSourceFactory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final PipelineConfig.KafkaSection kafka;

    public KafkaSourceFactory(PipelineConfig config) {
        this.kafka = config.getKafka();
    }

    public KafkaSource<RawEvent> createRawEventSource() {
        log.info("Kafka source: topic={} group={} bootstrap={} reset={}",
                kafka.getTopic(), kafka.getConsumerGroup(), kafka.getBootstrapServers(),
                kafka.getOffsetResetPolicy());
        return KafkaSource.<RawEvent>builder()
                .setBootstrapServers(kafka.getBootstrapServers())
                .setTopics(kafka.getTopic())
                .setGroupId(kafka.getConsumerGroup())
                .setStartingOffsets(OffsetsInitializer.committedOffsets(
                        kafka.getOffsetResetPolicy().toKafkaStrategy()))
                .setDeserializer(new RawEventDeserializationSchema())
                .setProperty("commit.offsets.on.checkpoint", "true")
                .setProperty(ConsumerConfig.RECONNECT_BACKOFF_MS_CONFIG,
                        String.valueOf(kafka.getReconnectBackoffMs()))
                .setProperty(ConsumerConfig.RECONNECT_BACKOFF_MAX_MS_CONFIG,
                        String.valueOf(kafka.getReconnectBackoffMaxMs()))
                .setProperty(ConsumerConfig.RETRY_BACKOFF_MS_CONFIG,
                        String.valueOf(kafka.getRetryBackoffMs()))
                .build();
    }
}
