package com.cdcbridge.kafka;

import com.cdcbridge.model.RawEvent;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Wraps each Kafka record as a {@link RawEvent}, keeping its coordinates and stamping the
 * processing time at which it was read. Payload bytes are passed through untouched; decoding
 * happens downstream where the registry client lives.
 */
public class RawEventDeserializationSchema implements KafkaRecordDeserializationSchema<RawEvent> {

    private static final long serialVersionUID = 1L;

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<RawEvent> out) {
        out.collect(toRawEvent(record, System.currentTimeMillis()));
    }

    static RawEvent toRawEvent(ConsumerRecord<byte[], byte[]> record, long arrivalTimestamp) {
        return RawEvent.builder()
                .key(record.key())
                .value(record.value())
                .topic(record.topic())
                .partition(record.partition())
                .offset(record.offset())
                .arrivalTimestamp(arrivalTimestamp)
                .build();
    }

    @Override
    public TypeInformation<RawEvent> getProducedType() {
        return TypeInformation.of(RawEvent.class);
    }
}
