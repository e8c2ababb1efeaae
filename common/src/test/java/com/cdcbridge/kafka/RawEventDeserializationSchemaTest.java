package com.cdcbridge.kafka;

import com.cdcbridge.model.RawEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class RawEventDeserializationSchemaTest {

    @Test
    void keepsCoordinatesAndPayloadAndStampsArrivalTime() {
        // given
        byte[] key = "k".getBytes(StandardCharsets.UTF_8);
        byte[] value = {0, 0, 0, 0, 7, 2};
        ConsumerRecord<byte[], byte[]> record =
                new ConsumerRecord<>("dbserver1.inventory.customers", 3, 42L, key, value);

        // when
        RawEvent event = RawEventDeserializationSchema.toRawEvent(record, 1_234L);

        // then
        assertThat(event.getTopic()).isEqualTo("dbserver1.inventory.customers");
        assertThat(event.getPartition()).isEqualTo(3);
        assertThat(event.getOffset()).isEqualTo(42L);
        assertThat(event.getValue()).isEqualTo(value);
        assertThat(event.getKey()).isEqualTo(key);
        assertThat(event.getArrivalTimestamp()).isEqualTo(1_234L);
    }

    @Test
    void producesRawEvents() {
        assertThat(new RawEventDeserializationSchema().getProducedType().getTypeClass())
                .isEqualTo(RawEvent.class);
    }
}
