package com.cdcbridge.customers;

import com.cdcbridge.customers.model.CustomerTable;
import com.cdcbridge.decode.RegistryAvroDecoder;
import com.cdcbridge.error.DecodeContractViolation;
import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.RawEvent;
import com.cdcbridge.model.Row;
import com.cdcbridge.registry.CachingSchemaResolver;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Decodes customer change events as the connector writes them and projects them into rows.
 */
class CustomerChangeDecodingTest {

    private static final int FULL_SCHEMA_ID = 1;
    private static final int NO_EMAIL_SCHEMA_ID = 2;

    private static final Schema FULL = SchemaBuilder.record("Value").namespace("dbserver1.inventory.customers")
            .fields()
            .requiredInt("id")
            .requiredString("first_name")
            .requiredString("last_name")
            .requiredString("email")
            .optionalString("__op")
            .optionalLong("__source_ts_ms")
            .optionalLong("__lsn")
            .endRecord();

    private static final Schema NO_EMAIL = SchemaBuilder.record("Value").namespace("dbserver1.inventory.customers")
            .fields()
            .requiredInt("id")
            .requiredString("first_name")
            .requiredString("last_name")
            .optionalString("__op")
            .optionalLong("__source_ts_ms")
            .optionalLong("__lsn")
            .endRecord();

    private static final Map<Integer, Schema> REGISTRY = Map.of(FULL_SCHEMA_ID, FULL, NO_EMAIL_SCHEMA_ID, NO_EMAIL);

    private final RegistryAvroDecoder decoder = new RegistryAvroDecoder(
            new CachingSchemaResolver(id -> REGISTRY.get(id).toString()), CustomerTable.CONTRACT);

    private static byte[] frame(int schemaId, GenericRecord record) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(body, null);
        new GenericDatumWriter<GenericRecord>(record.getSchema()).write(record, encoder);
        encoder.flush();
        return ByteBuffer.allocate(5 + body.size()).put((byte) 0).putInt(schemaId).put(body.toByteArray()).array();
    }

    private static GenericRecord change(Schema schema, int id, String op) {
        GenericRecord record = new GenericData.Record(schema);
        record.put("id", id);
        record.put("first_name", "Sally");
        record.put("last_name", "Thomas");
        if (schema.getField("email") != null) {
            record.put("email", "sally.thomas@acme.com");
        }
        record.put("__op", op);
        record.put("__source_ts_ms", 1_700_000_000_000L);
        record.put("__lsn", 33_842_864L);
        return record;
    }

    private static RawEvent event(byte[] payload) {
        return RawEvent.builder().value(payload).topic("dbserver1.inventory.customers")
                .partition(0).offset(3).arrivalTimestamp(100).build();
    }

    @Test
    void decodedChangeProjectsIntoACustomerRow() throws IOException {
        // given
        byte[] payload = frame(FULL_SCHEMA_ID, change(FULL, 1001, "u"));

        // when
        DecodedRecord decoded = decoder.decode(event(payload));
        Row row = CustomerTable.BINDING.getProjector().project(decoded);

        // then
        assertThat(decoded.getFields()).containsOnlyKeys(CustomerTable.TABLE.columnNames());
        assertThat(row.getValues()).containsExactly(
                Map.entry("id", 1001L),
                Map.entry("first_name", "Sally"),
                Map.entry("last_name", "Thomas"),
                Map.entry("email", "sally.thomas@acme.com"),
                Map.entry("__op", "update"),
                Map.entry("__source_ts_ms", 1_700_000_000_000L),
                Map.entry("__lsn", 33_842_864L));
    }

    @Test
    void eventWithoutEmailYieldsNoRecord() throws IOException {
        byte[] payload = frame(NO_EMAIL_SCHEMA_ID, change(NO_EMAIL, 1002, "c"));

        assertThatThrownBy(() -> decoder.decode(event(payload)))
                .isInstanceOf(DecodeContractViolation.class)
                .satisfies(e -> assertThat(((DecodeContractViolation) e).getField()).isEqualTo("email"));
    }

    @Test
    void eventWithoutOperationYieldsNoRecord() throws IOException {
        byte[] payload = frame(FULL_SCHEMA_ID, change(FULL, 1003, null));

        assertThatThrownBy(() -> decoder.decode(event(payload)))
                .isInstanceOf(DecodeContractViolation.class)
                .satisfies(e -> assertThat(((DecodeContractViolation) e).getField()).isEqualTo("__op"));
    }
}
