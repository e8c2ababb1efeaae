package com.cdcbridge.decode;

import com.cdcbridge.error.DecodeContractViolation;
import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.RawEvent;
import com.cdcbridge.registry.CachingSchemaResolver;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DecoderFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Decodes schema-registry framed Avro payloads.
 *
 * <p>Frame layout: one magic byte {@code 0x0}, the writer schema id as a 4-byte big-endian
 * int, then the Avro binary body. The whole body must be consumed; leftover bytes mean the
 * payload does not match its declared schema.</p>
 */
public class RegistryAvroDecoder implements Closeable {

    static final byte MAGIC_BYTE = 0x0;
    static final int HEADER_SIZE = 5;

    private final CachingSchemaResolver resolver;
    private final RecordContract contract;
    private final DecoderFactory decoderFactory = DecoderFactory.get();

    public RegistryAvroDecoder(CachingSchemaResolver resolver, RecordContract contract) {
        this.resolver = resolver;
        this.contract = contract;
    }

    public DecodedRecord decode(RawEvent event) {
        byte[] payload = event.getValue();
        int schemaId = schemaIdOf(payload);
        Schema writerSchema = resolver.resolve(schemaId);

        GenericRecord record;
        try {
            BinaryDecoder decoder = decoderFactory.binaryDecoder(
                    payload, HEADER_SIZE, payload.length - HEADER_SIZE, null);
            record = new GenericDatumReader<GenericRecord>(writerSchema).read(null, decoder);
            if (!decoder.isEnd()) {
                throw new DecodeContractViolation("Payload at partition=" + event.getPartition()
                        + " offset=" + event.getOffset() + " has trailing bytes after the record");
            }
        } catch (IOException | AvroRuntimeException | IndexOutOfBoundsException e) {
            throw new DecodeContractViolation("Malformed Avro body at partition=" + event.getPartition()
                    + " offset=" + event.getOffset() + " (schema id " + schemaId + ")", e);
        }

        return DecodedRecord.builder()
                .schemaId(schemaId)
                .partition(event.getPartition())
                .offset(event.getOffset())
                .arrivalTimestamp(event.getArrivalTimestamp())
                .fields(contract.extract(record))
                .build();
    }

    static int schemaIdOf(byte[] payload) {
        if (payload == null || payload.length < HEADER_SIZE) {
            throw new DecodeContractViolation("Payload too short for a registry frame: "
                    + (payload == null ? "null" : payload.length + " bytes"));
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        byte magic = buffer.get();
        if (magic != MAGIC_BYTE) {
            throw new DecodeContractViolation("Unknown magic byte: " + magic);
        }
        return buffer.getInt();
    }

    @Override
    public void close() {
        resolver.close();
    }
}
