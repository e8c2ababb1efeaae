package com.cdcbridge.decode;

import com.cdcbridge.error.DecodeContractViolation;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * The fields every decoded record must carry. A record missing any of them, or carrying
 * one with the wrong type, is rejected as a whole.
 */
public class RecordContract implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final List<FieldSpec> fields;

    public RecordContract(String name, List<FieldSpec> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Record contract '" + name + "' declares no fields");
        }
        this.name = name;
        this.fields = List.copyOf(fields);
    }

    public String getName() {
        return name;
    }

    public List<FieldSpec> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Extracts the contract fields from a decoded Avro record, in contract order.
     *
     * @throws DecodeContractViolation on the first missing, null, mistyped or disallowed field
     */
    public LinkedHashMap<String, Object> extract(GenericRecord record) {
        Schema schema = record.getSchema();
        LinkedHashMap<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec spec : fields) {
            String field = spec.getName();
            if (schema.getField(field) == null) {
                throw new DecodeContractViolation(field,
                        "Required field '" + field + "' is absent from writer schema " + schema.getFullName(), null);
            }
            Object raw = record.get(field);
            if (raw == null) {
                throw new DecodeContractViolation(field, "Required field '" + field + "' is null", null);
            }
            Object value = spec.getType().coerce(raw);
            if (value == null) {
                throw new DecodeContractViolation(field,
                        "Field '" + field + "' expected " + spec.getType() + " but was "
                                + raw.getClass().getSimpleName(), null);
            }
            if (!spec.getAllowedValues().isEmpty() && !spec.getAllowedValues().contains(value)) {
                throw new DecodeContractViolation(field,
                        "Field '" + field + "' has unexpected value '" + value + "'", null);
            }
            values.put(field, value);
        }
        return values;
    }
}
