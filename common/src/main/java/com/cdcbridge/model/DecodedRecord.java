package com.cdcbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;

/**
 * A change event decoded against its writer schema and checked against the record contract.
 *
 * <p>{@code fields} holds exactly the contract's fields, in contract order, with Java
 * values of the declared types ({@link Integer}, {@link Long}, {@link String}).</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecodedRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private int schemaId;
    private int partition;
    private long offset;
    private long arrivalTimestamp;
    private LinkedHashMap<String, Object> fields;

    public Object get(String field) {
        return fields == null ? null : fields.get(field);
    }
}
