package com.cdcbridge.decode;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Set;

/**
 * A required field of the record contract.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private FieldType type;
    /** Accepted values; empty means any value of the right type. */
    private Set<String> allowedValues = Set.of();

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, Set.of());
    }

    public static FieldSpec oneOf(String name, Set<String> allowedValues) {
        return new FieldSpec(name, FieldType.STRING, Set.copyOf(allowedValues));
    }
}
