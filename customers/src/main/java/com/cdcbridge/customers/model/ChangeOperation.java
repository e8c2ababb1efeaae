package com.cdcbridge.customers.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kind of change carried in {@code __op}. The connector emits single-letter codes;
 * the warehouse column stores the full lowercase name.
 */
public enum ChangeOperation {

    CREATE("c"),
    UPDATE("u"),
    DELETE("d"),
    READ("r");

    private final String code;

    ChangeOperation(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public String columnValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts either the connector code ({@code "c"}) or the column value ({@code "create"}).
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ChangeOperation parse(String value) {
        for (ChangeOperation op : values()) {
            if (op.code.equals(value) || op.columnValue().equals(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown change operation '" + value + "'");
    }

    /** Every spelling {@link #parse} accepts. */
    public static Set<String> acceptedValues() {
        return Arrays.stream(values())
                .flatMap(op -> Arrays.stream(new String[]{op.code, op.columnValue()}))
                .collect(Collectors.toUnmodifiableSet());
    }
}
