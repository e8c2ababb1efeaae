package com.cdcbridge.projection;

/**
 * Warehouse column types used by the target tables.
 */
public enum ColumnType {

    INT64(Long.class),
    STRING(String.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }
}
