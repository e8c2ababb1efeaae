package com.cdcbridge.decode;

/**
 * Java-side type a decoded field must carry.
 */
public enum FieldType {

    INT32,
    INT64,
    STRING;

    /**
     * Converts an Avro runtime value into this type, or returns {@code null} when the value
     * does not have this type. Avro strings arrive as {@code Utf8}, hence the CharSequence case.
     */
    Object coerce(Object avroValue) {
        switch (this) {
            case INT32:
                return avroValue instanceof Integer ? avroValue : null;
            case INT64:
                return avroValue instanceof Long ? avroValue : null;
            case STRING:
                return avroValue instanceof CharSequence ? avroValue.toString() : null;
            default:
                throw new IllegalStateException("Unhandled field type " + this);
        }
    }
}
