package com.cdcbridge.customers.projection;

import com.cdcbridge.customers.model.ChangeOperation;
import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.Row;
import com.cdcbridge.projection.RowProjector;

import static com.cdcbridge.customers.model.CustomerTable.EMAIL;
import static com.cdcbridge.customers.model.CustomerTable.FIRST_NAME;
import static com.cdcbridge.customers.model.CustomerTable.ID;
import static com.cdcbridge.customers.model.CustomerTable.LAST_NAME;
import static com.cdcbridge.customers.model.CustomerTable.LSN;
import static com.cdcbridge.customers.model.CustomerTable.OP;
import static com.cdcbridge.customers.model.CustomerTable.SOURCE_TS_MS;

/**
 * Maps a decoded customer change into a warehouse row. {@code id} widens to INT64 and
 * {@code __op} is spelled out ({@code c} becomes {@code create}).
 */
public class CustomerRowProjector implements RowProjector {

    private static final long serialVersionUID = 1L;

    @Override
    public Row project(DecodedRecord record) {
        ChangeOperation op;
        try {
            op = ChangeOperation.parse(field(record, OP, String.class));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Decoded record at offset " + record.getOffset()
                    + " carries an unknown operation", e);
        }
        return new Row()
                .set(ID, field(record, ID, Integer.class).longValue())
                .set(FIRST_NAME, field(record, FIRST_NAME, String.class))
                .set(LAST_NAME, field(record, LAST_NAME, String.class))
                .set(EMAIL, field(record, EMAIL, String.class))
                .set(OP, op.columnValue())
                .set(SOURCE_TS_MS, field(record, SOURCE_TS_MS, Long.class))
                .set(LSN, field(record, LSN, Long.class));
    }

    private static <T> T field(DecodedRecord record, String name, Class<T> type) {
        Object value = record.get(name);
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Decoded record at partition=" + record.getPartition()
                    + " offset=" + record.getOffset() + " has " + name + "="
                    + (value == null ? "null" : value.getClass().getSimpleName())
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
