package com.cdcbridge.customers.model;

import com.cdcbridge.customers.projection.CustomerRowProjector;
import com.cdcbridge.decode.FieldSpec;
import com.cdcbridge.decode.FieldType;
import com.cdcbridge.decode.RecordContract;
import com.cdcbridge.projection.ColumnType;
import com.cdcbridge.projection.TableBinding;
import com.cdcbridge.projection.TableDefinition;

import java.util.List;

/**
 * Contract and target table for change events of {@code inventory.customers}, as emitted
 * by the connector with the new-record-state unwrap (business columns plus {@code __op},
 * {@code __source_ts_ms} and {@code __lsn}).
 */
public final class CustomerTable {

    public static final String ID = "id";
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String EMAIL = "email";
    public static final String OP = "__op";
    public static final String SOURCE_TS_MS = "__source_ts_ms";
    public static final String LSN = "__lsn";

    /** What a decoded change event must contain. */
    public static final RecordContract CONTRACT = new RecordContract("inventory.customers", List.of(
            FieldSpec.required(ID, FieldType.INT32),
            FieldSpec.required(FIRST_NAME, FieldType.STRING),
            FieldSpec.required(LAST_NAME, FieldType.STRING),
            FieldSpec.required(EMAIL, FieldType.STRING),
            FieldSpec.oneOf(OP, ChangeOperation.acceptedValues()),
            FieldSpec.required(SOURCE_TS_MS, FieldType.INT64),
            FieldSpec.required(LSN, FieldType.INT64)));

    /** Warehouse table layout. */
    public static final TableDefinition TABLE = TableDefinition.builder()
            .column(ID, ColumnType.INT64)
            .column(FIRST_NAME, ColumnType.STRING)
            .column(LAST_NAME, ColumnType.STRING)
            .column(EMAIL, ColumnType.STRING)
            .column(OP, ColumnType.STRING)
            .column(SOURCE_TS_MS, ColumnType.INT64)
            .column(LSN, ColumnType.INT64)
            .build();

    public static final TableBinding BINDING = new TableBinding(CONTRACT, new CustomerRowProjector(), TABLE);

    private CustomerTable() {
    }
}
