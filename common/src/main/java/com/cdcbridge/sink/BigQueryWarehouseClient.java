package com.cdcbridge.sink;

import com.cdcbridge.error.SinkWriteException;
import com.cdcbridge.error.TransientIOException;
import com.cdcbridge.model.Row;
import com.cdcbridge.projection.TableColumn;
import com.cdcbridge.projection.TableDefinition;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link WarehouseClient} backed by BigQuery streaming inserts.
 */
@Slf4j
public class BigQueryWarehouseClient implements WarehouseClient {

    private static final int ALREADY_EXISTS = 409;
    private static final Set<String> RETRYABLE_REASONS =
            Set.of("backendError", "internalError", "rateLimitExceeded", "timeout");
    /** Reported for rows aborted only because another row of the same request failed. */
    private static final String STOPPED = "stopped";

    private final BigQuery bigQuery;

    public BigQueryWarehouseClient(BigQuery bigQuery) {
        this.bigQuery = bigQuery;
    }

    /**
     * Factory using application default credentials for the given billing project.
     */
    public static WarehouseClientFactory factory(String projectId) {
        return () -> new BigQueryWarehouseClient(
                BigQueryOptions.newBuilder().setProjectId(projectId).build().getService());
    }

    @Override
    public boolean tableExists(WarehouseTableRef table) {
        try {
            return bigQuery.getTable(tableId(table)) != null;
        } catch (BigQueryException e) {
            throw translate("Lookup of table " + table, e);
        }
    }

    @Override
    public void createTable(WarehouseTableRef table, TableDefinition definition)
            throws TableAlreadyExistsException {
        List<Field> fields = new ArrayList<>();
        for (TableColumn column : definition.getColumns()) {
            fields.add(Field.of(column.getName(), toSqlType(column)));
        }
        try {
            bigQuery.create(TableInfo.of(tableId(table), StandardTableDefinition.of(Schema.of(fields))));
        } catch (BigQueryException e) {
            if (e.getCode() == ALREADY_EXISTS) {
                throw new TableAlreadyExistsException(table);
            }
            throw translate("Creation of table " + table, e);
        }
    }

    @Override
    public void appendRows(WarehouseTableRef table, List<Row> rows) {
        InsertAllRequest.Builder request = InsertAllRequest.newBuilder(tableId(table));
        for (Row row : rows) {
            request.addRow(row.getValues());
        }
        InsertAllResponse response;
        try {
            response = bigQuery.insertAll(request.build());
        } catch (BigQueryException e) {
            throw translate("Append of " + rows.size() + " rows to " + table, e);
        }
        if (response.hasErrors()) {
            String message = "Append to " + table + " rejected " + response.getInsertErrors().size()
                    + " of " + rows.size() + " rows: " + response.getInsertErrors();
            log.warn(message);
            if (isRetryable(response.getInsertErrors())) {
                throw new TransientIOException(message);
            }
            throw new SinkWriteException(message);
        }
    }

    /**
     * A rejected insert is retryable when every row error that caused it is transient.
     */
    static boolean isRetryable(Map<Long, List<BigQueryError>> insertErrors) {
        for (List<BigQueryError> errors : insertErrors.values()) {
            for (BigQueryError error : errors) {
                if (!STOPPED.equals(error.getReason()) && !RETRYABLE_REASONS.contains(error.getReason())) {
                    return false;
                }
            }
        }
        return true;
    }

    private static TableId tableId(WarehouseTableRef table) {
        return TableId.of(table.getProjectId(), table.getDatasetId(), table.getTableId());
    }

    private static StandardSQLTypeName toSqlType(TableColumn column) {
        switch (column.getType()) {
            case INT64:
                return StandardSQLTypeName.INT64;
            case STRING:
                return StandardSQLTypeName.STRING;
            default:
                throw new IllegalArgumentException("Unsupported column type " + column.getType());
        }
    }

    private static RuntimeException translate(String operation, BigQueryException e) {
        if (e.isRetryable() || e.getCode() == 429 || e.getCode() >= 500) {
            return new TransientIOException(operation + " failed: " + e.getMessage(), e);
        }
        return new SinkWriteException(operation + " failed: " + e.getMessage(), e);
    }
}
