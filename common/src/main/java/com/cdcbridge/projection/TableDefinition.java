package com.cdcbridge.projection;

import com.cdcbridge.model.Row;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered column list of a target table. Used both to create the warehouse table and to
 * check that projected rows match it exactly.
 */
public class TableDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<TableColumn> columns;

    public TableDefinition(List<TableColumn> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("A table needs at least one column");
        }
        this.columns = List.copyOf(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TableColumn> getColumns() {
        return columns;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (TableColumn column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    /**
     * Fails when the row's columns differ from this definition in name, order or type.
     *
     * @throws IllegalStateException describing the first mismatch
     */
    public void checkConforms(Row row) {
        List<String> actual = row.columnNames();
        if (!actual.equals(columnNames())) {
            throw new IllegalStateException("Row columns " + actual + " do not match table columns " + columnNames());
        }
        for (TableColumn column : columns) {
            Object value = row.get(column.getName());
            if (!column.getType().getJavaType().isInstance(value)) {
                throw new IllegalStateException("Column '" + column.getName() + "' expects " + column.getType()
                        + " but row holds " + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
    }

    @Override
    public String toString() {
        return "TableDefinition" + columns;
    }

    public static final class Builder {

        private final List<TableColumn> columns = new ArrayList<>();

        public Builder column(String name, ColumnType type) {
            columns.add(new TableColumn(name, type));
            return this;
        }

        public TableDefinition build() {
            return new TableDefinition(columns);
        }
    }
}
