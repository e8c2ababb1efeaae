package com.cdcbridge.sink;

import com.cdcbridge.model.Row;
import com.cdcbridge.projection.ColumnType;
import com.cdcbridge.projection.TableColumn;
import com.cdcbridge.projection.TableDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Pretty-printed JSON text form of rows: one indented object per row, objects separated by
 * a newline, column order preserved.
 */
public final class PrettyRowFormat {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private PrettyRowFormat() {
        // utility class
    }

    public static String format(List<Row> rows) {
        StringBuilder text = new StringBuilder();
        for (Row row : rows) {
            try {
                text.append(MAPPER.writeValueAsString(row.getValues())).append('\n');
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot render row " + row, e);
            }
        }
        return text.toString();
    }

    /**
     * Reads rows back, restoring column types from the table definition
     * (JSON alone cannot tell a small INT64 from an int).
     */
    public static List<Row> parse(String text, TableDefinition definition) throws IOException {
        List<Row> rows = new ArrayList<>();
        try (MappingIterator<LinkedHashMap<String, Object>> it = MAPPER.readerFor(ROW_TYPE).readValues(text)) {
            while (it.hasNext()) {
                LinkedHashMap<String, Object> parsed = it.next();
                Row row = new Row();
                for (TableColumn column : definition.getColumns()) {
                    Object value = parsed.get(column.getName());
                    if (column.getType() == ColumnType.INT64 && value instanceof Number) {
                        value = ((Number) value).longValue();
                    }
                    row.set(column.getName(), value);
                }
                rows.add(row);
            }
        }
        return rows;
    }
}
