package com.cdcbridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * A flat output row. Column order is the insertion order of {@code values} and always
 * matches the target {@link com.cdcbridge.projection.TableDefinition}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Row implements Serializable {

    private static final long serialVersionUID = 1L;

    private LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    public Row set(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public List<String> columnNames() {
        return new ArrayList<>(values.keySet());
    }
}
