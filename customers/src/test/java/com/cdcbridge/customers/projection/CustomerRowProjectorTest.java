package com.cdcbridge.customers.projection;

import com.cdcbridge.customers.model.CustomerTable;
import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.Row;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomerRowProjectorTest {

    private final CustomerRowProjector projector = new CustomerRowProjector();

    private static DecodedRecord customer(Object id, String op) {
        LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("first_name", "Sally");
        fields.put("last_name", "Thomas");
        fields.put("email", "sally.thomas@acme.com");
        fields.put("__op", op);
        fields.put("__source_ts_ms", 1_700_000_000_000L);
        fields.put("__lsn", 33_842_864L);
        return DecodedRecord.builder().schemaId(1).partition(0).offset(5).arrivalTimestamp(0).fields(fields).build();
    }

    @Test
    void projectsEveryColumnInTableOrder() {
        // when
        Row row = projector.project(customer(1001, "c"));

        // then
        assertThat(row.columnNames()).isEqualTo(CustomerTable.TABLE.columnNames());
        assertThat(row.get("id")).isEqualTo(1001L);
        assertThat(row.get("first_name")).isEqualTo("Sally");
        assertThat(row.get("last_name")).isEqualTo("Thomas");
        assertThat(row.get("email")).isEqualTo("sally.thomas@acme.com");
        assertThat(row.get("__op")).isEqualTo("create");
        assertThat(row.get("__source_ts_ms")).isEqualTo(1_700_000_000_000L);
        assertThat(row.get("__lsn")).isEqualTo(33_842_864L);
        CustomerTable.TABLE.checkConforms(row);
    }

    @Test
    void acceptsAlreadySpelledOutOperation() {
        assertThat(projector.project(customer(1, "delete")).get("__op")).isEqualTo("delete");
    }

    @Test
    void mistypedFieldIsAnInvariantViolation() {
        assertThatThrownBy(() -> projector.project(customer("1001", "c")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("id=String");
    }

    @Test
    void unknownOperationIsAnInvariantViolation() {
        assertThatThrownBy(() -> projector.project(customer(1, "z")))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
