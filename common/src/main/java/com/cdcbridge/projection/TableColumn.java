package com.cdcbridge.projection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableColumn implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private ColumnType type;
}
