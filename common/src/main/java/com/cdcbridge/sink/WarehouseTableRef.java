package com.cdcbridge.sink;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WarehouseTableRef implements Serializable {

    private static final long serialVersionUID = 1L;

    private String projectId;
    private String datasetId;
    private String tableId;

    @Override
    public String toString() {
        return projectId + "." + datasetId + "." + tableId;
    }
}
