package com.cdcbridge.config;

import com.cdcbridge.sink.WarehouseTableRef;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Target warehouse table and write retry settings.
 */
@Data
@NoArgsConstructor
public class WarehouseConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String projectId;
    private String datasetId;
    private String tableId;

    /** Attempts per batch append (and per table creation) before the job fails. */
    private int maxAttempts = 5;
    private long retryBackoffMs = 1_000;
    private long maxRetryBackoffMs = 60_000;

    public WarehouseTableRef toTableRef() {
        return new WarehouseTableRef(projectId, datasetId, tableId);
    }
}
