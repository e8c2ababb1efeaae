package com.cdcbridge.sink;

import java.io.Serializable;

/**
 * Builds a {@link WarehouseClient} on the task manager, where the sink writer runs.
 */
@FunctionalInterface
public interface WarehouseClientFactory extends Serializable {

    WarehouseClient create();
}
