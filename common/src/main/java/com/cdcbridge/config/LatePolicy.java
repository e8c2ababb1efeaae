package com.cdcbridge.config;

/**
 * What happens to a record whose window has already fired.
 */
public enum LatePolicy {

    /** Discard the record. Counted by Flink's {@code numLateRecordsDropped} metric. */
    DROP,

    /** Emit the record to the sink on its own, in a batch flagged as late. */
    LATE_OUTPUT
}
