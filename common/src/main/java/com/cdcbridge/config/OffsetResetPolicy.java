package com.cdcbridge.config;

import org.apache.kafka.clients.consumer.OffsetResetStrategy;

/**
 * Where to start reading a partition that has no committed offset for the consumer group.
 */
public enum OffsetResetPolicy {

    /** Start from the oldest retained record. */
    EARLIEST,

    /** Start from records produced after the job starts. */
    LATEST;

    public OffsetResetStrategy toKafkaStrategy() {
        return this == EARLIEST ? OffsetResetStrategy.EARLIEST : OffsetResetStrategy.LATEST;
    }
}
