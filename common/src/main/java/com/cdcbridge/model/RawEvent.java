package com.cdcbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * A record as read from the log topic, before decoding.
 *
 * <p>{@code arrivalTimestamp} is the processing time at which the source read the record;
 * it drives window assignment. The key bytes are carried for completeness and never
 * consulted by the decoder.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private byte[] key;
    private byte[] value;
    private String topic;
    private int partition;
    private long offset;
    private long arrivalTimestamp;
}
