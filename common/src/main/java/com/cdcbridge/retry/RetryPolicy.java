package com.cdcbridge.retry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Bounded exponential backoff for a single I/O operation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Total attempts including the first one. */
    private int maxAttempts = 5;
    private long initialBackoffMs = 500;
    private long maxBackoffMs = 30_000;
    private double multiplier = 2.0;

    /**
     * Delay before attempt {@code attempt + 1}, where {@code attempt} starts at 1.
     */
    public long backoffAfter(int attempt) {
        double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }
}
