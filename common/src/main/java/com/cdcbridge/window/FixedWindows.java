package com.cdcbridge.window;

import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;

import java.io.Serializable;
import java.time.Duration;

/**
 * Fixed, non-overlapping windows of length {@code W} over arrival time.
 *
 * <p>A timestamp {@code t} belongs to {@code [floor(t/W)*W, floor(t/W)*W + W)}, so a
 * timestamp that is an exact multiple of {@code W} opens a new window rather than closing
 * the previous one. Flink's tumbling assigner with a zero offset uses the same rule; this
 * class is the single place that picks the size and exposes the arithmetic to code outside
 * the window operator.</p>
 */
public class FixedWindows implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long sizeMs;

    public FixedWindows(Duration size) {
        if (size.isZero() || size.isNegative()) {
            throw new IllegalArgumentException("Window size must be positive: " + size);
        }
        this.sizeMs = size.toMillis();
    }

    public static FixedWindows ofSeconds(long seconds) {
        return new FixedWindows(Duration.ofSeconds(seconds));
    }

    public long getSizeMs() {
        return sizeMs;
    }

    public long windowStart(long timestamp) {
        return Math.floorDiv(timestamp, sizeMs) * sizeMs;
    }

    public TimeWindow windowFor(long timestamp) {
        long start = windowStart(timestamp);
        return new TimeWindow(start, start + sizeMs);
    }

    public TumblingEventTimeWindows assigner() {
        return TumblingEventTimeWindows.of(Duration.ofMillis(sizeMs));
    }
}
