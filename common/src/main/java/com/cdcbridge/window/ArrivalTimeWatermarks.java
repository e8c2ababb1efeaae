package com.cdcbridge.window;

import com.cdcbridge.model.RawEvent;
import org.apache.flink.api.common.eventtime.SerializableTimestampAssigner;
import org.apache.flink.api.common.eventtime.Watermark;
import org.apache.flink.api.common.eventtime.WatermarkGenerator;
import org.apache.flink.api.common.eventtime.WatermarkOutput;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;

import java.util.function.LongSupplier;

/**
 * Watermarks over the arrival timestamps stamped by the source.
 *
 * <p>Arrival time is processing time, so the watermark follows the wall clock instead of
 * waiting for the next record. A partition that goes quiet still has its open windows fired
 * once their lateness deadline passes.</p>
 */
public final class ArrivalTimeWatermarks {

    private ArrivalTimeWatermarks() {
        // utility class
    }

    public static WatermarkStrategy<RawEvent> forRawEvents() {
        return onArrivalTime((event, recordTimestamp) -> event.getArrivalTimestamp());
    }

    public static <T> WatermarkStrategy<T> onArrivalTime(SerializableTimestampAssigner<T> arrivalTime) {
        return WatermarkStrategy.<T>forGenerator(context -> new ClockGenerator<T>(System::currentTimeMillis))
                .withTimestampAssigner(arrivalTime);
    }

    /**
     * Emits {@code clock - 1} on every periodic tick, never below the newest arrival seen and
     * never going backwards.
     */
    static final class ClockGenerator<T> implements WatermarkGenerator<T> {

        private final LongSupplier clock;
        private long maxTimestamp = Long.MIN_VALUE;
        private long lastEmitted = Long.MIN_VALUE;

        ClockGenerator(LongSupplier clock) {
            this.clock = clock;
        }

        @Override
        public void onEvent(T event, long eventTimestamp, WatermarkOutput output) {
            maxTimestamp = Math.max(maxTimestamp, eventTimestamp);
        }

        @Override
        public void onPeriodicEmit(WatermarkOutput output) {
            long candidate = clock.getAsLong() - 1;
            if (maxTimestamp != Long.MIN_VALUE) {
                candidate = Math.max(candidate, maxTimestamp - 1);
            }
            if (candidate > lastEmitted) {
                lastEmitted = candidate;
                output.emitWatermark(new Watermark(candidate));
            }
        }
    }
}
