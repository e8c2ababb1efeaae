package com.cdcbridge.window;

import com.cdcbridge.config.DrainPolicy;
import org.apache.flink.streaming.api.watermark.Watermark;
import org.apache.flink.streaming.api.windowing.triggers.Trigger;
import org.apache.flink.streaming.api.windowing.triggers.TriggerResult;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;

import java.time.Duration;

/**
 * Fires a window exactly once, when the watermark passes its end plus the allowed
 * lateness, and purges its contents in the same step.
 *
 * <p>Lifecycle of a window under this trigger: OPEN while records accumulate, CLOSED and
 * FLUSHED in the single {@code FIRE_AND_PURGE} at the deadline, then DISCARDED when the
 * window operator cleans up at the same timestamp. Records for it arriving afterwards are
 * late and never reopen it.</p>
 *
 * <p>The final {@link Watermark#MAX_WATERMARK} (end of input, or stop with drain) reaches
 * every open window at once; the {@link DrainPolicy} decides whether those windows are
 * flushed or dropped.</p>
 */
public class LatenessDeadlineTrigger extends Trigger<Object, TimeWindow> {

    private static final long serialVersionUID = 1L;

    private final long allowedLatenessMs;
    private final DrainPolicy drainPolicy;

    public LatenessDeadlineTrigger(Duration allowedLateness, DrainPolicy drainPolicy) {
        this.allowedLatenessMs = allowedLateness.toMillis();
        this.drainPolicy = drainPolicy;
    }

    long deadline(TimeWindow window) {
        long deadline = window.maxTimestamp() + allowedLatenessMs;
        // overflow
        return deadline >= window.maxTimestamp() ? deadline : Long.MAX_VALUE;
    }

    @Override
    public TriggerResult onElement(Object element, long timestamp, TimeWindow window, TriggerContext ctx) {
        ctx.registerEventTimeTimer(deadline(window));
        return TriggerResult.CONTINUE;
    }

    @Override
    public TriggerResult onEventTime(long time, TimeWindow window, TriggerContext ctx) {
        if (time != deadline(window)) {
            return TriggerResult.CONTINUE;
        }
        if (drainPolicy == DrainPolicy.DISCARD
                && ctx.getCurrentWatermark() == Watermark.MAX_WATERMARK.getTimestamp()) {
            return TriggerResult.PURGE;
        }
        return TriggerResult.FIRE_AND_PURGE;
    }

    @Override
    public TriggerResult onProcessingTime(long time, TimeWindow window, TriggerContext ctx) {
        return TriggerResult.CONTINUE;
    }

    @Override
    public void clear(TimeWindow window, TriggerContext ctx) {
        ctx.deleteEventTimeTimer(deadline(window));
    }

    @Override
    public String toString() {
        return "LatenessDeadlineTrigger(" + allowedLatenessMs + "ms, " + drainPolicy + ")";
    }
}
