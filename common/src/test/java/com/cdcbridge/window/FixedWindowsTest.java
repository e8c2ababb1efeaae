package com.cdcbridge.window;

import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedWindowsTest {

    private final FixedWindows windows = FixedWindows.ofSeconds(2);

    @Test
    void timestampOnBoundaryOpensTheNextWindow() {
        assertThat(windows.windowFor(1_999)).isEqualTo(new TimeWindow(0, 2_000));
        assertThat(windows.windowFor(2_000)).isEqualTo(new TimeWindow(2_000, 4_000));
        assertThat(windows.windowFor(4_000)).isEqualTo(new TimeWindow(4_000, 6_000));
    }

    @Test
    void timestampsWithSameFloorShareAWindow() {
        assertThat(windows.windowFor(100)).isEqualTo(windows.windowFor(1_900));
        assertThat(windows.windowFor(1_900)).isNotEqualTo(windows.windowFor(2_100));
    }

    @Test
    void windowsAreContiguousAndDoNotOverlap() {
        TimeWindow first = windows.windowFor(0);
        TimeWindow second = windows.windowFor(first.getEnd());

        assertThat(second.getStart()).isEqualTo(first.getEnd());
        assertThat(first.intersects(new TimeWindow(second.getStart(), second.getEnd() - 1))).isFalse();
    }

    @ParameterizedTest
    @ValueSource(longs = {0, 1, 1_999, 2_000, 2_001, 1_700_000_000_123L, -1, -2_000, -2_001})
    void agreesWithFlinkTumblingArithmetic(long timestamp) {
        assertThat(windows.windowStart(timestamp))
                .isEqualTo(TimeWindow.getWindowStartWithOffset(timestamp, 0, windows.getSizeMs()));
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new FixedWindows(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FixedWindows.ofSeconds(-2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
