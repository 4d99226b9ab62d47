package com.phillippitts.glasscast.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void elapsedMillisTruncatesPartialMilliseconds() {
        long start = System.nanoTime() - 2 * TimeUtils.NANOS_PER_MILLI - 500_000L;

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(2L).isLessThan(1_000L);
    }

    @Test
    void elapsedMillisIsNonNegative() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(9L);
    }

    @Test
    void frameDurationFollowsFrameRate() {
        assertThat(TimeUtils.frameDurationMicros(24)).isEqualTo(41_666L);
        assertThat(TimeUtils.frameDurationMicros(30)).isEqualTo(33_333L);
        assertThat(TimeUtils.frameDurationMicros(1)).isEqualTo(1_000_000L);
    }

    @Test
    void frameDurationRejectsNonPositiveRate() {
        assertThatThrownBy(() -> TimeUtils.frameDurationMicros(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
