package com.phillippitts.glasscast.service.transport;

import com.phillippitts.glasscast.domain.StreamingStats;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingStatsTrackerTest {

    private static final long SECOND = 1_000_000_000L;

    private final AtomicLong clock = new AtomicLong(10 * SECOND);
    private final StreamingStatsTracker tracker = new StreamingStatsTracker(clock::get);

    @Test
    void startsAtZero() {
        assertThat(tracker.snapshot()).isEqualTo(StreamingStats.ZERO);
        assertThat(tracker.recompute().connectionTime()).isEqualTo(Duration.ZERO);
    }

    @Test
    void computesRatePerInterval() {
        tracker.markConnected();
        for (int i = 0; i < 24; i++) {
            tracker.record(1_000);
        }
        clock.addAndGet(SECOND);

        StreamingStats first = tracker.recompute();

        assertThat(first.framesSent()).isEqualTo(24);
        assertThat(first.bytesSent()).isEqualTo(24_000);
        assertThat(first.fps()).isEqualTo(24.0);
        assertThat(first.connectionTime()).isEqualTo(Duration.ofSeconds(1));

        for (int i = 0; i < 12; i++) {
            tracker.record(500);
        }
        clock.addAndGet(2 * SECOND);

        StreamingStats second = tracker.recompute();

        assertThat(second.framesSent()).isEqualTo(36);
        assertThat(second.fps()).isEqualTo(6.0);
        assertThat(second.connectionTime()).isEqualTo(Duration.ofSeconds(3));
        assertThat(tracker.snapshot()).isEqualTo(second);
    }

    @Test
    void resetClearsEverything() {
        tracker.markConnected();
        tracker.record(100);
        clock.addAndGet(SECOND);
        tracker.recompute();

        tracker.reset();

        assertThat(tracker.snapshot()).isEqualTo(StreamingStats.ZERO);
        assertThat(tracker.recompute()).isEqualTo(StreamingStats.ZERO);
    }
}
