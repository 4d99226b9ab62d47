package com.phillippitts.glasscast.domain;

import java.time.Duration;

/**
 * Snapshot of transport counters, recomputed once per interval.
 *
 * @param framesSent video frames or audio chunks handed to the transport
 * @param bytesSent bytes handed to the transport
 * @param fps units sent per second over the last interval
 * @param connectionTime time since the transport connected
 */
public record StreamingStats(long framesSent, long bytesSent, double fps, Duration connectionTime) {

    public static final StreamingStats ZERO = new StreamingStats(0, 0, 0.0, Duration.ZERO);
}
