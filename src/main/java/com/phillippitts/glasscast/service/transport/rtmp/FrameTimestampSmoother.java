package com.phillippitts.glasscast.service.transport.rtmp;

import com.phillippitts.glasscast.util.TimeUtils;

/**
 * Replaces jittery capture timestamps with an even cadence: frame {@code n} is stamped
 * {@code n * (1_000_000 / frameRate)} microseconds after the first frame.
 */
public final class FrameTimestampSmoother {

    private final long frameDurationMicros;
    private long frameIndex;

    public FrameTimestampSmoother(int frameRate) {
        this.frameDurationMicros = TimeUtils.frameDurationMicros(frameRate);
    }

    /** Timestamp for the next published frame. */
    public long next() {
        return frameIndex++ * frameDurationMicros;
    }

    public long framesStamped() {
        return frameIndex;
    }
}
