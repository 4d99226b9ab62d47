package com.phillippitts.glasscast.util;

/**
 * Clock arithmetic shared by the transports and the session loop.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    public static final long MICROS_PER_SECOND = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * @param startNanos value previously read from {@link System#nanoTime()}
     * @return whole milliseconds elapsed since {@code startNanos}
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Duration of one video frame, truncated to whole microseconds.
     *
     * @throws IllegalArgumentException if {@code frameRate} is not positive
     */
    public static long frameDurationMicros(int frameRate) {
        if (frameRate <= 0) {
            throw new IllegalArgumentException("frameRate must be positive: " + frameRate);
        }
        return MICROS_PER_SECOND / frameRate;
    }
}
