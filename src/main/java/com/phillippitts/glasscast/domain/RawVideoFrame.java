package com.phillippitts.glasscast.domain;

import java.util.Objects;

/**
 * One planar YUV (I420) camera frame as delivered by a frame source.
 *
 * <p>The backing buffer belongs to the source for the duration of one callback only. Consumers
 * must copy or fully consume it before returning.
 *
 * @param width frame width in pixels
 * @param height frame height in pixels
 * @param buffer I420 bytes: Y plane, then U, then V ({@code width*height*3/2} bytes)
 * @param captureTimestampNanos monotonic capture time in nanoseconds
 */
public record RawVideoFrame(int width, int height, byte[] buffer, long captureTimestampNanos) {

    public RawVideoFrame {
        Objects.requireNonNull(buffer, "buffer must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("frame dimensions must be positive: " + width + "x" + height);
        }
    }

    /** Byte length of an I420 frame with the given dimensions. */
    public static int i420Size(int width, int height) {
        return width * height * 3 / 2;
    }

    /** Returns a frame whose buffer is a private copy, safe to retain past the callback. */
    public RawVideoFrame copy() {
        return new RawVideoFrame(width, height, buffer.clone(), captureTimestampNanos);
    }
}
