package com.phillippitts.glasscast.service.video;

import com.phillippitts.glasscast.domain.RawVideoFrame;

import java.util.Objects;

/**
 * Converts planar I420 (Y, U, V planes) into semi-planar NV21 (Y plane, then interleaved V/U).
 *
 * <p>Stateless and thread-safe. A buffer whose length is not {@code width*height*3/2} is a caller
 * bug and fails with {@link IllegalArgumentException}.
 */
public final class ColorConverter {

    private ColorConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a newly allocated NV21 copy of the given I420 buffer.
     *
     * @param i420 Y plane followed by the U and V planes
     * @param width frame width in pixels
     * @param height frame height in pixels
     * @return NV21 bytes of the same total length
     */
    public static byte[] i420ToNv21(byte[] i420, int width, int height) {
        Objects.requireNonNull(i420, "i420 must not be null");
        int expected = RawVideoFrame.i420Size(width, height);
        if (width <= 0 || height <= 0 || i420.length != expected) {
            throw new IllegalArgumentException("I420 buffer of " + i420.length + " bytes does not match "
                    + width + "x" + height + " (expected " + expected + ")");
        }

        int lumaSize = width * height;
        int chromaSize = lumaSize / 4;
        byte[] nv21 = new byte[i420.length];

        System.arraycopy(i420, 0, nv21, 0, lumaSize);
        for (int n = 0; n < chromaSize; n++) {
            nv21[lumaSize + 2 * n] = i420[lumaSize + chromaSize + n];
            nv21[lumaSize + 2 * n + 1] = i420[lumaSize + n];
        }
        return nv21;
    }

    /** Convenience overload for a captured frame. */
    public static byte[] i420ToNv21(RawVideoFrame frame) {
        return i420ToNv21(frame.buffer(), frame.width(), frame.height());
    }
}
