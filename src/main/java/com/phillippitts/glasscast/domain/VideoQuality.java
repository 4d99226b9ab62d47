package com.phillippitts.glasscast.domain;

/**
 * Capture resolution requested from the frame source.
 */
public enum VideoQuality {
    LOW(360, 640),
    MEDIUM(504, 896),
    HIGH(720, 1280);

    private final int width;
    private final int height;

    VideoQuality(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
