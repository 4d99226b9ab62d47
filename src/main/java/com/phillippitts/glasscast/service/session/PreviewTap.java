package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.service.video.ColorConverter;
import com.phillippitts.glasscast.service.video.JpegPreviewEncoder;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Turns I420 frames into JPEG previews, at most {@code maxFps} per second.
 */
final class PreviewTap {

    private final JpegPreviewEncoder encoder;
    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private long lastEmitNanos;
    private boolean emitted;

    PreviewTap(JpegPreviewEncoder encoder, int maxFps) {
        this(encoder, maxFps, System::nanoTime);
    }

    PreviewTap(JpegPreviewEncoder encoder, int maxFps, LongSupplier nanoClock) {
        if (maxFps <= 0) {
            throw new IllegalArgumentException("maxFps must be positive: " + maxFps);
        }
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.minIntervalNanos = 1_000_000_000L / maxFps;
        this.nanoClock = nanoClock;
    }

    /**
     * @return JPEG bytes, or {@code null} if the frame falls inside the throttle window
     * @throws com.phillippitts.glasscast.exception.EncodeException if JPEG encoding fails
     */
    synchronized byte[] offer(RawVideoFrame frame) {
        long now = nanoClock.getAsLong();
        if (emitted && now - lastEmitNanos < minIntervalNanos) {
            return null;
        }
        emitted = true;
        lastEmitNanos = now;
        byte[] nv21 = ColorConverter.i420ToNv21(frame);
        return encoder.encode(nv21, frame.width(), frame.height());
    }

    synchronized void reset() {
        emitted = false;
    }
}
