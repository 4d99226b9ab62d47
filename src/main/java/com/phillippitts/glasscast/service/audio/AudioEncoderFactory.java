package com.phillippitts.glasscast.service.audio;

/**
 * Creates a fresh {@link AudioEncoder} for each streaming session, so resampler state is never
 * shared between sessions.
 */
@FunctionalInterface
public interface AudioEncoderFactory {

    AudioEncoder create();
}
