package com.phillippitts.glasscast.domain;

import java.util.Objects;

/**
 * Raw PCM audio as delivered by a frame source: signed 16-bit little-endian, interleaved.
 *
 * @param pcm sample bytes
 * @param sampleRate samples per second per channel
 * @param channelCount number of interleaved channels
 */
public record AudioChunk(byte[] pcm, int sampleRate, int channelCount) {

    public AudioChunk {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        if (channelCount <= 0) {
            throw new IllegalArgumentException("channelCount must be positive: " + channelCount);
        }
    }

    /** Number of sample frames (one sample per channel) in this chunk. */
    public int frameCount() {
        return pcm.length / (2 * channelCount);
    }
}
