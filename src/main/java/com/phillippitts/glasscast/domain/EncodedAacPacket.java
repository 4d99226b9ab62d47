package com.phillippitts.glasscast.domain;

import java.util.Objects;

/**
 * One raw AAC access unit produced by the encoder, without any transport framing.
 *
 * @param payload AAC elementary-stream bytes
 * @param sampleRate output sample rate
 * @param channelCount output channel count
 * @param sequenceIndex zero-based index within the encoder session
 */
public record EncodedAacPacket(byte[] payload, int sampleRate, int channelCount, long sequenceIndex) {

    public EncodedAacPacket {
        Objects.requireNonNull(payload, "payload must not be null");
    }
}
