package com.phillippitts.glasscast.domain;

import java.util.Objects;

/**
 * An AAC packet prefixed with its 7-byte ADTS header.
 *
 * @param bytes header followed by the payload
 * @param sampleRate sample rate encoded in the header
 * @param channelCount channel count encoded in the header
 */
public record AdtsFrame(byte[] bytes, int sampleRate, int channelCount) {

    public static final int HEADER_LENGTH = 7;

    public AdtsFrame {
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (bytes.length < HEADER_LENGTH) {
            throw new IllegalArgumentException("ADTS frame shorter than its header: " + bytes.length);
        }
    }

    public int length() {
        return bytes.length;
    }

    public int payloadLength() {
        return bytes.length - HEADER_LENGTH;
    }
}
