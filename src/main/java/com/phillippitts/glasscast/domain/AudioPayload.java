package com.phillippitts.glasscast.domain;

/**
 * Decoded payload of an {@code audio} envelope.
 *
 * @param timestamp ISO-8601 UTC send time
 * @param chunkIndex per-session sequence number starting at 0
 * @param codec always {@code AAC}
 * @param sampleRate sample rate of the framed audio
 * @param channels channel count of the framed audio
 * @param data base64 of one ADTS frame
 * @param size raw ADTS frame length before base64
 */
public record AudioPayload(String timestamp,
                           long chunkIndex,
                           String codec,
                           int sampleRate,
                           int channels,
                           String data,
                           int size) {
}
