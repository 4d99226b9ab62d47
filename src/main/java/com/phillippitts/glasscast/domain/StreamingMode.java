package com.phillippitts.glasscast.domain;

/**
 * What a media session does with the source's output.
 */
public enum StreamingMode {
    /** Microphone PCM to AAC/ADTS chunks over the WebSocket gateway. */
    AUDIO_GATEWAY,
    /** Camera frames to an H.264/FLV push on an RTMP endpoint. */
    RTMP_VIDEO,
    /** Camera frames to JPEG previews only. */
    PREVIEW
}
