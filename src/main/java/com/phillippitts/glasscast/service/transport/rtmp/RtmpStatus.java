package com.phillippitts.glasscast.service.transport.rtmp;

/**
 * Connection status of an {@link RtmpTransportSession}.
 */
public enum RtmpStatus {
    /** Armed or stopped; no connect attempted yet. */
    IDLE,
    /** First frame received, publisher connecting with that frame's dimensions. */
    CONNECTING,
    STREAMING,
    /** Connect or write failed. Frames are dropped until the session is restarted. */
    ERROR
}
