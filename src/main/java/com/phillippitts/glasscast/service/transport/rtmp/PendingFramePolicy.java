package com.phillippitts.glasscast.service.transport.rtmp;

/**
 * What happens to frames fed while the lazy RTMP connect is still in flight.
 */
public enum PendingFramePolicy {
    /** Discard them; the stream starts with the first frame after connect. */
    DROP,
    /** Keep a bounded number of copies (oldest evicted first) and publish them after connect. */
    BUFFER
}
