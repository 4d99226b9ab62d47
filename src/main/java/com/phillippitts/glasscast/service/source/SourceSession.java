package com.phillippitts.glasscast.service.source;

/**
 * Handle for one open frame source session.
 *
 * Contract:
 * - At most one frame subscriber and one state subscriber at a time
 * - Frame callbacks run on the source's thread; buffers are only valid during the callback
 * - A new state subscriber immediately receives the current state
 * - {@link #close()} is idempotent
 */
public interface SourceSession {

    /**
     * Subscribes to the frame stream.
     *
     * @throws IllegalStateException if a frame subscriber is already registered
     */
    Subscription subscribeFrames(MediaSink sink);

    /**
     * Subscribes to the state stream.
     *
     * @throws IllegalStateException if a state subscriber is already registered
     */
    Subscription subscribeState(SourceStateListener listener);

    SourceState currentState();

    /** Stops capture and releases the device. */
    void close();
}
