package com.phillippitts.glasscast.util;

import java.time.Duration;

/**
 * Standard timeout values for thread and socket teardown.
 *
 * <p>Configurable per-transport timeouts live in the {@code stream.*} properties. These constants
 * cover the fixed waits around them.
 */
public final class StreamTimeouts {

    /**
     * Grace period added on top of the configured stop timeout when a caller waits for the
     * session control loop to finish a teardown.
     */
    public static final Duration CONTROL_LOOP_MARGIN = Duration.ofMillis(500);

    /**
     * Maximum wait for an in-flight frame or chunk to finish forwarding before the transport
     * is stopped anyway.
     */
    public static final Duration FORWARDER_DRAIN_TIMEOUT = Duration.ofMillis(250);

    /**
     * Share of the session stop budget kept back for closing the source after the transport.
     */
    public static final Duration SOURCE_CLOSE_RESERVE = Duration.ofMillis(200);

    /**
     * Smallest wait a transport is given to close, however little of the stop budget is left.
     */
    public static final Duration MIN_TRANSPORT_STOP_BUDGET = Duration.ofMillis(50);

    /**
     * Timeout for the microphone capture thread to terminate during normal stop.
     *
     * <p>Capture may be blocked on a line read; one chunk is at most 200 ms.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for the mock device producer thread to terminate.
     */
    public static final Duration PRODUCER_THREAD_STOP_TIMEOUT = Duration.ofMillis(300);

    /**
     * Interval between dropped-frame summary log lines.
     */
    public static final Duration DROPPED_FRAME_LOG_INTERVAL = Duration.ofSeconds(5);

    private StreamTimeouts() {
        // Utility class - prevent instantiation
    }
}
