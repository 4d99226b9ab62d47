package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.service.source.MediaSink;

import java.time.Duration;

/**
 * Encoder and transport chain driven by a {@link MediaSessionController}.
 *
 * <p>Frame callbacks must consume or copy the buffer before returning. The controller guarantees
 * that no frame callback starts after {@link #stop(Duration)} begins.
 */
public interface StreamingPipeline extends MediaSink {

    /** Short name used in logs and metric tags. */
    String name();

    /**
     * Starts the transport.
     *
     * @throws com.phillippitts.glasscast.exception.GlassCastException if it cannot be started
     */
    void start(Listener listener);

    /**
     * Whether the session counts as streaming as soon as {@link #start(Listener)} returns.
     * Otherwise it waits for the source to report streaming.
     */
    boolean streamsOnStart();

    /**
     * Stops the transport and releases encoders. Idempotent.
     *
     * @param budget upper bound on waiting for the remote side to close; the transport's own
     *               configured close timeout applies when it is shorter
     */
    void stop(Duration budget);

    StreamingStats recomputeStats();

    /** Upward reports. Implementations never mutate session state directly. */
    interface Listener {

        /** Unrecoverable; the controller tears the session down. */
        void onTransportFailure(TransportException error);

        /** One unit was dropped; the session continues. */
        void onEncodeWarning(EncodeException warning);

        default void onPreviewFrame(int width, int height, byte[] jpeg) {
        }
    }
}
