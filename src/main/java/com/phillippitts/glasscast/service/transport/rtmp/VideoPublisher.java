package com.phillippitts.glasscast.service.transport.rtmp;

/**
 * H.264/FLV encoder and RTMP pusher driven by {@link RtmpTransportSession}.
 *
 * <p>All methods are called from the session's single worker thread, except
 * {@link #forceRelease()}, which may run concurrently with a hung {@link #stop()}.
 */
public interface VideoPublisher {

    /**
     * Connects to the endpoint and initialises the encoder for the given dimensions.
     *
     * @throws com.phillippitts.glasscast.exception.TransportException on connect failure
     */
    void start();

    /**
     * Encodes and sends one I420 frame.
     *
     * @param i420 frame bytes, owned by the caller
     * @param timestampMicros presentation time relative to the first frame
     * @throws com.phillippitts.glasscast.exception.EncodeException if the frame is rejected
     * @throws com.phillippitts.glasscast.exception.TransportException if the socket write fails
     */
    void publish(byte[] i420, int width, int height, long timestampMicros);

    /** Flushes and closes the stream gracefully. */
    void stop();

    /** Releases native resources without a graceful flush. Idempotent. */
    void forceRelease();
}
