package com.phillippitts.glasscast.service.source;

/**
 * Device that supplies raw video frames and/or PCM audio plus session state events.
 *
 * <p>The core depends only on this interface and {@link SourceSession}; vendor SDK transport
 * details stay behind it.
 */
public interface FrameSource {

    /** Short name used in logs and events. */
    String name();

    /**
     * Opens a capture/stream session. The session starts in {@link SourceState#STARTING} and
     * reports further transitions on its state stream.
     *
     * @param config requested quality and frame rate
     * @return handle for the new session
     * @throws com.phillippitts.glasscast.exception.MediaSourceException if the session cannot be opened
     */
    SourceSession startSession(SourceConfig config);
}
