package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;

/**
 * Receives frames from a {@link SourceSession}. Implementations must copy or fully consume the
 * buffers before returning.
 */
public interface MediaSink {

    default void onVideoFrame(RawVideoFrame frame) {
    }

    default void onAudioChunk(AudioChunk chunk) {
    }
}
