package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.domain.VideoQuality;

import java.util.Objects;

/**
 * Parameters passed to {@link FrameSource#startSession(SourceConfig)}.
 */
public record SourceConfig(VideoQuality quality, int frameRate) {

    public SourceConfig {
        Objects.requireNonNull(quality, "quality must not be null");
        if (frameRate <= 0) {
            throw new IllegalArgumentException("frameRate must be positive: " + frameRate);
        }
    }
}
