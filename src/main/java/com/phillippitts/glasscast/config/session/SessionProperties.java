package com.phillippitts.glasscast.config.session;

import com.phillippitts.glasscast.domain.VideoQuality;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for media session controllers.
 */
@Validated
@ConfigurationProperties(prefix = "stream.session")
public class SessionProperties {

    /** Capture resolution requested from the source. */
    private final VideoQuality videoQuality;

    @Min(1)
    @Max(60)
    private final int frameRate;

    /** Stream time limit; 0 means unlimited. */
    @Min(0)
    @Max(86_400)
    private final int timeLimitSeconds;

    /** Budget shared by all teardown steps of one stop. */
    @Min(100)
    @Max(30_000)
    private final int stopTimeoutMs;

    @Min(100)
    @Max(60_000)
    private final int statsIntervalMs;

    @ConstructorBinding
    public SessionProperties(VideoQuality videoQuality,
                             Integer frameRate,
                             Integer timeLimitSeconds,
                             Integer stopTimeoutMs,
                             Integer statsIntervalMs) {
        this.videoQuality = videoQuality == null ? VideoQuality.MEDIUM : videoQuality;
        this.frameRate = frameRate == null ? 24 : frameRate;
        this.timeLimitSeconds = timeLimitSeconds == null ? 0 : timeLimitSeconds;
        this.stopTimeoutMs = stopTimeoutMs == null ? 800 : stopTimeoutMs;
        this.statsIntervalMs = statsIntervalMs == null ? 1_000 : statsIntervalMs;
    }

    public VideoQuality getVideoQuality() { return videoQuality; }
    public int getFrameRate() { return frameRate; }
    public int getTimeLimitSeconds() { return timeLimitSeconds; }
    public int getStopTimeoutMs() { return stopTimeoutMs; }
    public int getStatsIntervalMs() { return statsIntervalMs; }
}
