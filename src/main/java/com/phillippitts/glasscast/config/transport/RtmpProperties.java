package com.phillippitts.glasscast.config.transport;

import com.phillippitts.glasscast.service.transport.rtmp.PendingFramePolicy;
import com.phillippitts.glasscast.service.transport.rtmp.RtmpEndpoint;
import com.phillippitts.glasscast.service.transport.rtmp.StreamingPlatform;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the RTMP video push.
 *
 * <p>The publish URL is {@code url} (plus {@code stream-key} when set), or the platform preset's
 * base URL plus {@code stream-key} when no URL is given.
 */
@Validated
@ConfigurationProperties(prefix = "stream.rtmp")
public class RtmpProperties {

    @Pattern(regexp = "^rtmps?://.+", message = "must be an rtmp:// or rtmps:// URL")
    private final String url;

    private final String streamKey;

    private final StreamingPlatform platform;

    @Min(100_000)
    @Max(20_000_000)
    private final int targetBitrate;

    @Min(1)
    @Max(60)
    private final int frameRate;

    /** Keyframe interval in seconds. */
    @Min(1)
    @Max(10)
    private final int gopSeconds;

    private final PendingFramePolicy pendingFramePolicy;

    @Min(1)
    @Max(240)
    private final int pendingFrameCapacity;

    /** Frames waiting for the encoder thread once connected; overflow is dropped. */
    @Min(1)
    @Max(600)
    private final int frameQueueCapacity;

    /** Socket read/write timeout handed to FFmpeg. */
    @Min(500)
    @Max(60_000)
    private final int ioTimeoutMs;

    /** Bound on {@code stop()} before the muxer is force-released. */
    @Min(50)
    @Max(10_000)
    private final int stopTimeoutMs;

    /** x264 preset. */
    private final String encoderPreset;

    @ConstructorBinding
    public RtmpProperties(String url,
                          String streamKey,
                          StreamingPlatform platform,
                          Integer targetBitrate,
                          Integer frameRate,
                          Integer gopSeconds,
                          PendingFramePolicy pendingFramePolicy,
                          Integer pendingFrameCapacity,
                          Integer frameQueueCapacity,
                          Integer ioTimeoutMs,
                          Integer stopTimeoutMs,
                          String encoderPreset) {
        this.url = (url == null || url.isBlank()) ? null : url.trim();
        this.streamKey = (streamKey == null || streamKey.isBlank()) ? null : streamKey.trim();
        this.platform = platform == null ? StreamingPlatform.CUSTOM : platform;
        this.targetBitrate = targetBitrate == null ? 2_000_000 : targetBitrate;
        this.frameRate = frameRate == null ? 24 : frameRate;
        this.gopSeconds = gopSeconds == null ? 1 : gopSeconds;
        this.pendingFramePolicy = pendingFramePolicy == null ? PendingFramePolicy.DROP : pendingFramePolicy;
        this.pendingFrameCapacity = pendingFrameCapacity == null ? 12 : pendingFrameCapacity;
        this.frameQueueCapacity = frameQueueCapacity == null ? 48 : frameQueueCapacity;
        this.ioTimeoutMs = ioTimeoutMs == null ? 5_000 : ioTimeoutMs;
        this.stopTimeoutMs = stopTimeoutMs == null ? 500 : stopTimeoutMs;
        this.encoderPreset = (encoderPreset == null || encoderPreset.isBlank()) ? "veryfast" : encoderPreset;
    }

    /**
     * Resolves the URL the publisher connects to.
     *
     * @return full publish URL, or {@code null} if neither a URL nor a platform preset is configured
     */
    public String resolvePublishUrl() {
        if (url != null) {
            return RtmpEndpoint.buildFullUrl(url, streamKey);
        }
        if (platform != StreamingPlatform.CUSTOM) {
            return RtmpEndpoint.buildFullUrl(platform.baseUrl(), streamKey);
        }
        return null;
    }

    public String getUrl() { return url; }
    public String getStreamKey() { return streamKey; }
    public StreamingPlatform getPlatform() { return platform; }
    public int getTargetBitrate() { return targetBitrate; }
    public int getFrameRate() { return frameRate; }
    public int getGopSeconds() { return gopSeconds; }
    public PendingFramePolicy getPendingFramePolicy() { return pendingFramePolicy; }
    public int getPendingFrameCapacity() { return pendingFrameCapacity; }
    public int getFrameQueueCapacity() { return frameQueueCapacity; }
    public int getIoTimeoutMs() { return ioTimeoutMs; }
    public int getStopTimeoutMs() { return stopTimeoutMs; }
    public String getEncoderPreset() { return encoderPreset; }
}
