package com.phillippitts.glasscast.config.session;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * JPEG preview settings. {@code enabled} adds the preview tap to RTMP sessions and is off by
 * default, so each RTMP frame feeds only the H.264 encoder. The PREVIEW mode always has the tap.
 */
@Validated
@ConfigurationProperties(prefix = "stream.preview")
public class PreviewProperties {

    private final boolean enabled;

    @Min(1)
    @Max(100)
    private final int jpegQuality;

    @Min(1)
    @Max(30)
    private final int maxFps;

    @ConstructorBinding
    public PreviewProperties(Boolean enabled, Integer jpegQuality, Integer maxFps) {
        this.enabled = enabled != null && enabled;
        this.jpegQuality = jpegQuality == null ? 50 : jpegQuality;
        this.maxFps = maxFps == null ? 10 : maxFps;
    }

    public boolean isEnabled() { return enabled; }
    public int getJpegQuality() { return jpegQuality; }
    public int getMaxFps() { return maxFps; }
}
