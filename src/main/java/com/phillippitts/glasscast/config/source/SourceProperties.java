package com.phillippitts.glasscast.config.source;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties selecting and tuning the frame source.
 *
 * Microphone PCM is 16-bit signed, little-endian, mono at {@code microphoneSampleRate}.
 */
@Validated
@ConfigurationProperties(prefix = "source")
public class SourceProperties {

    public enum SourceType { MOCK_DEVICE, MICROPHONE }

    private final SourceType type;

    /** Size of one emitted PCM chunk in milliseconds. */
    @Min(10)
    @Max(200)
    private final int audioChunkMillis;

    /** Native capture rate requested from the microphone. */
    @Min(8_000)
    @Max(96_000)
    private final int microphoneSampleRate;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    /** Delay between STARTING and STREAMING on the mock device. */
    @Min(0)
    @Max(5_000)
    private final int mockWarmupMillis;

    /** Frequency of the mock device's test tone. */
    @Min(20)
    @Max(20_000)
    private final int mockToneHz;

    @ConstructorBinding
    public SourceProperties(SourceType type,
                            Integer audioChunkMillis,
                            Integer microphoneSampleRate,
                            String deviceName,
                            Integer mockWarmupMillis,
                            Integer mockToneHz) {
        this.type = type == null ? SourceType.MOCK_DEVICE : type;
        this.audioChunkMillis = audioChunkMillis == null ? 20 : audioChunkMillis;
        this.microphoneSampleRate = microphoneSampleRate == null ? 48_000 : microphoneSampleRate;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
        this.mockWarmupMillis = mockWarmupMillis == null ? 100 : mockWarmupMillis;
        this.mockToneHz = mockToneHz == null ? 440 : mockToneHz;
    }

    public SourceType getType() { return type; }
    public int getAudioChunkMillis() { return audioChunkMillis; }
    public int getMicrophoneSampleRate() { return microphoneSampleRate; }
    public String getDeviceName() { return deviceName; }
    public int getMockWarmupMillis() { return mockWarmupMillis; }
    public int getMockToneHz() { return mockToneHz; }
}
