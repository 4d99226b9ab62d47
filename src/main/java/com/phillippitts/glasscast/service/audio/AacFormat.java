package com.phillippitts.glasscast.service.audio;

/**
 * Single source of truth for the gateway audio format.
 * Target: AAC-LC, 24 kHz, mono, 64 kbps. Input PCM: 16-bit signed, little-endian, interleaved.
 */
public final class AacFormat {

    /** Target sample rate in Hz. */
    public static final int TARGET_SAMPLE_RATE = 24_000;
    /** Target channel count (mono). */
    public static final int TARGET_CHANNELS = 1;
    /** Target bit rate in bits per second. */
    public static final int TARGET_BIT_RATE = 64_000;
    /** MPEG-4 audio object type for AAC-LC, as written into ADTS headers. */
    public static final int AAC_LC_PROFILE = 2;
    /** Samples per channel in one AAC frame. */
    public static final int SAMPLES_PER_FRAME = 1024;
    /** Codec name carried in the envelope payload. */
    public static final String CODEC_NAME = "AAC";

    /** Bits per input PCM sample. */
    public static final int PCM_BITS_PER_SAMPLE = 16;
    /** Signed PCM flag for Java Sound. */
    public static final boolean PCM_SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean PCM_BIG_ENDIAN = false;

    private AacFormat() {}

    /** Bytes per second of input PCM at the given rate and channel count. */
    public static int pcmByteRate(int sampleRate, int channels) {
        return sampleRate * channels * (PCM_BITS_PER_SAMPLE / 8);
    }
}
