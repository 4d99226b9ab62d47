package com.phillippitts.glasscast.service.audio;

import com.phillippitts.glasscast.annotation.RequiresRealBinary;
import com.phillippitts.glasscast.domain.AdtsFrame;
import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.EncodedAacPacket;
import com.phillippitts.glasscast.exception.EncodeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@RequiresRealBinary("ffmpeg")
class FfmpegAacEncoderTest {

    private static AudioChunk tone(int sampleRate, int channels, int millis, long offset) {
        int frames = sampleRate * millis / 1000;
        byte[] pcm = new byte[frames * channels * 2];
        for (int i = 0; i < frames; i++) {
            short v = (short) (Math.sin(2 * Math.PI * 440 * (offset + i) / sampleRate) * 8000);
            for (int c = 0; c < channels; c++) {
                int at = (i * channels + c) * 2;
                pcm[at] = (byte) (v & 0xFF);
                pcm[at + 1] = (byte) ((v >> 8) & 0xFF);
            }
        }
        return new AudioChunk(pcm, sampleRate, channels);
    }

    @Test
    void encodesOneSecondOf48kMonoToAacLc24k() {
        List<EncodedAacPacket> packets = new ArrayList<>();
        try (FfmpegAacEncoder encoder = new FfmpegAacEncoder()) {
            for (int i = 0; i < 50; i++) {
                packets.addAll(encoder.encode(tone(48_000, 1, 20, i * 960L)));
            }
        }

        // 24000 / 1024 frames per second, less the encoder's priming delay
        assertThat(packets).hasSizeBetween(18, 24);
        assertThat(packets).allSatisfy(p -> {
            assertThat(p.sampleRate()).isEqualTo(AacFormat.TARGET_SAMPLE_RATE);
            assertThat(p.channelCount()).isEqualTo(1);
            assertThat(p.payload()).isNotEmpty();
        });
        for (int i = 0; i < packets.size(); i++) {
            assertThat(packets.get(i).sequenceIndex()).isEqualTo(i);
        }
    }

    @Test
    void packetsFrameIntoValidAdts() {
        List<EncodedAacPacket> packets = new ArrayList<>();
        try (FfmpegAacEncoder encoder = new FfmpegAacEncoder()) {
            for (int i = 0; i < 20; i++) {
                packets.addAll(encoder.encode(tone(44_100, 2, 20, i * 882L)));
            }
        }

        AdtsFrame frame = AdtsFramer.frame(packets.get(0));
        byte[] bytes = frame.bytes();
        assertThat(bytes[0] & 0xFF).isEqualTo(0xFF);
        assertThat(bytes[1] & 0xFF).isEqualTo(0xF1);
        // profile LC, 24 kHz, mono
        assertThat(bytes[2] & 0xFF).isEqualTo(0x58);
        assertThat(bytes).hasSize(packets.get(0).payload().length + 7);
    }

    @Test
    void rejectsFormatChangeWithinSession() {
        try (FfmpegAacEncoder encoder = new FfmpegAacEncoder()) {
            encoder.encode(tone(48_000, 1, 20, 0));

            assertThatThrownBy(() -> encoder.encode(tone(16_000, 1, 20, 0)))
                    .isInstanceOf(EncodeException.class)
                    .hasMessageContaining("PCM format changed");
        }
    }

    @Test
    void emptyChunkYieldsNothing() {
        try (FfmpegAacEncoder encoder = new FfmpegAacEncoder()) {
            assertThat(encoder.encode(new AudioChunk(new byte[0], 48_000, 1))).isEmpty();
        }
    }

    @Test
    void closedEncoderRefusesWork() {
        FfmpegAacEncoder encoder = new FfmpegAacEncoder();
        encoder.close();
        encoder.close();

        assertThatThrownBy(() -> encoder.encode(tone(48_000, 1, 20, 0)))
                .isInstanceOf(IllegalStateException.class);
    }
}
