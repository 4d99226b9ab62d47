package com.phillippitts.glasscast.service.audio;

import com.phillippitts.glasscast.domain.AdtsFrame;
import com.phillippitts.glasscast.domain.EncodedAacPacket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdtsFramerTest {

    private static final int[] STANDARD_RATES = {
            96_000, 88_200, 64_000, 48_000, 44_100, 32_000, 24_000, 22_050,
            16_000, 12_000, 11_025, 8_000, 7_350
    };

    @Test
    void buildsExactHeaderForMono24k() {
        byte[] header = AdtsFramer.header(100, 24_000, 1);

        assertThat(header).containsExactly(
                (byte) 0xFF, (byte) 0xF1, (byte) 0x58, (byte) 0x40, (byte) 0x0D, (byte) 0x7F, (byte) 0xFC);
    }

    @Test
    void buildsExactHeaderForStereo44k() {
        byte[] header = AdtsFramer.header(1000, 44_100, 2);

        assertThat(header).containsExactly(
                (byte) 0xFF, (byte) 0xF1, (byte) 0x50, (byte) 0x80, (byte) 0x7D, (byte) 0xFF, (byte) 0xFC);
    }

    @Test
    void carriesHighLengthBitsIntoByteThree() {
        byte[] header = AdtsFramer.header(3000, 24_000, 1);

        // frameLen 3007 = 0b01_0111_0111_111
        assertThat(header[3]).isEqualTo((byte) 0x41);
        assertThat(header[4]).isEqualTo((byte) 0x77);
        assertThat(header[5]).isEqualTo((byte) 0xFF);
    }

    @Test
    void encodedFrameLengthIsPayloadPlusSeven() {
        for (int payload : new int[] {0, 1, 7, 255, 256, 2040, 2041, 4096, 8184}) {
            byte[] h = AdtsFramer.header(payload, 48_000, 1);
            int frameLength = ((h[3] & 0x03) << 11) | ((h[4] & 0xFF) << 3) | ((h[5] & 0xE0) >> 5);
            assertThat(frameLength).as("payload %d", payload).isEqualTo(payload + 7);
        }
    }

    @Test
    void headerDecodesBackToRateChannelsAndLength() {
        int[][] configs = {
                {48_000, 1, 0},
                {44_100, 2, 1},
                {24_000, 1, 171},
                {24_000, 2, 2041},
                {16_000, 1, 4096},
                {8_000, 2, 8184},
                {96_000, 7, 300}
        };
        for (int[] config : configs) {
            int rate = config[0];
            int channels = config[1];
            int payload = config[2];

            byte[] h = AdtsFramer.header(payload, rate, channels);

            assertThat(h[0] & 0xFF).isEqualTo(0xFF);
            assertThat(h[1] & 0xF0).isEqualTo(0xF0);
            assertThat(h[1] & 0x01).as("protection absent").isEqualTo(1);
            int freqIdx = (h[2] >> 2) & 0x0F;
            int decodedChannels = ((h[2] & 0x01) << 2) | ((h[3] & 0xC0) >> 6);
            int frameLength = ((h[3] & 0x03) << 11) | ((h[4] & 0xFF) << 3) | ((h[5] & 0xE0) >> 5);
            assertThat(STANDARD_RATES[freqIdx]).as("rate %d", rate).isEqualTo(rate);
            assertThat(decodedChannels).as("channels for %d Hz", rate).isEqualTo(channels);
            assertThat(frameLength).as("length for payload %d", payload).isEqualTo(payload + 7);
            assertThat(h[6] & 0x03).as("one raw data block").isZero();
        }
    }

    @Test
    void mapsKnownRatesToStandardIndices() {
        assertThat(AdtsFramer.frequencyIndex(96_000)).isEqualTo(0);
        assertThat(AdtsFramer.frequencyIndex(48_000)).isEqualTo(3);
        assertThat(AdtsFramer.frequencyIndex(44_100)).isEqualTo(4);
        assertThat(AdtsFramer.frequencyIndex(24_000)).isEqualTo(6);
        assertThat(AdtsFramer.frequencyIndex(16_000)).isEqualTo(8);
        assertThat(AdtsFramer.frequencyIndex(8_000)).isEqualTo(11);
        assertThat(AdtsFramer.frequencyIndex(7_350)).isEqualTo(12);
    }

    @Test
    void unknownRateFallsBackToIndexSix() {
        assertThat(AdtsFramer.frequencyIndex(12_345)).isEqualTo(6);

        byte[] header = AdtsFramer.header(10, 12_345, 1);
        assertThat((header[2] >> 2) & 0x0F).isEqualTo(6);
    }

    @Test
    void profileBitsAreAacLc() {
        byte[] header = AdtsFramer.header(10, 24_000, 1);

        assertThat((header[2] & 0xC0) >> 6).isEqualTo(AacFormat.AAC_LC_PROFILE - 1);
    }

    @Test
    void frameCopiesPayloadAfterHeader() {
        byte[] payload = {1, 2, 3, 4, 5};
        EncodedAacPacket packet = new EncodedAacPacket(payload, 24_000, 1, 0);

        AdtsFrame frame = AdtsFramer.frame(packet);

        assertThat(frame.length()).isEqualTo(12);
        assertThat(frame.payloadLength()).isEqualTo(5);
        assertThat(frame.sampleRate()).isEqualTo(24_000);
        assertThat(frame.channelCount()).isEqualTo(1);
        assertThat(frame.bytes()).endsWith(payload);
        assertThat(frame.bytes()).startsWith(AdtsFramer.header(5, 24_000, 1));
    }

    @Test
    void rejectsFramesLongerThanLengthField() {
        assertThatThrownBy(() -> AdtsFramer.header(AdtsFramer.MAX_FRAME_LENGTH, 24_000, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }
}
