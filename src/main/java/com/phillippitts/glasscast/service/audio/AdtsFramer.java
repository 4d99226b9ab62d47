package com.phillippitts.glasscast.service.audio;

import com.phillippitts.glasscast.domain.AdtsFrame;
import com.phillippitts.glasscast.domain.EncodedAacPacket;

import java.util.Map;
import java.util.Objects;

/**
 * Wraps raw AAC packets in 7-byte ADTS headers (ISO/IEC 13818-7, MPEG-4, no CRC).
 *
 * <p>The header layout is an external wire format and is reproduced bit for bit:
 * <pre>
 * byte0 = 0xFF
 * byte1 = 0xF1                                       MPEG-4, layer 0, no CRC
 * byte2 = ((profile-1) &lt;&lt; 6) | (freqIdx &lt;&lt; 2) | (channels &gt;&gt; 2)
 * byte3 = ((channels &amp; 3) &lt;&lt; 6) | ((frameLen &gt;&gt; 11) &amp; 0x03)
 * byte4 = (frameLen &gt;&gt; 3) &amp; 0xFF
 * byte5 = ((frameLen &amp; 0x7) &lt;&lt; 5) | 0x1F
 * byte6 = 0xFC
 * </pre>
 * where {@code frameLen = 7 + payloadLength} and profile is AAC-LC.
 */
public final class AdtsFramer {

    /** Sampling frequency index used for rates missing from the table (24 kHz). */
    public static final int DEFAULT_FREQUENCY_INDEX = 6;

    /** Largest frame length expressible in the 13-bit ADTS length field. */
    public static final int MAX_FRAME_LENGTH = (1 << 13) - 1;

    private static final Map<Integer, Integer> FREQUENCY_INDEX = Map.ofEntries(
            Map.entry(96_000, 0),
            Map.entry(88_200, 1),
            Map.entry(64_000, 2),
            Map.entry(48_000, 3),
            Map.entry(44_100, 4),
            Map.entry(32_000, 5),
            Map.entry(24_000, 6),
            Map.entry(22_050, 7),
            Map.entry(16_000, 8),
            Map.entry(12_000, 9),
            Map.entry(11_025, 10),
            Map.entry(8_000, 11),
            Map.entry(7_350, 12)
    );

    private AdtsFramer() {
        // Utility class - prevent instantiation
    }

    /**
     * Frames one packet.
     *
     * @param packet raw AAC access unit
     * @return header followed by a copy of the payload
     * @throws IllegalArgumentException if the framed length exceeds the 13-bit length field
     */
    public static AdtsFrame frame(EncodedAacPacket packet) {
        Objects.requireNonNull(packet, "packet must not be null");
        byte[] payload = packet.payload();
        byte[] header = header(payload.length, packet.sampleRate(), packet.channelCount());

        byte[] out = new byte[header.length + payload.length];
        System.arraycopy(header, 0, out, 0, header.length);
        System.arraycopy(payload, 0, out, header.length, payload.length);
        return new AdtsFrame(out, packet.sampleRate(), packet.channelCount());
    }

    /**
     * Builds the 7-byte header for a payload of the given length.
     */
    public static byte[] header(int payloadLength, int sampleRate, int channels) {
        int frameLength = AdtsFrame.HEADER_LENGTH + payloadLength;
        if (payloadLength < 0 || frameLength > MAX_FRAME_LENGTH) {
            throw new IllegalArgumentException("ADTS frame length out of range: " + frameLength);
        }
        int profile = AacFormat.AAC_LC_PROFILE;
        int freqIdx = frequencyIndex(sampleRate);

        byte[] header = new byte[AdtsFrame.HEADER_LENGTH];
        header[0] = (byte) 0xFF;
        header[1] = (byte) 0xF1;
        header[2] = (byte) (((profile - 1) << 6) | (freqIdx << 2) | (channels >> 2));
        header[3] = (byte) (((channels & 3) << 6) | ((frameLength >> 11) & 0x03));
        header[4] = (byte) ((frameLength >> 3) & 0xFF);
        header[5] = (byte) (((frameLength & 0x7) << 5) | 0x1F);
        header[6] = (byte) 0xFC;
        return header;
    }

    /** Sampling frequency index for the rate, or {@link #DEFAULT_FREQUENCY_INDEX} if unknown. */
    public static int frequencyIndex(int sampleRate) {
        return FREQUENCY_INDEX.getOrDefault(sampleRate, DEFAULT_FREQUENCY_INDEX);
    }
}
