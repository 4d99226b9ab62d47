package com.phillippitts.glasscast.testutil;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.EncodedAacPacket;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.PartialEncodeException;
import com.phillippitts.glasscast.service.audio.AacFormat;
import com.phillippitts.glasscast.service.audio.AudioEncoder;
import com.phillippitts.glasscast.service.audio.AudioEncoderFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Encoder stand-in that yields a fixed number of packets per chunk and records the input format
 * of every call.
 */
public class FakeAudioEncoder implements AudioEncoder {

    private final int packetsPerChunk;
    private final int payloadBytes;
    private final int rejectCall;
    private volatile boolean partialReject;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<Integer> inputRates = new CopyOnWriteArrayList<>();
    private long sequence;
    private volatile boolean closed;

    /**
     * @param rejectCall zero-based call that throws {@link EncodeException}, or {@code -1}
     */
    public FakeAudioEncoder(int packetsPerChunk, int payloadBytes, int rejectCall) {
        this.packetsPerChunk = packetsPerChunk;
        this.payloadBytes = payloadBytes;
        this.rejectCall = rejectCall;
    }

    @Override
    public List<EncodedAacPacket> encode(AudioChunk chunk) {
        int call = calls.getAndIncrement();
        inputRates.add(chunk.sampleRate());
        if (call == rejectCall && !partialReject) {
            throw new EncodeException("chunk rejected", "aac");
        }
        List<EncodedAacPacket> out = new ArrayList<>();
        for (int i = 0; i < packetsPerChunk; i++) {
            out.add(new EncodedAacPacket(new byte[payloadBytes], AacFormat.TARGET_SAMPLE_RATE,
                    AacFormat.TARGET_CHANNELS, sequence++));
        }
        if (call == rejectCall) {
            throw new PartialEncodeException("frame rejected", "aac", out,
                    new EncodeException("avcodec_send_frame failed", "aac"));
        }
        return out;
    }

    @Override
    public void close() {
        closed = true;
    }

    /** Makes the rejected call fail only after its packets were produced. */
    public FakeAudioEncoder failAfterPackets() {
        partialReject = true;
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    public int calls() {
        return calls.get();
    }

    public List<Integer> inputRates() {
        return inputRates;
    }

    /** Factory that records every encoder it creates. */
    public static final class Factory implements AudioEncoderFactory {

        private final int packetsPerChunk;
        private final int payloadBytes;
        private final int rejectCall;
        private final List<FakeAudioEncoder> created = new CopyOnWriteArrayList<>();
        private boolean failAfterPackets;

        public Factory(int packetsPerChunk, int payloadBytes, int rejectCall) {
            this.packetsPerChunk = packetsPerChunk;
            this.payloadBytes = payloadBytes;
            this.rejectCall = rejectCall;
        }

        @Override
        public AudioEncoder create() {
            FakeAudioEncoder encoder = new FakeAudioEncoder(packetsPerChunk, payloadBytes, rejectCall);
            if (failAfterPackets) {
                encoder.failAfterPackets();
            }
            created.add(encoder);
            return encoder;
        }

        public Factory failAfterPackets() {
            failAfterPackets = true;
            return this;
        }

        public List<FakeAudioEncoder> created() {
            return created;
        }
    }
}
