package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.config.source.SourceProperties;
import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.exception.SourceErrorKind;
import com.phillippitts.glasscast.util.StreamTimeouts;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * Simulated glasses for development without hardware.
 *
 * <p>Each session produces I420 test-pattern frames at the requested quality and frame rate plus
 * a sine test tone as 48 kHz mono PCM. The frame buffer is reused between callbacks, the same way
 * a real device recycles its capture buffers.
 */
@Component
@ConditionalOnProperty(prefix = "source", name = "type", havingValue = "MOCK_DEVICE", matchIfMissing = true)
public class MockDeviceFrameSource implements FrameSource {

    private static final Logger LOG = LogManager.getLogger(MockDeviceFrameSource.class);

    static final int AUDIO_SAMPLE_RATE = 48_000;
    private static final double TONE_AMPLITUDE = 8_000.0;

    private final SourceProperties props;
    private final Set<MockDeviceSession> live = ConcurrentHashMap.newKeySet();

    public MockDeviceFrameSource(SourceProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public String name() {
        return "mock-device";
    }

    @Override
    public SourceSession startSession(SourceConfig config) {
        MockDeviceSession session = new MockDeviceSession(config);
        live.add(session);
        session.start();
        LOG.info("Mock device session started: {}x{} @ {} fps", config.quality().width(),
                config.quality().height(), config.frameRate());
        return session;
    }

    /** Simulates powering the glasses off: every open session reports STOPPED unprompted. */
    public void powerOff() {
        LOG.info("Mock device powered off; {} session(s) affected", live.size());
        for (MockDeviceSession session : live) {
            session.deviceLost();
        }
    }

    public int openSessionCount() {
        return live.size();
    }

    @PreDestroy
    public void shutdown() {
        for (MockDeviceSession session : live) {
            session.close();
        }
    }

    final class MockDeviceSession extends AbstractSourceSession {

        private final SourceConfig config;
        private final AtomicBoolean running = new AtomicBoolean(false);
        private final byte[] frameBuffer;
        private volatile Thread thread;

        MockDeviceSession(SourceConfig config) {
            super("mock-device");
            this.config = Objects.requireNonNull(config);
            this.frameBuffer = new byte[RawVideoFrame.i420Size(config.quality().width(), config.quality().height())];
        }

        void start() {
            running.set(true);
            Thread t = new Thread(this::produce, "mock-device");
            t.setDaemon(true);
            thread = t;
            t.start();
        }

        private void produce() {
            int width = config.quality().width();
            int height = config.quality().height();
            int samplesPerChunk = AUDIO_SAMPLE_RATE * props.getAudioChunkMillis() / 1000;
            long frameIntervalNanos = TimeUnit.SECONDS.toNanos(1) / config.frameRate();
            long chunkIntervalNanos = TimeUnit.MILLISECONDS.toNanos(props.getAudioChunkMillis());
            try {
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(props.getMockWarmupMillis()));
                if (!running.get()) {
                    return;
                }
                emitState(SourceState.STREAMING);

                long nextFrame = System.nanoTime();
                long nextChunk = nextFrame;
                long frameNumber = 0;
                long samplePosition = 0;
                while (running.get()) {
                    long now = System.nanoTime();
                    if (now >= nextFrame) {
                        paint(frameNumber++, width, height);
                        emitVideo(new RawVideoFrame(width, height, frameBuffer, now));
                        nextFrame += frameIntervalNanos;
                    }
                    if (now >= nextChunk) {
                        emitAudio(tone(samplePosition, samplesPerChunk));
                        samplePosition += samplesPerChunk;
                        nextChunk += chunkIntervalNanos;
                    }
                    long sleep = Math.min(nextFrame, nextChunk) - System.nanoTime();
                    if (sleep > 0) {
                        LockSupport.parkNanos(sleep);
                    }
                }
            } catch (RuntimeException e) {
                LOG.warn("Mock device producer failed: {}", e.toString());
                emitError(SourceErrorKind.VIDEO_STREAMING_ERROR, e.getMessage());
            }
        }

        private void paint(long frameNumber, int width, int height) {
            int shift = (int) (frameNumber * 4);
            for (int y = 0; y < height; y++) {
                int row = y * width;
                for (int x = 0; x < width; x++) {
                    frameBuffer[row + x] = (byte) ((x + y + shift) & 0xFF);
                }
            }
            int lumaSize = width * height;
            for (int i = lumaSize; i < frameBuffer.length; i++) {
                frameBuffer[i] = (byte) 128;
            }
        }

        private AudioChunk tone(long startSample, int samples) {
            byte[] pcm = new byte[samples * 2];
            double step = 2 * Math.PI * props.getMockToneHz() / AUDIO_SAMPLE_RATE;
            for (int i = 0; i < samples; i++) {
                short v = (short) (Math.sin(step * (startSample + i)) * TONE_AMPLITUDE);
                pcm[2 * i] = (byte) (v & 0xFF);
                pcm[2 * i + 1] = (byte) ((v >> 8) & 0xFF);
            }
            return new AudioChunk(pcm, AUDIO_SAMPLE_RATE, 1);
        }

        void deviceLost() {
            running.set(false);
            live.remove(this);
            emitState(SourceState.STOPPED);
        }

        @Override
        protected void doClose() {
            running.set(false);
            live.remove(this);
            Thread t = thread;
            if (t != null && t != Thread.currentThread()) {
                try {
                    t.join(StreamTimeouts.PRODUCER_THREAD_STOP_TIMEOUT.toMillis());
                    if (t.isAlive()) {
                        LOG.warn("Mock device thread did not terminate within {}ms",
                                StreamTimeouts.PRODUCER_THREAD_STOP_TIMEOUT.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while waiting for mock device thread to terminate");
                }
            }
        }
    }
}
