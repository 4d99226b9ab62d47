package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.config.source.SourceProperties;
import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.exception.SourceErrorKind;
import com.phillippitts.glasscast.service.audio.AacFormat;
import com.phillippitts.glasscast.util.StreamTimeouts;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone source that emits PCM16LE mono chunks at the microphone's
 * native rate. Audio only: video subscribers never receive frames.
 *
 * <p>Device failures are reported on the session's state stream and as a {@link SourceErrorEvent}.
 */
@Component
@ConditionalOnProperty(prefix = "source", name = "type", havingValue = "MICROPHONE")
public class JavaSoundMicrophoneSource implements FrameSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundMicrophoneSource.class);
    private static final String NAME = "microphone";

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(AudioFormat format, Optional<String> deviceName) throws LineUnavailableException;
    }

    private final SourceProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundMicrophoneSource(SourceProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundMicrophoneSource(SourceProperties props,
                              ApplicationEventPublisher publisher,
                              DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Microphone source initialized: OS={}, device='{}', available-mixers={}, rate={} Hz, chunk={}ms",
                System.getProperty("os.name"), device, AudioSystem.getMixerInfo().length,
                props.getMicrophoneSampleRate(), props.getAudioChunkMillis());
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SourceSession startSession(SourceConfig config) {
        MicrophoneSession session = new MicrophoneSession();
        session.start();
        return session;
    }

    final class MicrophoneSession extends AbstractSourceSession {

        private final AtomicBoolean active = new AtomicBoolean(false);
        private volatile Thread thread;

        MicrophoneSession() {
            super(NAME);
        }

        void start() {
            int sampleRate = props.getMicrophoneSampleRate();
            int bytesPerChunk = props.getAudioChunkMillis() * AacFormat.pcmByteRate(sampleRate, 1) / 1000;
            AudioFormat fmt = new AudioFormat(sampleRate, AacFormat.PCM_BITS_PER_SAMPLE, 1,
                    AacFormat.PCM_SIGNED, AacFormat.PCM_BIG_ENDIAN);
            active.set(true);

            Thread t = new Thread(() -> doCapture(fmt, bytesPerChunk), "audio-capture");
            t.setDaemon(true);
            thread = t;
            t.start();
        }

        private void doCapture(AudioFormat fmt, int bytesPerChunk) {
            TargetDataLine line = null;
            long written = 0;
            try {
                line = provider.open(fmt, Optional.ofNullable(props.getDeviceName()));
                line.start();
                emitState(SourceState.STREAMING);
                byte[] buf = new byte[bytesPerChunk];
                int sampleRate = (int) fmt.getSampleRate();
                while (active.get()) {
                    int n = line.read(buf, 0, buf.length);
                    if (n <= 0) {
                        continue;
                    }
                    // keep whole 16-bit samples only
                    int aligned = n - (n % 2);
                    emitAudio(new AudioChunk(Arrays.copyOf(buf, aligned), sampleRate, 1));
                    written += aligned;
                }
                LOG.info("Microphone capture completed: total {} bytes captured", written);
            } catch (LineUnavailableException e) {
                fail(SourceErrorKind.DEVICE_NOT_FOUND, "Microphone unavailable: " + e.getMessage());
            } catch (SecurityException se) {
                fail(SourceErrorKind.PERMISSION_DENIED, "Microphone access denied: " + se.getMessage());
            } catch (RuntimeException e) {
                fail(SourceErrorKind.AUDIO_STREAMING_ERROR, "Capture failed: " + e);
            } finally {
                if (line != null) {
                    closeLine(line);
                }
            }
        }

        private void fail(SourceErrorKind kind, String detail) {
            LOG.warn(detail);
            active.set(false);
            publisher.publishEvent(new SourceErrorEvent(NAME, kind, Instant.now()));
            emitError(kind, detail);
        }

        private void closeLine(TargetDataLine line) {
            try {
                line.stop();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring failure stopping data line: {}", e.toString());
            }
            try {
                line.close();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring failure closing data line: {}", e.toString());
            }
        }

        @Override
        protected void doClose() {
            active.set(false);
            Thread captureThread = thread;
            if (captureThread == null || !captureThread.isAlive() || captureThread == Thread.currentThread()) {
                return;
            }
            long timeoutMs = StreamTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis();
            try {
                captureThread.join(timeoutMs);
                if (captureThread.isAlive()) {
                    LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for capture thread to terminate");
            }
        }
    }
}
