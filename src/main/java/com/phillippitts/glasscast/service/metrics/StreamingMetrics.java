package com.phillippitts.glasscast.service.metrics;

import com.phillippitts.glasscast.domain.MediaSessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the media pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Audio chunks and bytes handed to the gateway socket</li>
 *   <li>Video frames published to RTMP, and frames dropped before the muxer</li>
 *   <li>Encode warnings per codec and transport failures per transport</li>
 *   <li>Session state transitions and teardown latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer at /actuator/metrics.
 */
@Component
public class StreamingMetrics {

    private static final String METRIC_PREFIX = "glasscast";

    private final MeterRegistry registry;

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one ADTS frame sent to the audio gateway.
     *
     * @param bytes raw frame length before base64
     */
    public void audioChunkSent(long bytes) {
        Counter.builder(METRIC_PREFIX + ".audio.chunks.sent")
                .description("ADTS frames sent to the audio gateway")
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".audio.bytes.sent")
                .description("ADTS bytes sent to the audio gateway, before base64")
                .baseUnit("bytes")
                .register(registry)
                .increment(bytes);
    }

    public void videoFrameSent() {
        Counter.builder(METRIC_PREFIX + ".video.frames.sent")
                .description("Video frames handed to the RTMP muxer")
                .register(registry)
                .increment();
    }

    public void videoFrameDropped() {
        Counter.builder(METRIC_PREFIX + ".video.frames.dropped")
                .description("Video frames dropped before reaching the RTMP muxer")
                .register(registry)
                .increment();
    }

    /**
     * @param codec codec that rejected the unit (aac, h264, jpeg)
     */
    public void encodeWarning(String codec) {
        Counter.builder(METRIC_PREFIX + ".encode.warnings")
                .description("Frames or chunks dropped by an encoder")
                .tag("codec", codec)
                .register(registry)
                .increment();
    }

    /**
     * @param transport pipeline name (audio-gateway, rtmp)
     */
    public void transportFailure(String transport) {
        Counter.builder(METRIC_PREFIX + ".transport.failures")
                .description("Unrecoverable transport errors")
                .tag("transport", transport)
                .register(registry)
                .increment();
    }

    public void sessionTransition(MediaSessionState to) {
        Counter.builder(METRIC_PREFIX + ".session.transitions")
                .description("Media session state transitions by target phase")
                .tag("to", to.phase().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records the time from entering STOPPING to a terminal state.
     *
     * @param durationNanos teardown duration in nanoseconds
     */
    public void stopLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".session.stop.latency")
                .description("Time taken to tear down a media session")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
