package com.phillippitts.glasscast.service.metrics;

import com.phillippitts.glasscast.domain.MediaSessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingMetricsTest {

    private MeterRegistry registry;
    private StreamingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StreamingMetrics(registry);
    }

    @Test
    void shouldCountAudioChunksAndBytes() {
        metrics.audioChunkSent(107);
        metrics.audioChunkSent(93);

        assertThat(registry.find("glasscast.audio.chunks.sent").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("glasscast.audio.bytes.sent").counter().count()).isEqualTo(200.0);
    }

    @Test
    void shouldCountVideoFramesSentAndDropped() {
        metrics.videoFrameSent();
        metrics.videoFrameSent();
        metrics.videoFrameDropped();

        assertThat(registry.find("glasscast.video.frames.sent").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("glasscast.video.frames.dropped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagEncodeWarningsByCodec() {
        metrics.encodeWarning("aac");
        metrics.encodeWarning("aac");
        metrics.encodeWarning("h264");

        Counter aac = registry.find("glasscast.encode.warnings").tag("codec", "aac").counter();
        Counter h264 = registry.find("glasscast.encode.warnings").tag("codec", "h264").counter();

        assertThat(aac).isNotNull();
        assertThat(aac.count()).isEqualTo(2.0);
        assertThat(h264.count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagTransportFailuresByTransport() {
        metrics.transportFailure("rtmp");

        Counter counter = registry.find("glasscast.transport.failures").tag("transport", "rtmp").counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagTransitionsByPhase() {
        metrics.sessionTransition(MediaSessionState.STARTING);
        metrics.sessionTransition(MediaSessionState.error("boom"));
        metrics.sessionTransition(MediaSessionState.error("other"));

        assertThat(registry.find("glasscast.session.transitions").tag("to", "starting").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("glasscast.session.transitions").tag("to", "error").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldRecordStopLatency() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.stopLatency(durationNanos);

        Timer timer = registry.find("glasscast.session.stop.latency").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }
}
