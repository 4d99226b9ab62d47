package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.config.transport.RtmpProperties;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.service.metrics.StreamingMetrics;
import com.phillippitts.glasscast.service.session.AudioGatewayPipelineTest.RecordingListener;
import com.phillippitts.glasscast.service.transport.rtmp.PendingFramePolicy;
import com.phillippitts.glasscast.service.transport.rtmp.RtmpTransportSession;
import com.phillippitts.glasscast.testutil.FakeVideoPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RtmpVideoPipelineTest {

    private static final Duration STOP_BUDGET = Duration.ofMillis(500);

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final StreamingMetrics metrics = new StreamingMetrics(registry);
    private final RecordingListener listener = new RecordingListener();
    private RtmpVideoPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.stop(STOP_BUDGET);
        }
    }

    private static RtmpTransportSession transport(FakeVideoPublisher.Factory factory) {
        RtmpProperties props = new RtmpProperties("rtmp://localhost/live/key", null, null, null, 25, null,
                PendingFramePolicy.BUFFER, 12, 48, null, 500, null);
        return new RtmpTransportSession(props, factory);
    }

    private static RawVideoFrame frame(int width, int height) {
        return new RawVideoFrame(width, height, new byte[RawVideoFrame.i420Size(width, height)], System.nanoTime());
    }

    private double counter(String name) {
        return registry.counter(name).count();
    }

    @Test
    void pushesFramesAndCountsThem() {
        FakeVideoPublisher.Factory factory = new FakeVideoPublisher.Factory();
        pipeline = new RtmpVideoPipeline(transport(factory), metrics);
        pipeline.start(listener);

        pipeline.onVideoFrame(frame(8, 4));
        pipeline.onVideoFrame(frame(8, 4));

        await().atMost(Duration.ofSeconds(5)).until(() -> counter("glasscast.video.frames.sent") == 2.0);
        assertThat(factory.last().width()).isEqualTo(8);
        assertThat(factory.last().height()).isEqualTo(4);
        assertThat(listener.previews).isEmpty();
    }

    @Test
    void countsFramesTheTransportRefuses() {
        pipeline = new RtmpVideoPipeline(transport(new FakeVideoPublisher.Factory()), metrics);
        pipeline.start(listener);

        pipeline.onVideoFrame(frame(8, 4));
        pipeline.onVideoFrame(frame(16, 8));

        assertThat(counter("glasscast.video.frames.dropped")).isEqualTo(1.0);
    }

    @Test
    void previewTapSeesTheSameFrames() {
        PreviewTap tap = new PreviewTap((nv21, w, h) -> new byte[] {1}, 30);
        pipeline = new RtmpVideoPipeline(transport(new FakeVideoPublisher.Factory()), tap, metrics);
        pipeline.start(listener);

        pipeline.onVideoFrame(frame(8, 4));

        assertThat(listener.previews).hasSize(1);
    }

    @Test
    void reportsConnectFailureUpward() {
        FakeVideoPublisher.Behavior behavior = new FakeVideoPublisher.Behavior()
                .failConnect(new TransportException("connection refused"));
        pipeline = new RtmpVideoPipeline(transport(new FakeVideoPublisher.Factory(behavior)), metrics);
        pipeline.start(listener);

        pipeline.onVideoFrame(frame(8, 4));

        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.failures.isEmpty());
        assertThat(listener.failures.get(0)).isInstanceOf(TransportException.class);
    }

    @Test
    void stopClosesThePublisher() {
        FakeVideoPublisher.Factory factory = new FakeVideoPublisher.Factory();
        pipeline = new RtmpVideoPipeline(transport(factory), metrics);
        pipeline.start(listener);
        pipeline.onVideoFrame(frame(8, 4));
        await().atMost(Duration.ofSeconds(5)).until(() -> counter("glasscast.video.frames.sent") == 1.0);

        pipeline.stop(STOP_BUDGET);

        assertThat(factory.last().isStopped()).isTrue();
        assertThat(pipeline.streamsOnStart()).isFalse();
    }
}
