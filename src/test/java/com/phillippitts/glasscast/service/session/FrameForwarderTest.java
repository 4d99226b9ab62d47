package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.service.source.MediaSink;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FrameForwarderTest {

    private static RawVideoFrame frame() {
        return new RawVideoFrame(2, 2, new byte[6], 0L);
    }

    @Test
    void forwardsUntilCancelled() {
        AtomicInteger video = new AtomicInteger();
        AtomicInteger audio = new AtomicInteger();
        FrameForwarder forwarder = new FrameForwarder(new MediaSink() {
            @Override
            public void onVideoFrame(RawVideoFrame frame) {
                video.incrementAndGet();
            }

            @Override
            public void onAudioChunk(AudioChunk chunk) {
                audio.incrementAndGet();
            }
        });

        forwarder.onVideoFrame(frame());
        forwarder.onAudioChunk(new AudioChunk(new byte[4], 16_000, 1));
        assertThat(forwarder.cancel(Duration.ofMillis(100))).isTrue();
        forwarder.onVideoFrame(frame());
        forwarder.onAudioChunk(new AudioChunk(new byte[4], 16_000, 1));

        assertThat(video).hasValue(1);
        assertThat(audio).hasValue(1);
        assertThat(forwarder.forwardedCount()).isEqualTo(2);
        assertThat(forwarder.isCancelled()).isTrue();
    }

    @Test
    void cancelWaitsForInFlightFrame() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FrameForwarder forwarder = new FrameForwarder(new MediaSink() {
            @Override
            public void onVideoFrame(RawVideoFrame frame) {
                entered.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        Thread producer = new Thread(() -> forwarder.onVideoFrame(frame()));
        producer.start();
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        // still blocked in the sink
        assertThat(forwarder.cancel(Duration.ofMillis(50))).isFalse();

        release.countDown();
        assertThat(forwarder.cancel(Duration.ofSeconds(2))).isTrue();
        producer.join(2_000);
        assertThat(forwarder.forwardedCount()).isEqualTo(1);
    }
}
