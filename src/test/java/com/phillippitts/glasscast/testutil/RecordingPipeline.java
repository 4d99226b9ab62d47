package com.phillippitts.glasscast.testutil;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.service.session.StreamingPipeline;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pipeline that records lifecycle calls into a shared log and counts frames, including any that
 * arrive after {@link #stop(Duration)} began.
 */
public class RecordingPipeline implements StreamingPipeline {

    private final List<String> calls;
    private final boolean streamsOnStart;
    private final AtomicInteger videoFrames = new AtomicInteger();
    private final AtomicInteger audioChunks = new AtomicInteger();
    private final AtomicInteger framesAfterStop = new AtomicInteger();

    private volatile Listener listener;
    private volatile boolean stopped;
    private volatile RuntimeException startFailure;
    private volatile RuntimeException stopFailure;
    private volatile Duration frameDelay = Duration.ZERO;
    private volatile Duration lastStopBudget;
    private volatile StreamingStats stats = new StreamingStats(3, 300, 3.0, Duration.ofSeconds(1));

    public RecordingPipeline(List<String> calls, boolean streamsOnStart) {
        this.calls = calls;
        this.streamsOnStart = streamsOnStart;
    }

    public RecordingPipeline(boolean streamsOnStart) {
        this(new CopyOnWriteArrayList<>(), streamsOnStart);
    }

    @Override
    public String name() {
        return "recording";
    }

    @Override
    public void start(Listener pipelineListener) {
        calls.add("pipeline.start");
        RuntimeException failure = startFailure;
        if (failure != null) {
            throw failure;
        }
        this.listener = pipelineListener;
        this.stopped = false;
    }

    @Override
    public boolean streamsOnStart() {
        return streamsOnStart;
    }

    @Override
    public void onVideoFrame(RawVideoFrame frame) {
        if (stopped) {
            framesAfterStop.incrementAndGet();
        }
        pause();
        videoFrames.incrementAndGet();
    }

    @Override
    public void onAudioChunk(AudioChunk chunk) {
        if (stopped) {
            framesAfterStop.incrementAndGet();
        }
        pause();
        audioChunks.incrementAndGet();
    }

    private void pause() {
        long millis = frameDelay.toMillis();
        if (millis > 0) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void stop(Duration budget) {
        stopped = true;
        lastStopBudget = budget;
        calls.add("pipeline.stop");
        RuntimeException failure = stopFailure;
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public StreamingStats recomputeStats() {
        return stats;
    }

    public void reportTransportFailure(TransportException error) {
        listener.onTransportFailure(error);
    }

    public void reportEncodeWarning(EncodeException warning) {
        listener.onEncodeWarning(warning);
    }

    public void reportPreview(int width, int height, byte[] jpeg) {
        listener.onPreviewFrame(width, height, jpeg);
    }

    public void failOnStart(RuntimeException failure) {
        this.startFailure = failure;
    }

    public void failOnStop(RuntimeException failure) {
        this.stopFailure = failure;
    }

    /** Each frame callback sleeps this long before returning. */
    public void slowFrames(Duration delay) {
        this.frameDelay = delay;
    }

    public void setStats(StreamingStats stats) {
        this.stats = stats;
    }

    public int videoFrames() {
        return videoFrames.get();
    }

    public int audioChunks() {
        return audioChunks.get();
    }

    /** Budget handed to the most recent stop, or {@code null} if never stopped. */
    public Duration lastStopBudget() {
        return lastStopBudget;
    }

    public int framesAfterStop() {
        return framesAfterStop.get();
    }
}
