package com.phillippitts.glasscast.service.transport.rtmp;

import com.phillippitts.glasscast.config.transport.RtmpProperties;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.exception.TransportExceptionBuilder;
import com.phillippitts.glasscast.service.transport.StreamingStatsTracker;
import com.phillippitts.glasscast.util.LogSanitizer;
import com.phillippitts.glasscast.util.StreamTimeouts;
import com.phillippitts.glasscast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pushes raw video frames to an RTMP endpoint.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → CONNECTING (first frame fed; its dimensions fix the stream size)
 * CONNECTING → STREAMING (publisher connected)
 * CONNECTING | STREAMING → ERROR (connect or write failure)
 * any → IDLE (stop)
 * </pre>
 *
 * <p>The connect is lazy and happens exactly once per {@link #start(Listener)}. Encoding and
 * network I/O run on a single worker thread, so {@link #feedFrame} never blocks: it copies the
 * caller's buffer and either queues it, holds it per the {@link PendingFramePolicy} while the
 * connect is in flight, or drops it. Frames are never reordered.
 *
 * <p>{@link #stop()} is bounded by {@code stream.rtmp.stop-timeout-ms}; a publisher that does not
 * close in time is force-released on a background thread.
 */
public class RtmpTransportSession {

    private static final Logger LOG = LogManager.getLogger(RtmpTransportSession.class);

    /** Callbacks arrive on the worker thread or the thread calling {@link #stop()}. */
    public interface Listener {
        void onStatusChanged(RtmpStatus status);

        void onTransportError(TransportException error);

        /** A single frame was rejected by the encoder; streaming continues. */
        default void onEncodeWarning(EncodeException warning) {
        }

        /** A frame reached the muxer. */
        default void onFramePublished(int bytes) {
        }
    }

    private final RtmpProperties props;
    private final VideoPublisherFactory publisherFactory;
    private final StreamingStatsTracker stats;

    private final Object lock = new Object();
    private final Deque<RawVideoFrame> pending = new ArrayDeque<>();
    private final AtomicLong droppedFrames = new AtomicLong();
    private final AtomicLong connectAttempts = new AtomicLong();

    private ThreadPoolExecutor worker;
    private Listener listener;
    private String publishUrl;
    private RtmpStatus status = RtmpStatus.IDLE;
    private int generation;
    private boolean connectRequested;
    private int width;
    private int height;
    private boolean sizeMismatchWarned;
    private FrameTimestampSmoother smoother;

    private volatile VideoPublisher publisher;
    private volatile long lastDropLogNanos;
    private long droppedAtLastLog;

    public RtmpTransportSession(RtmpProperties props, VideoPublisherFactory publisherFactory) {
        this(props, publisherFactory, new StreamingStatsTracker());
    }

    public RtmpTransportSession(RtmpProperties props,
                                VideoPublisherFactory publisherFactory,
                                StreamingStatsTracker stats) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisherFactory = Objects.requireNonNull(publisherFactory, "publisherFactory must not be null");
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
    }

    /**
     * Arms the session. No connection is made until the first frame arrives.
     * A previous run, if any, is stopped first.
     *
     * @throws TransportException if no publish URL can be resolved from the properties
     */
    public void start(Listener newListener) {
        Objects.requireNonNull(newListener, "listener must not be null");
        stop();
        String url = props.resolvePublishUrl();
        if (url == null) {
            throw TransportExceptionBuilder.create("No RTMP URL configured")
                    .metadata("property", "stream.rtmp.url")
                    .build();
        }
        RtmpEndpoint.parse(url);

        synchronized (lock) {
            generation++;
            listener = newListener;
            publishUrl = url;
            status = RtmpStatus.IDLE;
            connectRequested = false;
            sizeMismatchWarned = false;
            width = 0;
            height = 0;
            pending.clear();
            droppedFrames.set(0);
            droppedAtLastLog = 0;
            smoother = new FrameTimestampSmoother(props.getFrameRate());
            worker = newWorker(props.getFrameQueueCapacity());
        }
        stats.reset();
        LOG.info("RTMP session armed for {} (policy={}, {}bps @ {}fps)",
                LogSanitizer.redactCredentials(url), props.getPendingFramePolicy(),
                props.getTargetBitrate(), props.getFrameRate());
    }

    private ThreadPoolExecutor newWorker(int queueCapacity) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "rtmp-publisher");
                    t.setDaemon(true);
                    return t;
                },
                (r, rejectedBy) -> countDrop("encoder queue full"));
        return executor;
    }

    /** Feeds a frame; see {@link #feedFrame(byte[], int, int, long)}. */
    public boolean feedFrame(RawVideoFrame frame) {
        return feedFrame(frame.buffer(), frame.width(), frame.height(),
                frame.captureTimestampNanos() / 1_000L);
    }

    /**
     * Hands one I420 frame to the session. Never blocks; the buffer is copied before returning.
     *
     * <p>Published timestamps follow an even cadence at the configured frame rate, so the capture
     * timestamp is only used for diagnostics.
     *
     * @return {@code true} if the frame was queued for publishing or held as pending
     */
    public boolean feedFrame(byte[] buffer, int frameWidth, int frameHeight, long timestampUs) {
        if (buffer == null || frameWidth <= 0 || frameHeight <= 0) {
            countDrop("invalid frame");
            return false;
        }
        if (buffer.length != RawVideoFrame.i420Size(frameWidth, frameHeight)) {
            warnBufferMismatch(buffer.length, frameWidth, frameHeight);
            countDrop("buffer size mismatch");
            return false;
        }

        synchronized (lock) {
            if (worker == null || status == RtmpStatus.ERROR) {
                countDrop("session " + (worker == null ? "not started" : "in error"));
                return false;
            }
            if (!connectRequested) {
                connectRequested = true;
                width = frameWidth;
                height = frameHeight;
                status = RtmpStatus.CONNECTING;
                int gen = generation;
                String url = publishUrl;
                worker.execute(() -> connect(gen, url, frameWidth, frameHeight));
            }
            if (frameWidth != width || frameHeight != height) {
                warnDimensionChange(frameWidth, frameHeight);
                countDrop("dimension change");
                return false;
            }
            RawVideoFrame copy = new RawVideoFrame(frameWidth, frameHeight, buffer.clone(), timestampUs * 1_000L);
            if (status == RtmpStatus.CONNECTING) {
                holdPending(copy);
            } else {
                long ts = smoother.next();
                int gen = generation;
                worker.execute(() -> publishFrame(gen, copy, ts));
            }
        }
        return true;
    }

    private void holdPending(RawVideoFrame copy) {
        if (props.getPendingFramePolicy() == PendingFramePolicy.DROP) {
            countDrop("not yet connected");
            return;
        }
        pending.addLast(copy);
        while (pending.size() > props.getPendingFrameCapacity()) {
            pending.pollFirst();
            countDrop("pending buffer full");
        }
    }

    private void connect(int gen, String url, int frameWidth, int frameHeight) {
        Listener connecting;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            connecting = listener;
        }
        LOG.info("First frame {}x{} received, connecting", frameWidth, frameHeight);
        connecting.onStatusChanged(RtmpStatus.CONNECTING);
        connectAttempts.incrementAndGet();
        long startNanos = System.nanoTime();
        VideoPublisher created;
        try {
            created = publisherFactory.create(url, frameWidth, frameHeight);
            publisher = created;
            created.start();
        } catch (TransportException e) {
            fail(gen, e);
            return;
        } catch (RuntimeException e) {
            fail(gen, TransportExceptionBuilder.create("RTMP publisher could not be started")
                    .endpoint(url)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(startNanos))
                    .build());
            return;
        }

        List<RawVideoFrame> backlog;
        long[] stamps;
        Listener current;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            status = RtmpStatus.STREAMING;
            backlog = new ArrayList<>(pending);
            pending.clear();
            // stamped before any frame fed after this block can take a timestamp
            stamps = new long[backlog.size()];
            for (int i = 0; i < stamps.length; i++) {
                stamps[i] = smoother.next();
            }
            current = listener;
        }
        stats.markConnected();
        LOG.info("RTMP streaming {}x{} after {}ms, flushing {} pending frame(s)",
                frameWidth, frameHeight, TimeUtils.elapsedMillis(startNanos), backlog.size());
        current.onStatusChanged(RtmpStatus.STREAMING);

        for (int i = 0; i < backlog.size(); i++) {
            publishFrame(gen, backlog.get(i), stamps[i]);
        }
    }

    private void publishFrame(int gen, RawVideoFrame frame, long timestampMicros) {
        VideoPublisher target = publisher;
        Listener current;
        synchronized (lock) {
            if (gen != generation || status != RtmpStatus.STREAMING || target == null) {
                return;
            }
            current = listener;
        }
        try {
            target.publish(frame.buffer(), frame.width(), frame.height(), timestampMicros);
            stats.record(frame.buffer().length);
            current.onFramePublished(frame.buffer().length);
        } catch (EncodeException e) {
            LOG.warn("Video frame dropped by encoder: {}", e.getMessage());
            current.onEncodeWarning(e);
        } catch (TransportException e) {
            fail(gen, e);
        }
    }

    private void fail(int gen, TransportException error) {
        Listener current;
        synchronized (lock) {
            if (gen != generation || status == RtmpStatus.ERROR || status == RtmpStatus.IDLE) {
                return;
            }
            status = RtmpStatus.ERROR;
            pending.clear();
            current = listener;
        }
        LOG.error("RTMP transport failed: {}", error.getMessage());
        current.onStatusChanged(RtmpStatus.ERROR);
        current.onTransportError(error);
    }

    /**
     * Stops publishing and closes the connection. Safe from any status, idempotent, and bounded
     * by {@code stop-timeout-ms}. Statistics are reset.
     */
    public void stop() {
        stop(Duration.ofMillis(props.getStopTimeoutMs()));
    }

    /**
     * Like {@link #stop()}, but waits for the publisher no longer than {@code budget} when that
     * is shorter than {@code stop-timeout-ms}.
     */
    public void stop(Duration budget) {
        long waitMs = Math.max(0L, Math.min(props.getStopTimeoutMs(), budget.toMillis()));
        ThreadPoolExecutor executor;
        Listener current;
        synchronized (lock) {
            executor = worker;
            current = listener;
            worker = null;
            generation++;
            status = RtmpStatus.IDLE;
            pending.clear();
            connectRequested = false;
            if (executor != null) {
                executor.getQueue().clear();
                executor.execute(this::closePublisher);
                executor.shutdown();
            }
        }
        stats.reset();
        if (executor == null) {
            return;
        }

        long startNanos = System.nanoTime();
        boolean closed;
        try {
            closed = executor.awaitTermination(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closed = false;
        }
        if (!closed) {
            LOG.warn("RTMP publisher did not close within {}ms; force-releasing", waitMs);
            executor.shutdownNow();
            forceReleaseInBackground();
        }
        long dropped = droppedFrames.get();
        LOG.info("RTMP session stopped in {}ms ({} frame(s) dropped this run)",
                TimeUtils.elapsedMillis(startNanos), dropped);
        if (current != null) {
            current.onStatusChanged(RtmpStatus.IDLE);
        }
    }

    private void closePublisher() {
        VideoPublisher target = publisher;
        if (target != null) {
            target.stop();
        }
        publisher = null;
    }

    private void forceReleaseInBackground() {
        VideoPublisher target = publisher;
        publisher = null;
        if (target == null) {
            return;
        }
        Thread releaser = new Thread(target::forceRelease, "rtmp-force-release");
        releaser.setDaemon(true);
        releaser.start();
    }

    private void countDrop(String reason) {
        long total = droppedFrames.incrementAndGet();
        long now = System.nanoTime();
        long last = lastDropLogNanos;
        if (last == 0 || now - last >= StreamTimeouts.DROPPED_FRAME_LOG_INTERVAL.toNanos()) {
            lastDropLogNanos = now;
            long sinceLast = total - droppedAtLastLog;
            droppedAtLastLog = total;
            LOG.warn("Dropped {} video frame(s) since last report, {} total (latest reason: {})",
                    sinceLast, total, reason);
        }
    }

    private void warnBufferMismatch(int actualLength, int frameWidth, int frameHeight) {
        synchronized (lock) {
            if (sizeMismatchWarned) {
                return;
            }
            sizeMismatchWarned = true;
        }
        LOG.warn("Frame buffer of {} bytes does not match {}x{} I420 ({} bytes); dropping such frames",
                actualLength, frameWidth, frameHeight, RawVideoFrame.i420Size(frameWidth, frameHeight));
    }

    // caller holds lock
    private void warnDimensionChange(int frameWidth, int frameHeight) {
        if (!sizeMismatchWarned) {
            sizeMismatchWarned = true;
            LOG.warn("Frame size changed to {}x{} after connecting at {}x{}; dropping such frames",
                    frameWidth, frameHeight, width, height);
        }
    }

    public RtmpStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public StreamingStats recomputeStats() {
        return stats.recompute();
    }

    /** Number of times a publisher was created and started since construction. */
    public long connectAttempts() {
        return connectAttempts.get();
    }

    /** Frames dropped since the last {@link #start(Listener)}. */
    public long droppedFrames() {
        return droppedFrames.get();
    }

    /** Dimensions fixed by the first frame, or {@code 0x0} before it arrives. */
    public int negotiatedWidth() {
        synchronized (lock) {
            return width;
        }
    }

    public int negotiatedHeight() {
        synchronized (lock) {
            return height;
        }
    }
}
