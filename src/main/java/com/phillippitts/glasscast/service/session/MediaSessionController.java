package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.config.session.SessionProperties;
import com.phillippitts.glasscast.domain.MediaSessionState;
import com.phillippitts.glasscast.domain.StreamingMode;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.service.metrics.StreamingMetrics;
import com.phillippitts.glasscast.service.session.event.EncodeWarningEvent;
import com.phillippitts.glasscast.service.session.event.MediaSessionStateChangedEvent;
import com.phillippitts.glasscast.service.session.event.PreviewFrameEvent;
import com.phillippitts.glasscast.service.session.event.StreamingStatsEvent;
import com.phillippitts.glasscast.service.source.FrameSource;
import com.phillippitts.glasscast.service.source.SourceConfig;
import com.phillippitts.glasscast.service.source.SourceSession;
import com.phillippitts.glasscast.service.source.SourceStateEvent;
import com.phillippitts.glasscast.service.source.Subscription;
import com.phillippitts.glasscast.util.StreamTimeouts;
import com.phillippitts.glasscast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Coordinates one frame source session with one streaming pipeline.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE | STOPPED | ERROR → STARTING (start)
 * STARTING → STREAMING (source streaming, or at once for pipelines that stream on start)
 * STARTING | STREAMING → STOPPING (stop, source stopped, time limit, source or transport error)
 * STOPPING → STOPPED | ERROR(reason)
 * </pre>
 *
 * <p><b>Single writer:</b> every transition runs on one control-loop thread. Source state
 * callbacks and pipeline failure reports are queued onto that loop; nothing else mutates the
 * session state. Callbacks from a previous run are recognised by their run id and ignored.
 *
 * <p><b>Teardown order</b> is fixed: the frame forwarder is cancelled (and in-flight frames
 * drained), then the pipeline's transport is stopped, then the source session is closed. Each
 * step is isolated so a failing step never skips the next one; an error ending still runs all
 * three. Statistics are reset to zero afterwards.
 *
 * <p>The control loop also publishes a {@link StreamingStatsEvent} every
 * {@code stream.session.stats-interval-ms} while the session is active.
 */
public class MediaSessionController {

    private static final Logger LOG = LogManager.getLogger(MediaSessionController.class);

    private static final String MDC_SESSION_ID = "sessionId";

    private final String id;
    private final StreamingMode mode;
    private final FrameSource source;
    private final StreamingPipeline pipeline;
    private final SessionProperties props;
    private final ApplicationEventPublisher publisher;
    private final StreamingMetrics metrics;

    private final SessionStateMachine stateMachine = new SessionStateMachine();
    private final ScheduledExecutorService loop;
    private volatile Thread loopThread;

    // Owned by the control loop
    private SourceSession sourceSession;
    private Subscription stateSubscription;
    private Subscription frameSubscription;
    private FrameForwarder forwarder;
    private ScheduledFuture<?> statsTick;
    private ScheduledFuture<?> timeLimit;

    private volatile StreamingStats stats = StreamingStats.ZERO;

    public MediaSessionController(StreamingMode mode,
                                  FrameSource source,
                                  StreamingPipeline pipeline,
                                  SessionProperties props,
                                  ApplicationEventPublisher publisher,
                                  StreamingMetrics metrics) {
        this.id = UUID.randomUUID().toString();
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-control-" + id.substring(0, 8));
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    /**
     * Starts a session. A no-op unless the state is IDLE, STOPPED or ERROR.
     *
     * <p>Returns once the start sequence has run; the session is then STARTING, STREAMING, or
     * ERROR if the source or the transport could not be started.
     */
    public MediaSessionState start() {
        runOnLoop(this::doStart, controlTimeout());
        return getState();
    }

    /**
     * Stops the current session. Safe from any state and idempotent; from IDLE it does nothing.
     *
     * <p>The teardown shares one budget of {@code stop-timeout-ms}: the in-flight frame drain and
     * the transport close are cut short to leave room for closing the source. From outside the
     * control loop this waits at most {@code stop-timeout-ms} plus a fixed margin.
     */
    public MediaSessionState stop() {
        runOnLoop(() -> {
            UUID run = stateMachine.getActiveRun();
            if (run != null) {
                teardown(run, MediaSessionState.STOPPED, "stop requested");
            }
        }, controlTimeout());
        return getState();
    }

    /** Stops the session and terminates the control loop. The controller cannot be reused. */
    public void shutdown() {
        if (loop.isShutdown()) {
            return;
        }
        stop();
        loop.shutdown();
        try {
            if (!loop.awaitTermination(controlTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Control loop of session {} did not terminate in time", id);
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }
    }

    private void doStart() {
        MediaSessionState previous = stateMachine.getState();
        UUID run = stateMachine.tryStart();
        if (run == null) {
            LOG.debug("start() ignored in state {}", previous);
            return;
        }
        LOG.info("Starting {} session with source '{}' ({} @ {} fps)",
                mode, source.name(), props.getVideoQuality(), props.getFrameRate());
        announce(previous, MediaSessionState.STARTING);

        try {
            sourceSession = source.startSession(new SourceConfig(props.getVideoQuality(), props.getFrameRate()));
            stateSubscription = sourceSession.subscribeState(event -> submit(() -> onSourceState(run, event)));
            pipeline.start(new PipelineCallbacks(run));
            forwarder = new FrameForwarder(pipeline);
            frameSubscription = sourceSession.subscribeFrames(forwarder);
        } catch (RuntimeException e) {
            LOG.error("Session failed to start: {}", e.getMessage());
            teardown(run, MediaSessionState.error(describe(e)), "start failed");
            return;
        }

        if (pipeline.streamsOnStart()) {
            markStreaming(run);
        }
        long intervalMs = props.getStatsIntervalMs();
        statsTick = loop.scheduleAtFixedRate(withSessionContext(() -> tick(run)), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        if (props.getTimeLimitSeconds() > 0) {
            timeLimit = loop.schedule(withSessionContext(() -> onTimeLimit(run)), props.getTimeLimitSeconds(), TimeUnit.SECONDS);
        }
    }

    private void onSourceState(UUID run, SourceStateEvent event) {
        if (!stateMachine.isRunActive(run)) {
            LOG.debug("Ignoring source state {} from a finished run", event.state());
            return;
        }
        switch (event.state()) {
            case STARTING -> LOG.debug("Source is starting");
            case STREAMING -> markStreaming(run);
            case STOPPED -> {
                LOG.info("Source stopped on its own; tearing down session");
                teardown(run, MediaSessionState.STOPPED, "source stopped");
            }
            case ERROR -> {
                LOG.error("Source failed: {}", event.describe());
                teardown(run, MediaSessionState.error(event.describe()), "source error");
            }
            default -> throw new IllegalStateException("Unknown source state: " + event.state());
        }
    }

    private void onTransportFailure(UUID run, TransportException error) {
        if (!stateMachine.isRunActive(run)) {
            return;
        }
        metrics.transportFailure(pipeline.name());
        teardown(run, MediaSessionState.error(describe(error)), "transport failure");
    }

    private void onTimeLimit(UUID run) {
        if (stateMachine.isRunActive(run)) {
            LOG.info("Time limit of {}s reached", props.getTimeLimitSeconds());
            teardown(run, MediaSessionState.STOPPED, "time limit");
        }
    }

    private void markStreaming(UUID run) {
        if (stateMachine.markStreaming(run)) {
            LOG.info("Session streaming via {}", pipeline.name());
            announce(MediaSessionState.STARTING, MediaSessionState.STREAMING);
        }
    }

    private void tick(UUID run) {
        if (!stateMachine.isRunActive(run)) {
            return;
        }
        stats = pipeline.recomputeStats();
        publisher.publishEvent(new StreamingStatsEvent(id, stats, Instant.now()));
    }

    /**
     * Runs the fixed teardown sequence and settles in {@code terminal}.
     * Only the first teardown of a run does anything.
     */
    private void teardown(UUID run, MediaSessionState terminal, String cause) {
        MediaSessionState previous = stateMachine.getState();
        if (!stateMachine.beginStop(run)) {
            return;
        }
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(props.getStopTimeoutMs());
        LOG.info("Stopping session ({})", cause);
        announce(previous, MediaSessionState.STOPPING);
        cancelTimers();

        // 1. stop feeding frames
        Duration drain = min(StreamTimeouts.FORWARDER_DRAIN_TIMEOUT, remaining(deadlineNanos));
        if (forwarder != null && !forwarder.cancel(drain)) {
            LOG.warn("In-flight frame did not drain within {}ms", drain.toMillis());
        }
        cancelQuietly(frameSubscription, "frame subscription");

        // 2. stop the transport
        Duration transportBudget = max(StreamTimeouts.MIN_TRANSPORT_STOP_BUDGET,
                remaining(deadlineNanos).minus(StreamTimeouts.SOURCE_CLOSE_RESERVE));
        try {
            pipeline.stop(transportBudget);
        } catch (RuntimeException e) {
            LOG.error("Pipeline {} failed to stop cleanly", pipeline.name(), e);
        }

        // 3. close the source session
        cancelQuietly(stateSubscription, "state subscription");
        if (sourceSession != null) {
            try {
                sourceSession.close();
            } catch (RuntimeException e) {
                LOG.error("Source session failed to close cleanly", e);
            }
        }
        sourceSession = null;
        stateSubscription = null;
        frameSubscription = null;
        forwarder = null;

        stats = StreamingStats.ZERO;
        publisher.publishEvent(new StreamingStatsEvent(id, StreamingStats.ZERO, Instant.now()));
        stateMachine.finish(run, terminal);
        metrics.stopLatency(System.nanoTime() - startNanos);
        LOG.info("Session ended in {} after {}ms", terminal, TimeUtils.elapsedMillis(startNanos));
        announce(MediaSessionState.STOPPING, terminal);
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private void cancelTimers() {
        if (statsTick != null) {
            statsTick.cancel(false);
            statsTick = null;
        }
        if (timeLimit != null) {
            timeLimit.cancel(false);
            timeLimit = null;
        }
    }

    private static void cancelQuietly(Subscription subscription, String what) {
        if (subscription == null) {
            return;
        }
        try {
            subscription.cancel();
        } catch (RuntimeException e) {
            LOG.warn("Failed to cancel {}: {}", what, e.getMessage());
        }
    }

    private void announce(MediaSessionState previous, MediaSessionState current) {
        metrics.sessionTransition(current);
        publisher.publishEvent(new MediaSessionStateChangedEvent(id, mode, previous, current, Instant.now()));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private Duration controlTimeout() {
        return Duration.ofMillis(props.getStopTimeoutMs()).plus(StreamTimeouts.CONTROL_LOOP_MARGIN);
    }

    private void submit(Runnable task) {
        try {
            loop.execute(withSessionContext(task));
        } catch (RejectedExecutionException e) {
            LOG.debug("Control loop of session {} is shut down; dropping callback", id);
        }
    }

    private void runOnLoop(Runnable task, Duration timeout) {
        if (Thread.currentThread() == loopThread) {
            task.run();
            return;
        }
        Future<?> result;
        try {
            result = loop.submit(withSessionContext(task));
        } catch (RejectedExecutionException e) {
            LOG.debug("Control loop of session {} is shut down", id);
            return;
        }
        try {
            result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Session {} control operation still running after {}ms; continuing in background",
                    id, timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Session control operation failed", cause);
        }
    }

    private Runnable withSessionContext(Runnable task) {
        return () -> {
            ThreadContext.put(MDC_SESSION_ID, id);
            try {
                task.run();
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        };
    }

    public String getId() {
        return id;
    }

    public StreamingMode getMode() {
        return mode;
    }

    public MediaSessionState getState() {
        return stateMachine.getState();
    }

    /** Last statistics snapshot; zero while not streaming. */
    public StreamingStats getStats() {
        return stats;
    }

    private final class PipelineCallbacks implements StreamingPipeline.Listener {

        private final UUID run;

        PipelineCallbacks(UUID run) {
            this.run = run;
        }

        @Override
        public void onTransportFailure(TransportException error) {
            submit(() -> MediaSessionController.this.onTransportFailure(run, error));
        }

        @Override
        public void onEncodeWarning(EncodeException warning) {
            metrics.encodeWarning(warning.getCodec());
            publisher.publishEvent(new EncodeWarningEvent(id, warning.getCodec(), warning.getMessage(), Instant.now()));
        }

        @Override
        public void onPreviewFrame(int width, int height, byte[] jpeg) {
            publisher.publishEvent(new PreviewFrameEvent(id, width, height, jpeg));
        }
    }
}
