package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.exception.SourceErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Subscription bookkeeping and state emission shared by the bundled sources.
 */
public abstract class AbstractSourceSession implements SourceSession {

    private static final Logger LOG = LogManager.getLogger(AbstractSourceSession.class);

    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final String name;

    private volatile MediaSink sink;
    private volatile SourceStateListener stateListener;
    private volatile SourceStateEvent lastEvent = SourceStateEvent.of(SourceState.STARTING);

    protected AbstractSourceSession(String name) {
        this.name = name;
    }

    @Override
    public Subscription subscribeFrames(MediaSink newSink) {
        synchronized (lock) {
            if (sink != null) {
                throw new IllegalStateException("Source session " + name + " already has a frame subscriber");
            }
            sink = newSink;
        }
        return () -> {
            synchronized (lock) {
                if (sink == newSink) {
                    sink = null;
                }
            }
        };
    }

    @Override
    public Subscription subscribeState(SourceStateListener listener) {
        SourceStateEvent current;
        synchronized (lock) {
            if (stateListener != null) {
                throw new IllegalStateException("Source session " + name + " already has a state subscriber");
            }
            stateListener = listener;
            current = lastEvent;
        }
        listener.onStateChanged(current);
        return () -> {
            synchronized (lock) {
                if (stateListener == listener) {
                    stateListener = null;
                }
            }
        };
    }

    @Override
    public SourceState currentState() {
        return lastEvent.state();
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            doClose();
        } finally {
            emitState(SourceStateEvent.of(SourceState.STOPPED));
            LOG.info("Source session {} closed", name);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Releases the device; called once from {@link #close()}. */
    protected abstract void doClose();

    protected void emitVideo(RawVideoFrame frame) {
        MediaSink current = sink;
        if (current != null && !closed.get()) {
            current.onVideoFrame(frame);
        }
    }

    protected void emitAudio(AudioChunk chunk) {
        MediaSink current = sink;
        if (current != null && !closed.get()) {
            current.onAudioChunk(chunk);
        }
    }

    protected void emitState(SourceState state) {
        emitState(SourceStateEvent.of(state));
    }

    protected void emitError(SourceErrorKind kind, String detail) {
        emitState(SourceStateEvent.error(kind, detail));
    }

    private void emitState(SourceStateEvent event) {
        SourceStateListener listener;
        synchronized (lock) {
            SourceState previous = lastEvent.state();
            if (previous == SourceState.STOPPED || previous == SourceState.ERROR) {
                // terminal
                return;
            }
            lastEvent = event;
            listener = stateListener;
        }
        LOG.debug("Source session {} state -> {}", name, event.state());
        if (listener != null) {
            listener.onStateChanged(event);
        }
    }
}
