package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.MediaSessionState;
import com.phillippitts.glasscast.domain.MediaSessionState.Phase;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for the media session lifecycle.
 *
 * <p>Each start opens a new run identified by a UUID. Transitions that belong to a run carry that
 * id, so callbacks from an earlier run are rejected instead of corrupting the current one.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE | STOPPED | ERROR → STARTING (tryStart)
 * STARTING → STREAMING (markStreaming)
 * STARTING | STREAMING → STOPPING (beginStop)
 * STOPPING → STOPPED | ERROR (finish)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a
 * {@link ReentrantLock} to protect state transitions. Only the session controller's control
 * loop calls the mutating methods; other threads may read.
 */
public final class SessionStateMachine {

    private final Lock lock = new ReentrantLock();
    private MediaSessionState state = MediaSessionState.IDLE;
    private UUID activeRun;

    /**
     * Opens a new run if the current state allows a start.
     *
     * @return id of the new run, or {@code null} if a run is already in progress
     */
    public UUID tryStart() {
        lock.lock();
        try {
            if (!state.canStart()) {
                return null;
            }
            activeRun = UUID.randomUUID();
            state = MediaSessionState.STARTING;
            return activeRun;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the run moved from STARTING to STREAMING
     */
    public boolean markStreaming(UUID runId) {
        lock.lock();
        try {
            if (!isCurrent(runId) || state.phase() != Phase.STARTING) {
                return false;
            }
            state = MediaSessionState.STREAMING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enters STOPPING. Only the first caller for a run wins.
     *
     * @return {@code true} if this call started the teardown
     */
    public boolean beginStop(UUID runId) {
        lock.lock();
        try {
            if (!isCurrent(runId) || !state.isActive()) {
                return false;
            }
            state = MediaSessionState.STOPPING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles a stopping run in its terminal state and closes the run.
     *
     * @param terminal {@link MediaSessionState#STOPPED} or an error state
     * @return {@code true} if the run was stopping and is now closed
     */
    public boolean finish(UUID runId, MediaSessionState terminal) {
        if (terminal.phase() != Phase.STOPPED && terminal.phase() != Phase.ERROR) {
            throw new IllegalArgumentException("terminal state must be STOPPED or ERROR: " + terminal);
        }
        lock.lock();
        try {
            if (!isCurrent(runId) || state.phase() != Phase.STOPPING) {
                return false;
            }
            state = terminal;
            activeRun = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public MediaSessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return id of the run in progress, or {@code null} when idle, stopped or in error
     */
    public UUID getActiveRun() {
        lock.lock();
        try {
            return activeRun;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunActive(UUID runId) {
        if (runId == null) {
            return false;
        }
        lock.lock();
        try {
            return isCurrent(runId);
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrent(UUID runId) {
        return runId != null && runId.equals(activeRun);
    }
}
