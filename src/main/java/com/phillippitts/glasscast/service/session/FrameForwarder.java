package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.service.source.MediaSink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Gate between a source's frame callbacks and a pipeline.
 *
 * <p>Forwards hold the read lock; {@link #cancel(Duration)} flips the gate and takes the write
 * lock, so once it returns {@code true} no forward is running and none will start.
 */
final class FrameForwarder implements MediaSink {

    private final MediaSink target;
    private final ReadWriteLock gate = new ReentrantReadWriteLock();
    private final AtomicLong forwarded = new AtomicLong();
    private volatile boolean cancelled;

    FrameForwarder(MediaSink target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public void onVideoFrame(RawVideoFrame frame) {
        if (cancelled || !gate.readLock().tryLock()) {
            return;
        }
        try {
            if (!cancelled) {
                target.onVideoFrame(frame);
                forwarded.incrementAndGet();
            }
        } finally {
            gate.readLock().unlock();
        }
    }

    @Override
    public void onAudioChunk(AudioChunk chunk) {
        if (cancelled || !gate.readLock().tryLock()) {
            return;
        }
        try {
            if (!cancelled) {
                target.onAudioChunk(chunk);
                forwarded.incrementAndGet();
            }
        } finally {
            gate.readLock().unlock();
        }
    }

    /**
     * Stops forwarding and waits for in-flight forwards to return.
     *
     * @return {@code true} if no forward is still running
     */
    boolean cancel(Duration drainTimeout) {
        cancelled = true;
        try {
            if (gate.writeLock().tryLock(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                gate.writeLock().unlock();
                return true;
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    boolean isCancelled() {
        return cancelled;
    }

    long forwardedCount() {
        return forwarded.get();
    }
}
