package com.phillippitts.glasscast.service.transport;

import com.phillippitts.glasscast.domain.StreamingStats;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Counters owned by one transport session, folded into a {@link StreamingStats} snapshot each
 * time {@link #recompute()} runs (once per second from the session controller).
 *
 * <p>{@link #record(long)} is lock-free and safe from the producer thread.
 */
public class StreamingStatsTracker {

    private final LongSupplier nanoClock;
    private final AtomicLong units = new AtomicLong();
    private final AtomicLong bytes = new AtomicLong();

    private volatile long connectedAtNanos = -1;
    private volatile StreamingStats snapshot = StreamingStats.ZERO;
    private long unitsAtLastTick;
    private long lastTickNanos;

    public StreamingStatsTracker() {
        this(System::nanoTime);
    }

    public StreamingStatsTracker(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.lastTickNanos = nanoClock.getAsLong();
    }

    /** Starts the connection clock and the fps window. */
    public synchronized void markConnected() {
        long now = nanoClock.getAsLong();
        connectedAtNanos = now;
        lastTickNanos = now;
        unitsAtLastTick = units.get();
    }

    /** Counts one frame or chunk of the given size. */
    public void record(long byteCount) {
        units.incrementAndGet();
        bytes.addAndGet(byteCount);
    }

    public synchronized StreamingStats recompute() {
        long now = nanoClock.getAsLong();
        long sent = units.get();
        long elapsed = now - lastTickNanos;
        double fps = elapsed > 0 ? (sent - unitsAtLastTick) * 1_000_000_000.0 / elapsed : 0.0;
        long connectedAt = connectedAtNanos;
        Duration connection = connectedAt < 0 ? Duration.ZERO : Duration.ofNanos(now - connectedAt);

        unitsAtLastTick = sent;
        lastTickNanos = now;
        snapshot = new StreamingStats(sent, bytes.get(), fps, connection);
        return snapshot;
    }

    /** Last computed snapshot. */
    public StreamingStats snapshot() {
        return snapshot;
    }

    public synchronized void reset() {
        units.set(0);
        bytes.set(0);
        connectedAtNanos = -1;
        unitsAtLastTick = 0;
        lastTickNanos = nanoClock.getAsLong();
        snapshot = StreamingStats.ZERO;
    }
}
