package com.phillippitts.glasscast.domain;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Externally visible state of a media session. Only {@link Phase#ERROR} carries a reason.
 */
public record MediaSessionState(Phase phase, String reason) {

    public enum Phase {
        IDLE,
        STARTING,
        STREAMING,
        STOPPING,
        STOPPED,
        ERROR
    }

    public static final MediaSessionState IDLE = new MediaSessionState(Phase.IDLE, null);
    public static final MediaSessionState STARTING = new MediaSessionState(Phase.STARTING, null);
    public static final MediaSessionState STREAMING = new MediaSessionState(Phase.STREAMING, null);
    public static final MediaSessionState STOPPING = new MediaSessionState(Phase.STOPPING, null);
    public static final MediaSessionState STOPPED = new MediaSessionState(Phase.STOPPED, null);

    private static final Set<Phase> STARTABLE = EnumSet.of(Phase.IDLE, Phase.STOPPED, Phase.ERROR);

    public MediaSessionState {
        Objects.requireNonNull(phase, "phase must not be null");
        if (phase != Phase.ERROR) {
            reason = null;
        }
    }

    public static MediaSessionState error(String reason) {
        return new MediaSessionState(Phase.ERROR, reason == null ? "unknown error" : reason);
    }

    /** {@code start()} is honoured only from these phases. */
    public boolean canStart() {
        return STARTABLE.contains(phase);
    }

    /** True while a source session and transport may be open. */
    public boolean isActive() {
        return phase == Phase.STARTING || phase == Phase.STREAMING;
    }

    @Override
    public String toString() {
        return phase == Phase.ERROR ? "ERROR(" + reason + ")" : phase.name();
    }
}
