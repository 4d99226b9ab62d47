package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.exception.SourceErrorKind;

import java.time.Instant;
import java.util.Objects;

/**
 * One transition on a source session's state stream. {@code errorKind} and {@code detail} are
 * set only for {@link SourceState#ERROR}.
 */
public record SourceStateEvent(SourceState state, SourceErrorKind errorKind, String detail, Instant at) {

    public SourceStateEvent {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }

    public static SourceStateEvent of(SourceState state) {
        return new SourceStateEvent(state, null, null, Instant.now());
    }

    public static SourceStateEvent error(SourceErrorKind kind, String detail) {
        return new SourceStateEvent(SourceState.ERROR, kind, detail, Instant.now());
    }

    /** User-facing reason for an error event, or the state name otherwise. */
    public String describe() {
        if (state != SourceState.ERROR) {
            return state.name();
        }
        SourceErrorKind kind = errorKind != null ? errorKind : SourceErrorKind.INTERNAL_ERROR;
        return detail == null || detail.isBlank() ? kind.userMessage() : kind.userMessage() + " (" + detail + ")";
    }
}
