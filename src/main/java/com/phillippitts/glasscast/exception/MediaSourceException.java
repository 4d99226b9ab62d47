package com.phillippitts.glasscast.exception;

/**
 * Thrown when a frame source session fails to start or dies unexpectedly.
 * Always escalates to the session controller, which tears the session down.
 */
public class MediaSourceException extends GlassCastException {

    private final SourceErrorKind kind;

    public MediaSourceException(SourceErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MediaSourceException(SourceErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SourceErrorKind getKind() {
        return kind;
    }
}
