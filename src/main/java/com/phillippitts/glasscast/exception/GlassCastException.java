package com.phillippitts.glasscast.exception;

/**
 * Base exception for all glasscast application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class GlassCastException extends RuntimeException {

    public GlassCastException(String message) {
        super(message);
    }

    public GlassCastException(String message, Throwable cause) {
        super(message, cause);
    }

    public GlassCastException(Throwable cause) {
        super(cause);
    }
}
