package com.phillippitts.glasscast.exception;

/**
 * Thrown when a socket connect or write fails. The owning session moves to its error state;
 * reconnecting is left to the caller.
 */
public class TransportException extends GlassCastException {

    private final String endpoint;

    public TransportException(String message) {
        super(message);
        this.endpoint = "unknown";
    }

    public TransportException(String message, String endpoint) {
        super(message + " (endpoint: " + endpoint + ")");
        this.endpoint = endpoint;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.endpoint = "unknown";
    }

    public TransportException(String message, String endpoint, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    /** Endpoint with credentials already redacted. */
    public String getEndpoint() {
        return endpoint;
    }
}
