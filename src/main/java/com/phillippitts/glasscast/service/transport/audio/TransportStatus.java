package com.phillippitts.glasscast.service.transport.audio;

/**
 * Connection status of the audio gateway socket.
 */
public enum TransportStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR;

    /** Whether outgoing chunks are accepted in this status. */
    public boolean acceptsSends() {
        return this == CONNECTING || this == CONNECTED;
    }
}
