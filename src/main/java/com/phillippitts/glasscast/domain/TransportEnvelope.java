package com.phillippitts.glasscast.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wire unit sent over the audio WebSocket: a message type plus a flat payload object.
 */
public record TransportEnvelope(String messageType, Map<String, Object> payload) {

    public TransportEnvelope {
        Objects.requireNonNull(messageType, "messageType must not be null");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
