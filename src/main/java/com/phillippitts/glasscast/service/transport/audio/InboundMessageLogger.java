package com.phillippitts.glasscast.service.transport.audio;

import com.phillippitts.glasscast.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Logs inbound gateway messages at a level chosen from their {@code type} field.
 * Messages are never dispatched; the audio protocol is send-only from this side.
 */
final class InboundMessageLogger {

    private static final Logger LOG = LogManager.getLogger(InboundMessageLogger.class);
    private static final int PREVIEW_CHARS = 200;

    private InboundMessageLogger() {
    }

    static void log(String text) {
        String type;
        JSONObject json;
        try {
            json = new JSONObject(text);
            type = json.optString("type", json.optString(AudioEnvelopeCodec.MESSAGE_TYPE, ""));
        } catch (JSONException e) {
            LOG.info("Gateway sent non-JSON text: {}", LogSanitizer.truncate(text, PREVIEW_CHARS));
            return;
        }
        switch (type) {
            case "ack", "pong" -> LOG.debug("Gateway {}", type);
            case "error" -> LOG.warn("Gateway error: code={}, msg={}",
                    json.opt("code"), LogSanitizer.truncate(json.optString("msg"), PREVIEW_CHARS));
            default -> LOG.info("Gateway message: {}", LogSanitizer.truncate(text, PREVIEW_CHARS));
        }
    }
}
