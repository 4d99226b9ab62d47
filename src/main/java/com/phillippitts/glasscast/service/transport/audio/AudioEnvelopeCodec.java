package com.phillippitts.glasscast.service.transport.audio;

import com.phillippitts.glasscast.domain.AdtsFrame;
import com.phillippitts.glasscast.domain.AudioPayload;
import com.phillippitts.glasscast.domain.TransportEnvelope;
import com.phillippitts.glasscast.service.audio.AacFormat;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes audio chunks into the gateway's JSON envelope:
 * <pre>
 * {"message_type": "audio", "payload": {"timestamp": ..., "chunk_index": ..., "codec": "AAC",
 *  "sample_rate": ..., "channels": ..., "data": base64(ADTS frame), "size": ...}}
 * </pre>
 * String values have embedded CR/LF stripped before encoding.
 */
public final class AudioEnvelopeCodec {

    public static final String AUDIO_MESSAGE_TYPE = "audio";

    static final String MESSAGE_TYPE = "message_type";
    static final String PAYLOAD = "payload";
    static final String TIMESTAMP = "timestamp";
    static final String CHUNK_INDEX = "chunk_index";
    static final String CODEC = "codec";
    static final String SAMPLE_RATE = "sample_rate";
    static final String CHANNELS = "channels";
    static final String DATA = "data";
    static final String SIZE = "size";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private AudioEnvelopeCodec() {
        // Utility class - prevent instantiation
    }

    public static TransportEnvelope audioEnvelope(AdtsFrame frame, long chunkIndex, Instant at) {
        Objects.requireNonNull(frame, "frame must not be null");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TIMESTAMP, TIMESTAMP_FORMAT.format(at));
        payload.put(CHUNK_INDEX, chunkIndex);
        payload.put(CODEC, AacFormat.CODEC_NAME);
        payload.put(SAMPLE_RATE, frame.sampleRate());
        payload.put(CHANNELS, frame.channelCount());
        payload.put(DATA, Base64.getEncoder().encodeToString(frame.bytes()));
        payload.put(SIZE, frame.length());
        return new TransportEnvelope(AUDIO_MESSAGE_TYPE, payload);
    }

    public static String toJson(TransportEnvelope envelope) {
        JSONObject payload = new JSONObject();
        for (Map.Entry<String, Object> entry : envelope.payload().entrySet()) {
            Object value = entry.getValue();
            payload.put(entry.getKey(), value instanceof String s ? stripNewlines(s) : value);
        }
        JSONObject root = new JSONObject();
        root.put(MESSAGE_TYPE, stripNewlines(envelope.messageType()));
        root.put(PAYLOAD, payload);
        return root.toString();
    }

    /**
     * Parses an {@code audio} envelope, as a receiving gateway would.
     *
     * @throws IllegalArgumentException if the text is not an audio envelope
     */
    public static AudioPayload parseAudio(String json) {
        try {
            JSONObject root = new JSONObject(json);
            String type = root.getString(MESSAGE_TYPE);
            if (!AUDIO_MESSAGE_TYPE.equals(type)) {
                throw new IllegalArgumentException("Not an audio envelope: message_type=" + type);
            }
            JSONObject p = root.getJSONObject(PAYLOAD);
            return new AudioPayload(
                    p.getString(TIMESTAMP),
                    p.getLong(CHUNK_INDEX),
                    p.getString(CODEC),
                    p.getInt(SAMPLE_RATE),
                    p.getInt(CHANNELS),
                    p.getString(DATA),
                    p.getInt(SIZE));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed audio envelope: " + e.getMessage(), e);
        }
    }

    static String stripNewlines(String value) {
        if (value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return value.replace("\r", "").replace("\n", "");
    }
}
