package com.phillippitts.glasscast.exception;

import com.phillippitts.glasscast.util.LogSanitizer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing TransportException with rich contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw TransportExceptionBuilder.create("RTMP connect failed")
 *         .endpoint(url)
 *         .cause(exception)
 *         .durationMs(1500)
 *         .metadata("width", width)
 *         .build();
 * </pre>
 *
 * <p>The endpoint is passed through {@link LogSanitizer#redactCredentials(String)} so tokens and
 * stream keys never reach exception messages.
 */
public final class TransportExceptionBuilder {

    private final String message;
    private String endpoint;
    private Throwable cause;
    private Integer closeCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TransportExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TransportExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TransportExceptionBuilder(message);
    }

    public TransportExceptionBuilder endpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public TransportExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the WebSocket close code reported by the peer.
     *
     * @param closeCode RFC 6455 close code
     * @return this builder for chaining
     */
    public TransportExceptionBuilder closeCode(int closeCode) {
        this.closeCode = closeCode;
        return this;
    }

    public TransportExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TransportExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the TransportException.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (closeCode={code}, durationMs={ms}, {key1}={val1}, ...) (endpoint: {endpoint})
     * </pre>
     *
     * @return constructed TransportException
     */
    public TransportException build() {
        String detailedMessage = buildDetailedMessage();
        String safeEndpoint = endpoint != null ? LogSanitizer.redactCredentials(endpoint) : "unknown";

        if (cause != null) {
            return new TransportException(detailedMessage, safeEndpoint, cause);
        }
        return new TransportException(detailedMessage, safeEndpoint);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = closeCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (closeCode != null) {
            sb.append("closeCode=").append(closeCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        sb.append(')');
        return sb.toString();
    }
}
