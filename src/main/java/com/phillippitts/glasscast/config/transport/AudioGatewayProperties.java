package com.phillippitts.glasscast.config.transport;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the audio WebSocket gateway.
 */
@Validated
@ConfigurationProperties(prefix = "stream.audio-gateway")
public class AudioGatewayProperties {

    /** Gateway endpoint, {@code ws://} or {@code wss://}. Audio sessions fail to start without it. */
    @Pattern(regexp = "^wss?://.+", message = "must be a ws:// or wss:// URL")
    private final String url;

    /** Bearer token; appended as the {@code token} query parameter unless sent as a header. */
    private final String token;

    /** Send the token as {@code Authorization: Bearer} instead of a query parameter. */
    private final boolean tokenInHeader;

    @Min(100)
    @Max(60_000)
    private final int connectTimeoutMs;

    /** Bound on waiting for the close handshake before the socket is cancelled. */
    @Min(50)
    @Max(10_000)
    private final int closeTimeoutMs;

    @Min(0)
    @Max(300)
    private final int pingIntervalSeconds;

    @ConstructorBinding
    public AudioGatewayProperties(String url,
                                  String token,
                                  Boolean tokenInHeader,
                                  Integer connectTimeoutMs,
                                  Integer closeTimeoutMs,
                                  Integer pingIntervalSeconds) {
        this.url = (url == null || url.isBlank()) ? null : url.trim();
        this.token = (token == null || token.isBlank()) ? null : token.trim();
        this.tokenInHeader = tokenInHeader != null && tokenInHeader;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
        this.closeTimeoutMs = closeTimeoutMs == null ? 500 : closeTimeoutMs;
        this.pingIntervalSeconds = pingIntervalSeconds == null ? 20 : pingIntervalSeconds;
    }

    public String getUrl() { return url; }
    public String getToken() { return token; }
    public boolean isTokenInHeader() { return tokenInHeader; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getCloseTimeoutMs() { return closeTimeoutMs; }
    public int getPingIntervalSeconds() { return pingIntervalSeconds; }
}
