package com.phillippitts.glasscast.service.transport.audio;

import okhttp3.Request;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the WebSocket upgrade request for the audio gateway, attaching the bearer token either
 * as a {@code token} query parameter or as an {@code Authorization} header.
 */
public final class GatewayEndpoint {

    private GatewayEndpoint() {
        // Utility class - prevent instantiation
    }

    public static Request buildRequest(String url, String token, boolean tokenInHeader) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("gateway url must not be blank");
        }
        if (token == null || token.isBlank()) {
            return new Request.Builder().url(url).build();
        }
        if (tokenInHeader) {
            return new Request.Builder()
                    .url(url)
                    .header("Authorization", "Bearer " + token)
                    .build();
        }
        return new Request.Builder().url(withToken(url, token)).build();
    }

    /**
     * Appends {@code token=<value>} unless the URL already carries a token parameter.
     */
    public static String withToken(String url, String token) {
        if (token == null || token.isBlank() || hasTokenParam(url)) {
            return url;
        }
        String encoded = URLEncoder.encode(token, StandardCharsets.UTF_8);
        char separator = url.indexOf('?') >= 0 ? '&' : '?';
        return url + separator + "token=" + encoded;
    }

    private static boolean hasTokenParam(String url) {
        int query = url.indexOf('?');
        if (query < 0) {
            return false;
        }
        for (String param : url.substring(query + 1).split("&")) {
            if (param.startsWith("token=")) {
                return true;
            }
        }
        return false;
    }
}
