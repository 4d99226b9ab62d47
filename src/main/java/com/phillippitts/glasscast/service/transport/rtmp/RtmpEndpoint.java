package com.phillippitts.glasscast.service.transport.rtmp;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * An RTMP ingest address split into its server/app part and its stream key.
 *
 * <p>{@code rtmp://host[:port]/app[/more]/key} parses to server {@code rtmp://host:port/app[/more]}
 * and key {@code key}. With a single path segment it is taken as the key under app {@code live};
 * with none the key is {@code stream}. The port defaults to 1935 ({@code rtmp}) or 443 ({@code rtmps}).
 */
public record RtmpEndpoint(String serverUrl, String streamKey) {

    public static final int DEFAULT_RTMP_PORT = 1935;
    public static final int DEFAULT_RTMPS_PORT = 443;
    public static final String DEFAULT_APP = "live";
    public static final String DEFAULT_STREAM_KEY = "stream";

    /**
     * @throws IllegalArgumentException if the URL is not a valid rtmp:// or rtmps:// URL
     */
    public static RtmpEndpoint parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("RTMP URL must not be blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid RTMP URL: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (!isRtmpScheme(scheme)) {
            throw new IllegalArgumentException("RTMP URL must start with rtmp:// or rtmps://");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("RTMP URL has no host");
        }
        int port = uri.getPort() > 0 ? uri.getPort()
                : ("rtmps".equalsIgnoreCase(scheme) ? DEFAULT_RTMPS_PORT : DEFAULT_RTMP_PORT);
        String authority = scheme.toLowerCase() + "://" + uri.getHost() + ":" + port;

        List<String> segments = new ArrayList<>();
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        if (segments.size() < 2) {
            String key = segments.isEmpty() ? DEFAULT_STREAM_KEY : segments.get(0);
            return new RtmpEndpoint(authority + "/" + DEFAULT_APP, key);
        }
        String app = String.join("/", segments.subList(0, segments.size() - 1));
        return new RtmpEndpoint(authority + "/" + app, segments.get(segments.size() - 1));
    }

    /**
     * Joins a base URL and stream key with exactly one slash; both are trimmed. A blank key
     * returns the trimmed base URL, a blank base URL returns an empty string.
     */
    public static String buildFullUrl(String baseUrl, String streamKey) {
        String url = baseUrl == null ? "" : baseUrl.trim();
        String key = streamKey == null ? "" : streamKey.trim();
        if (url.isEmpty()) {
            return "";
        }
        if (!key.isEmpty()) {
            if (!url.endsWith("/")) {
                url += "/";
            }
            url += key;
        }
        return url;
    }

    public static boolean isRtmpScheme(String scheme) {
        return "rtmp".equalsIgnoreCase(scheme) || "rtmps".equalsIgnoreCase(scheme);
    }

    /** Full publish URL: server URL followed by the stream key. */
    public String publishUrl() {
        return buildFullUrl(serverUrl, streamKey);
    }
}
