package com.phillippitts.glasscast.util;

import java.util.regex.Pattern;

/** Utility for privacy-safe logging of endpoints and message previews. */
public final class LogSanitizer {

    private static final Pattern TOKEN_PARAM = Pattern.compile("([?&]token=)[^&#]*");
    private static final String MASK = "***";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks secrets embedded in an endpoint URL: the {@code token} query parameter of gateway
     * URLs and the stream key (last path segment) of RTMP URLs with an app segment.
     */
    public static String redactCredentials(String url) {
        if (url == null) {
            return "";
        }
        String masked = TOKEN_PARAM.matcher(url).replaceAll("$1" + MASK);
        if (masked.startsWith("rtmp://") || masked.startsWith("rtmps://")) {
            int pathStart = masked.indexOf('/', masked.indexOf("://") + 3);
            int lastSlash = masked.lastIndexOf('/');
            if (pathStart > 0 && lastSlash > pathStart && lastSlash < masked.length() - 1) {
                return masked.substring(0, lastSlash + 1) + MASK;
            }
        }
        return masked;
    }
}
