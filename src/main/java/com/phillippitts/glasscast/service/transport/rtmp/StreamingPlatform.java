package com.phillippitts.glasscast.service.transport.rtmp;

/**
 * Ingest presets for common live platforms. The stream key is appended to the base URL.
 */
public enum StreamingPlatform {
    CUSTOM("Custom", ""),
    YOUTUBE("YouTube Live", "rtmp://a.rtmp.youtube.com/live2"),
    TWITCH("Twitch", "rtmp://live.twitch.tv/app"),
    BILIBILI("Bilibili", "rtmp://live-push.bilivideo.com/live-bvc"),
    DOUYIN("Douyin", "rtmp://push-rtmp-l6.douyincdn.com/third"),
    TIKTOK("TikTok", "rtmp://push.tiktokv.com/live"),
    FACEBOOK("Facebook Live", "rtmps://live-api-s.facebook.com:443/rtmp");

    private final String displayName;
    private final String baseUrl;

    StreamingPlatform(String displayName, String baseUrl) {
        this.displayName = displayName;
        this.baseUrl = baseUrl;
    }

    public String displayName() {
        return displayName;
    }

    /** Ingest base URL, empty for {@link #CUSTOM}. */
    public String baseUrl() {
        return baseUrl;
    }
}
