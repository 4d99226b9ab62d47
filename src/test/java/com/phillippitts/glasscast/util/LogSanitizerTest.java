package com.phillippitts.glasscast.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate(null, 0)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(100);
    }

    @Test
    void masksTokenQueryParameter() {
        assertThat(LogSanitizer.redactCredentials("wss://gw.example/audio?token=s3cret"))
                .isEqualTo("wss://gw.example/audio?token=***");
        assertThat(LogSanitizer.redactCredentials("wss://gw.example/audio?device=g1&token=s3cret&v=2"))
                .isEqualTo("wss://gw.example/audio?device=g1&token=***&v=2");
    }

    @Test
    void masksRtmpStreamKey() {
        assertThat(LogSanitizer.redactCredentials("rtmp://a.rtmp.youtube.com/live2/abcd-efgh"))
                .isEqualTo("rtmp://a.rtmp.youtube.com/live2/***");
        assertThat(LogSanitizer.redactCredentials("rtmps://live-api-s.facebook.com:443/rtmp/FB-123"))
                .isEqualTo("rtmps://live-api-s.facebook.com:443/rtmp/***");
    }

    @Test
    void leavesRtmpUrlWithoutKeyAlone() {
        assertThat(LogSanitizer.redactCredentials("rtmp://localhost:1935/live"))
                .isEqualTo("rtmp://localhost:1935/live");
        assertThat(LogSanitizer.redactCredentials("rtmp://localhost/live/"))
                .isEqualTo("rtmp://localhost/live/");
    }

    @Test
    void leavesUrlsWithoutSecretsAlone() {
        assertThat(LogSanitizer.redactCredentials("ws://gw.example/audio")).isEqualTo("ws://gw.example/audio");
        assertThat(LogSanitizer.redactCredentials(null)).isEmpty();
    }
}
