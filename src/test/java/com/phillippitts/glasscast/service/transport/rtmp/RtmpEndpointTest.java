package com.phillippitts.glasscast.service.transport.rtmp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RtmpEndpointTest {

    @Test
    void splitsAppAndStreamKey() {
        RtmpEndpoint endpoint = RtmpEndpoint.parse("rtmp://live.twitch.tv/app/key123");

        assertThat(endpoint.serverUrl()).isEqualTo("rtmp://live.twitch.tv:1935/app");
        assertThat(endpoint.streamKey()).isEqualTo("key123");
        assertThat(endpoint.publishUrl()).isEqualTo("rtmp://live.twitch.tv:1935/app/key123");
    }

    @Test
    void keepsExplicitPortAndNestedApp() {
        RtmpEndpoint endpoint = RtmpEndpoint.parse("rtmp://ingest.local:19350/a/b/key");

        assertThat(endpoint.serverUrl()).isEqualTo("rtmp://ingest.local:19350/a/b");
        assertThat(endpoint.streamKey()).isEqualTo("key");
    }

    @Test
    void rtmpsDefaultsToPort443() {
        RtmpEndpoint endpoint = RtmpEndpoint.parse("rtmps://live-api-s.facebook.com/rtmp/FB-1");

        assertThat(endpoint.serverUrl()).isEqualTo("rtmps://live-api-s.facebook.com:443/rtmp");
    }

    @Test
    void singleSegmentIsTheKeyUnderLiveApp() {
        RtmpEndpoint endpoint = RtmpEndpoint.parse("rtmp://host/onlykey");

        assertThat(endpoint.serverUrl()).isEqualTo("rtmp://host:1935/live");
        assertThat(endpoint.streamKey()).isEqualTo("onlykey");
    }

    @Test
    void noPathUsesDefaultKey() {
        RtmpEndpoint endpoint = RtmpEndpoint.parse("rtmp://host");

        assertThat(endpoint.serverUrl()).isEqualTo("rtmp://host:1935/live");
        assertThat(endpoint.streamKey()).isEqualTo(RtmpEndpoint.DEFAULT_STREAM_KEY);
    }

    @Test
    void rejectsOtherSchemesAndMissingHost() {
        assertThatThrownBy(() -> RtmpEndpoint.parse("http://host/app/key"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rtmp://");
        assertThatThrownBy(() -> RtmpEndpoint.parse("rtmp:///app/key"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no host");
        assertThatThrownBy(() -> RtmpEndpoint.parse("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buildFullUrlJoinsWithSingleSlash() {
        assertThat(RtmpEndpoint.buildFullUrl(" rtmp://a/live2 ", " key ")).isEqualTo("rtmp://a/live2/key");
        assertThat(RtmpEndpoint.buildFullUrl("rtmp://a/live2/", "key")).isEqualTo("rtmp://a/live2/key");
    }

    @Test
    void buildFullUrlHandlesBlankParts() {
        assertThat(RtmpEndpoint.buildFullUrl("rtmp://a/live2", "")).isEqualTo("rtmp://a/live2");
        assertThat(RtmpEndpoint.buildFullUrl("rtmp://a/live2", null)).isEqualTo("rtmp://a/live2");
        assertThat(RtmpEndpoint.buildFullUrl("", "key")).isEmpty();
        assertThat(RtmpEndpoint.buildFullUrl(null, "key")).isEmpty();
    }

    @Test
    void recognisesRtmpSchemesCaseInsensitively() {
        assertThat(RtmpEndpoint.isRtmpScheme("RTMP")).isTrue();
        assertThat(RtmpEndpoint.isRtmpScheme("rtmps")).isTrue();
        assertThat(RtmpEndpoint.isRtmpScheme("srt")).isFalse();
        assertThat(RtmpEndpoint.isRtmpScheme(null)).isFalse();
    }
}
