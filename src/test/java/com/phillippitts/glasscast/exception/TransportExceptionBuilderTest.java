package com.phillippitts.glasscast.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportExceptionBuilderTest {

    @Test
    void buildsPlainMessageWithoutDetails() {
        TransportException ex = TransportExceptionBuilder.create("Gateway unreachable").build();

        assertThat(ex.getMessage()).isEqualTo("Gateway unreachable (endpoint: unknown)");
        assertThat(ex.getEndpoint()).isEqualTo("unknown");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void appendsDetailsInOrder() {
        TransportException ex = TransportExceptionBuilder.create("Audio gateway closed the connection")
                .closeCode(1001)
                .durationMs(1500)
                .metadata("chunk", 42)
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage())
                .startsWith("Audio gateway closed the connection (closeCode=1001, durationMs=1500, chunk=42)");
    }

    @Test
    void redactsEndpointCredentials() {
        TransportException ex = TransportExceptionBuilder.create("Publish failed")
                .endpoint("rtmp://live.twitch.tv/app/live_secret_key")
                .build();

        assertThat(ex.getEndpoint()).isEqualTo("rtmp://live.twitch.tv/app/***");
        assertThat(ex.getMessage()).doesNotContain("live_secret_key");
    }

    @Test
    void keepsCause() {
        IllegalStateException cause = new IllegalStateException("muxer");

        TransportException ex = TransportExceptionBuilder.create("Connect failed").cause(cause).build();

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> TransportExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
