package com.phillippitts.glasscast.service.health;

import com.phillippitts.glasscast.domain.MediaSessionState;
import com.phillippitts.glasscast.domain.StreamingMode;
import com.phillippitts.glasscast.service.session.MediaSessionController;
import com.phillippitts.glasscast.service.session.MediaSessionControllerFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MediaSessionHealthIndicatorTest {

    private static MediaSessionController controller(String id, MediaSessionState state) {
        MediaSessionController controller = mock(MediaSessionController.class);
        when(controller.getId()).thenReturn(id);
        when(controller.getMode()).thenReturn(StreamingMode.RTMP_VIDEO);
        when(controller.getState()).thenReturn(state);
        return controller;
    }

    private static Health health(MediaSessionController... controllers) {
        MediaSessionControllerFactory factory = mock(MediaSessionControllerFactory.class);
        when(factory.controllers()).thenReturn(List.of(controllers));
        return new MediaSessionHealthIndicator(factory).health();
    }

    @Test
    void shouldReportUpWithoutSessions() {
        Health health = health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "No session in error");
        assertThat(health.getDetails()).containsEntry("sessions", Map.of());
    }

    @Test
    void shouldReportUpWhenNoSessionFailed() {
        Health health = health(controller("a", MediaSessionState.STREAMING), controller("b", MediaSessionState.STOPPED));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("sessions",
                Map.of("a", "RTMP_VIDEO STREAMING", "b", "RTMP_VIDEO STOPPED"));
    }

    @Test
    void shouldReportDegradedWhenSomeSessionsFailed() {
        Health health = health(controller("a", MediaSessionState.STREAMING),
                controller("b", MediaSessionState.error("Publish failed")));

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "1 of 2 sessions in error");
    }

    @Test
    void shouldReportDownWhenAllSessionsFailed() {
        Health health = health(controller("a", MediaSessionState.error("x")));

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "All sessions in error");
    }
}
