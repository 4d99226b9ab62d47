package com.phillippitts.glasscast.service.events;

import com.phillippitts.glasscast.domain.MediaSessionState;
import com.phillippitts.glasscast.domain.StreamingMode;
import com.phillippitts.glasscast.exception.SourceErrorKind;
import com.phillippitts.glasscast.service.session.event.EncodeWarningEvent;
import com.phillippitts.glasscast.service.session.event.MediaSessionStateChangedEvent;
import com.phillippitts.glasscast.service.source.SourceErrorEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        // first occurrence passes
        assertThat(l.shouldLog("source-microphone-PERMISSION_DENIED")).isTrue();
        assertThat(l.shouldLog("source-microphone-PERMISSION_DENIED")).isFalse();
        // other keys are throttled independently
        assertThat(l.shouldLog("encode-abc-h264")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onSourceError(new SourceErrorEvent("microphone", SourceErrorKind.PERMISSION_DENIED, Instant.now()));
            l.onEncodeWarning(new EncodeWarningEvent("abc", "aac", "bad input", Instant.now()));
            l.onSessionError(new MediaSessionStateChangedEvent("abc", StreamingMode.RTMP_VIDEO,
                    MediaSessionState.STOPPING, MediaSessionState.error("Publish failed"), Instant.now()));
            l.onSessionError(new MediaSessionStateChangedEvent("abc", StreamingMode.RTMP_VIDEO,
                    MediaSessionState.STOPPING, MediaSessionState.STOPPED, Instant.now()));
        }).doesNotThrowAnyException();
    }

    @Test
    void onlyErrorTransitionsAreThrottled() {
        ErrorEventsListener l = new ErrorEventsListener();

        l.onSessionError(new MediaSessionStateChangedEvent("abc", StreamingMode.PREVIEW,
                MediaSessionState.STOPPING, MediaSessionState.STOPPED, Instant.now()));

        assertThat(l.shouldLog("session-abc")).isTrue();
    }
}
