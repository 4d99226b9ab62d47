package com.phillippitts.glasscast.service.events;

import com.phillippitts.glasscast.domain.MediaSessionState.Phase;
import com.phillippitts.glasscast.service.session.event.EncodeWarningEvent;
import com.phillippitts.glasscast.service.session.event.MediaSessionStateChangedEvent;
import com.phillippitts.glasscast.service.source.SourceErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSourceError(SourceErrorEvent e) {
        String key = "source-" + e.source() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Source '{}' failed: {}", e.source(), e.kind().userMessage());
        }
    }

    // Published from capture threads; keep them free of logging work.
    @Async("eventExecutor")
    @EventListener
    void onEncodeWarning(EncodeWarningEvent e) {
        String key = "encode-" + e.controllerId() + '-' + e.codec();
        if (shouldLog(key)) {
            LOG.warn("Encoder {} dropping units in session {}: {}", e.codec(), e.controllerId(), e.message());
        }
    }

    @EventListener
    void onSessionError(MediaSessionStateChangedEvent e) {
        if (e.current().phase() != Phase.ERROR) {
            return;
        }
        String key = "session-" + e.controllerId();
        if (shouldLog(key)) {
            LOG.warn("{} session {} ended in error: {}. Start it again once the cause is fixed.",
                    e.mode(), e.controllerId(), e.current().reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
