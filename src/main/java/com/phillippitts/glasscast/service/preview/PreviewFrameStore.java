package com.phillippitts.glasscast.service.preview;

import com.phillippitts.glasscast.domain.MediaSessionState.Phase;
import com.phillippitts.glasscast.service.session.event.MediaSessionStateChangedEvent;
import com.phillippitts.glasscast.service.session.event.PreviewFrameEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the latest JPEG preview of every active session for polling clients.
 *
 * <p>Both listeners run on the publishing thread, so a controller's frames and state changes
 * arrive in the order it published them. Frames from a controller that is not between
 * STARTING and STOPPED/ERROR are ignored.
 */
@Component
public class PreviewFrameStore {

    private final Object lock = new Object();
    private final Set<String> active = new HashSet<>();
    private final Map<String, PreviewFrameEvent> latest = new HashMap<>();

    @EventListener
    public void onPreviewFrame(PreviewFrameEvent event) {
        synchronized (lock) {
            if (active.contains(event.controllerId())) {
                latest.put(event.controllerId(), event);
            }
        }
    }

    @EventListener
    public void onSessionStateChanged(MediaSessionStateChangedEvent event) {
        Phase phase = event.current().phase();
        synchronized (lock) {
            if (phase == Phase.STARTING || phase == Phase.STREAMING) {
                active.add(event.controllerId());
            } else if (phase == Phase.STOPPED || phase == Phase.ERROR) {
                active.remove(event.controllerId());
                latest.remove(event.controllerId());
            }
        }
    }

    public Optional<PreviewFrameEvent> latest(String controllerId) {
        synchronized (lock) {
            return Optional.ofNullable(latest.get(controllerId));
        }
    }
}
