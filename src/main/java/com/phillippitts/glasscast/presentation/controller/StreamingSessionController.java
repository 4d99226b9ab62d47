package com.phillippitts.glasscast.presentation.controller;

import com.phillippitts.glasscast.domain.MediaSessionState;
import com.phillippitts.glasscast.domain.StreamingMode;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.service.preview.PreviewFrameStore;
import com.phillippitts.glasscast.service.session.MediaSessionController;
import com.phillippitts.glasscast.service.session.MediaSessionControllerFactory;
import com.phillippitts.glasscast.service.transport.rtmp.StreamingPlatform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Session control for the excluded UI layer: start, inspect and stop media sessions.
 */
@RestController
class StreamingSessionController {

    private static final Logger LOG = LogManager.getLogger(StreamingSessionController.class);

    private final MediaSessionControllerFactory factory;
    private final PreviewFrameStore previews;

    StreamingSessionController(MediaSessionControllerFactory factory, PreviewFrameStore previews) {
        this.factory = factory;
        this.previews = previews;
    }

    /**
     * Creates a controller for the mode ({@code audio-gateway}, {@code rtmp-video}, {@code preview})
     * and starts it. A failed start still returns 201 with the ERROR state.
     */
    @PostMapping("/sessions/{mode}")
    ResponseEntity<SessionView> create(@PathVariable("mode") String mode) {
        StreamingMode streamingMode = parseMode(mode);
        MediaSessionController controller = factory.create(streamingMode);
        controller.start();
        LOG.info("Session {} requested in mode {}", controller.getId(), streamingMode);
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionView.of(controller));
    }

    @GetMapping("/sessions/{id}")
    ResponseEntity<SessionView> get(@PathVariable("id") String id) {
        return factory.find(id)
                .map(controller -> ResponseEntity.ok(SessionView.of(controller)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/sessions/{id}/preview", produces = MediaType.IMAGE_JPEG_VALUE)
    ResponseEntity<byte[]> preview(@PathVariable("id") String id) {
        return previews.latest(id)
                .map(frame -> ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(frame.jpeg()))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/sessions/{id}")
    ResponseEntity<Void> delete(@PathVariable("id") String id) {
        return factory.remove(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/platforms")
    List<Map<String, String>> platforms() {
        return Arrays.stream(StreamingPlatform.values())
                .map(p -> Map.of("id", p.name(), "name", p.displayName(), "baseUrl", p.baseUrl()))
                .toList();
    }

    static StreamingMode parseMode(String mode) {
        try {
            return StreamingMode.valueOf(mode.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown streaming mode: " + mode
                    + " (expected one of " + Arrays.toString(StreamingMode.values()) + ")", e);
        }
    }

    /**
     * Session snapshot returned to clients.
     */
    record SessionView(String id,
                       StreamingMode mode,
                       MediaSessionState.Phase state,
                       String reason,
                       StreamingStats stats) {

        static SessionView of(MediaSessionController controller) {
            MediaSessionState state = controller.getState();
            return new SessionView(controller.getId(), controller.getMode(), state.phase(),
                    state.reason(), controller.getStats());
        }
    }
}
