package com.phillippitts.glasscast.service.session.event;

import com.phillippitts.glasscast.domain.MediaSessionState;
import com.phillippitts.glasscast.domain.StreamingMode;

import java.time.Instant;

/**
 * Emitted after every state transition of a media session controller.
 *
 * @param controllerId id of the controller
 * @param mode streaming mode of the controller
 * @param previous state before the transition
 * @param current state after the transition
 * @param timestamp when the transition happened
 */
public record MediaSessionStateChangedEvent(
        String controllerId,
        StreamingMode mode,
        MediaSessionState previous,
        MediaSessionState current,
        Instant timestamp
) {}
