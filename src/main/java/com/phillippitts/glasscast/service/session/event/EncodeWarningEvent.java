package com.phillippitts.glasscast.service.session.event;

import java.time.Instant;

/**
 * An encoder dropped a single frame or chunk. The session keeps running.
 *
 * @param controllerId id of the controller
 * @param codec codec that rejected the unit
 * @param message encoder error message
 * @param timestamp when the unit was dropped
 */
public record EncodeWarningEvent(String controllerId, String codec, String message, Instant timestamp) {}
