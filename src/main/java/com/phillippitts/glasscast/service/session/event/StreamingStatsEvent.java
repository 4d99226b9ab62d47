package com.phillippitts.glasscast.service.session.event;

import com.phillippitts.glasscast.domain.StreamingStats;

import java.time.Instant;

/**
 * Periodic statistics snapshot; one with {@link StreamingStats#ZERO} follows every stop.
 */
public record StreamingStatsEvent(String controllerId, StreamingStats stats, Instant timestamp) {}
