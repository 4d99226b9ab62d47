package com.phillippitts.glasscast.service.source;

import com.phillippitts.glasscast.exception.SourceErrorKind;

import java.time.Instant;

/**
 * Published when a frame source fails (permissions, missing device, stream errors).
 *
 * Payload contains the source name, an error kind and a timestamp. Avoids any PII.
 */
public record SourceErrorEvent(String source, SourceErrorKind kind, Instant at) { }
