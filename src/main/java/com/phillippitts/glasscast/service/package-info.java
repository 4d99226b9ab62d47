/**
 * Media pipeline services.
 *
 * <p>Data flows from a {@code source} through {@code video} or {@code audio} encoders into a
 * {@code transport}; the {@code session} package owns the lifecycle that ties them together.
 */
package com.phillippitts.glasscast.service;
