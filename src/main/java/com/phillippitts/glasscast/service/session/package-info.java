/**
 * Media session lifecycle.
 *
 * <p>{@link com.phillippitts.glasscast.service.session.MediaSessionController} is the only
 * writer of {@link com.phillippitts.glasscast.domain.MediaSessionState}. Pipelines and sources
 * report upward through callbacks that the controller queues onto its control loop.
 */
package com.phillippitts.glasscast.service.session;
