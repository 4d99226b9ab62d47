/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.glasscast.config.logging.MdcFilter} tags REST requests with
 * {@code requestId}; session control threads tag their lines with {@code sessionId}.
 */
package com.phillippitts.glasscast.config.logging;
