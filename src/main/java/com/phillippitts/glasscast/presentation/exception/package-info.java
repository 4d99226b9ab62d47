/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link java.lang.IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.glasscast.exception.TransportException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.glasscast.exception.MediaSourceException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "BadRequest",
 *   "message": "Invalid request",
 *   "details": "Unknown streaming mode: video",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Endpoints and tokens are never returned to clients.
 */
package com.phillippitts.glasscast.presentation.exception;
