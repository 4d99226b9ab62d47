/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.glasscast.exception.GlassCastException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.glasscast.exception.MediaSourceException} - The frame source
 *       failed to start or died; carries a {@link com.phillippitts.glasscast.exception.SourceErrorKind}</li>
 *   <li>{@link com.phillippitts.glasscast.exception.EncodeException} - An encoder rejected a single
 *       unit; the unit is dropped and the session continues</li>
 *   <li>{@link com.phillippitts.glasscast.exception.TransportException} - A socket connect or write
 *       failed; the session is torn down and settles in its error state</li>
 * </ul>
 *
 * <p>Caller bugs such as a malformed frame buffer are reported with
 * {@link java.lang.IllegalArgumentException} and are never caught by the pipeline.
 *
 * @see com.phillippitts.glasscast.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.glasscast.exception;
