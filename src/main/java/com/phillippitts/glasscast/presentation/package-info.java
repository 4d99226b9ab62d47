/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP boundary the UI layer drives media sessions through.
 * Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - session control endpoints</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.glasscast.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.glasscast.presentation;
