/**
 * REST endpoints for media session control.
 *
 * <ul>
 *   <li>{@code POST /sessions/{mode}} - create and start a session</li>
 *   <li>{@code GET /sessions/{id}} - state and statistics</li>
 *   <li>{@code GET /sessions/{id}/preview} - latest JPEG preview</li>
 *   <li>{@code DELETE /sessions/{id}} - stop and discard</li>
 *   <li>{@code GET /platforms} - RTMP platform presets</li>
 * </ul>
 */
package com.phillippitts.glasscast.presentation.controller;
