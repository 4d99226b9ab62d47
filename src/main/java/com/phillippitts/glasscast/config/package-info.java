/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.glasscast.config.ThreadPoolConfig} - event listener executor
 *       with Log4j2 ThreadContext propagation</li>
 *   <li>{@link com.phillippitts.glasscast.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for that executor</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.session} - session and preview properties</li>
 *   <li>{@code config.source} - frame source selection</li>
 *   <li>{@code config.transport} - audio gateway and RTMP properties</li>
 *   <li>{@code config.pipeline} - codec and HTTP client beans</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.glasscast.config;
