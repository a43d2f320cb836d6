/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.autorecovery.config.RecoveryConfig} - backoff sleeper used between step attempts</li>
 *   <li>{@link com.phillippitts.autorecovery.config.ThreadPoolConfig} - recovery and probe executors,
 *       loop scheduler and clock</li>
 *   <li>{@link com.phillippitts.autorecovery.config.ThreadPoolMetricsConfig} - executor gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code recovery.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC request filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.autorecovery.config;
