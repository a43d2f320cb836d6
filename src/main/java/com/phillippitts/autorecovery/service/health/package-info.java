/**
 * Health monitoring.
 *
 * <p>The monitor probes every registered service on a fixed delay, folds the result into
 * the state machine (HEALTHY, DEGRADED, UNHEALTHY, FAILED by consecutive failures) and
 * asks the manager for a recovery once a service needs one.
 */
package com.phillippitts.autorecovery.service.health;
