/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.autorecovery.exception.RecoveryManagerException} - Base exception
 *       for all orchestrator errors</li>
 *   <li>{@link com.phillippitts.autorecovery.exception.InvalidRecoveryPlanException} - Thrown when
 *       a custom recovery plan fails validation at registration time</li>
 *   <li>{@link com.phillippitts.autorecovery.exception.ServiceNotFoundException} - Thrown at the
 *       REST boundary for unknown services or executions</li>
 *   <li>{@link com.phillippitts.autorecovery.exception.RecoveryStepException} - A recovery step
 *       attempt failed; retried by the executor and never surfaced to callers directly</li>
 * </ul>
 *
 * <p>Health-check failures are statistical and never raised as exceptions. Configuration
 * failures (unknown service, no matching plan) are reported as empty results rather than thrown.
 *
 * @see com.phillippitts.autorecovery.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.autorecovery.exception;
