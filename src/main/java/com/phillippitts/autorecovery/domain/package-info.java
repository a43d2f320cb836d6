/**
 * Domain model of the recovery orchestrator.
 *
 * <p>Plans, steps and retry policies are immutable once built; {@link
 * com.phillippitts.autorecovery.domain.RecoveryPlan.Builder} validates what it can at
 * construction and the catalog validates the rest on registration.
 * {@link com.phillippitts.autorecovery.domain.RecoveryExecution} is the one mutable type:
 * it is owned by the engine and handed out only as detached copies.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.autorecovery.domain.ServiceStatus} - health state of a supervised service</li>
 *   <li>{@link com.phillippitts.autorecovery.domain.RecoveryPlan} - ordered steps plus rollback for one strategy</li>
 *   <li>{@link com.phillippitts.autorecovery.domain.RecoveryExecution} - one run of a plan</li>
 *   <li>{@link com.phillippitts.autorecovery.domain.ServiceHealth} - point-in-time health snapshot</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.autorecovery.domain;
