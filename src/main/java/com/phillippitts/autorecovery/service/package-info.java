/**
 * Service layer of the recovery orchestrator.
 *
 * <p>{@link com.phillippitts.autorecovery.service.RecoveryManager} is the facade used by
 * the REST layer and by embedding code. It delegates to the sub-packages:
 * <ul>
 *   <li>{@code service.registry} - supervised services and their health records</li>
 *   <li>{@code service.health} - periodic probing and the health state machine</li>
 *   <li>{@code service.strategy} - choosing a strategy from the failure pattern</li>
 *   <li>{@code service.catalog} - recovery plans and the built-in set</li>
 *   <li>{@code service.recovery} - queueing and step-by-step plan execution</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.notification} - lifecycle fan-out</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions, never HTTP ones.
 *
 * @since 1.0
 */
package com.phillippitts.autorecovery.service;
