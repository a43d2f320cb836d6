/**
 * Global exception handling for the operator API.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.autorecovery.exception.ServiceNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.autorecovery.exception.InvalidRecoveryPlanException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.autorecovery.exception.RecoveryManagerException} → 409 Conflict</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ServiceNotFoundException",
 *   "message": "Not found",
 *   "details": "Service not found: cache",
 *   "timestamp": "2026-01-01T00:00:00Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.autorecovery.exception
 * @since 1.0
 */
package com.phillippitts.autorecovery.presentation.exception;
