/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.autorecovery.presentation.controller.RecoveryController}
 *       - operator API under {@code /api/recovery}</li>
 * </ul>
 *
 * <p>Controllers delegate to {@link com.phillippitts.autorecovery.service.RecoveryManager} and
 * let {@code GlobalExceptionHandler} map exceptions to status codes.
 *
 * @see com.phillippitts.autorecovery.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.autorecovery.presentation.controller;
