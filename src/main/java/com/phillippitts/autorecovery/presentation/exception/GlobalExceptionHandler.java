package com.phillippitts.autorecovery.presentation.exception;

import com.phillippitts.autorecovery.exception.InvalidRecoveryPlanException;
import com.phillippitts.autorecovery.exception.RecoveryManagerException;
import com.phillippitts.autorecovery.exception.ServiceNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts orchestrator exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown service or execution (HTTP 404).
     */
    @ExceptionHandler(ServiceNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(ServiceNotFoundException ex) {
        LOG.debug("Lookup failed: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex, "Not found", ex.getMessage());
    }

    /**
     * Client error - malformed plan or request body (HTTP 400).
     */
    @ExceptionHandler(InvalidRecoveryPlanException.class)
    ResponseEntity<ApiError> handleInvalidPlan(InvalidRecoveryPlanException ex) {
        LOG.warn("Invalid recovery plan: id={}, reason={}", ex.getPlanId(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid recovery plan", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", "Check the request body against the API");
    }

    /**
     * Request conflicts with current state, e.g. cancelling a finished execution (HTTP 409).
     */
    @ExceptionHandler(RecoveryManagerException.class)
    ResponseEntity<ApiError> handleConflict(RecoveryManagerException ex) {
        LOG.warn("Recovery request refused: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Request conflicts with current state", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
