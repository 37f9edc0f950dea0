package com.studygroups.studygroups_api.exception;

import java.util.Map;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Global Exception Handler to catch exceptions from all controllers
 * and return standardized JSON error responses.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ResponseEntity<Object> buildErrorResponse(String message, HttpStatus status) {
        return ResponseEntity.status(status).body(Map.of("message", message));
    }

    // --- 404 Not Found ---
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Object> handleNoSuchElementException(NoSuchElementException ex, WebRequest request) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return buildErrorResponse(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    // --- 400 Bad Request ---
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
        logger.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    // --- 409 Conflict (a run is already in flight) ---
    @ExceptionHandler(MatchingInProgressException.class)
    public ResponseEntity<Object> handleMatchingInProgress(MatchingInProgressException ex, WebRequest request) {
        logger.warn("Matching rejected: {}", ex.getMessage());
        return buildErrorResponse(ex.getMessage(), HttpStatus.CONFLICT);
    }

    // --- 503 or 500 for an aborted run ---
    @ExceptionHandler(MatchingFailedException.class)
    public ResponseEntity<Object> handleMatchingFailed(MatchingFailedException ex, WebRequest request) {
        logger.error("Matching run failed: {}", ex.getMessage(), ex);
        HttpStatus status = isStorageOutage(ex) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        return buildErrorResponse(ex.getMessage(), status);
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<Object> handleStorageUnavailable(DataAccessResourceFailureException ex, WebRequest request) {
        logger.error("Storage unavailable: {}", ex.getMessage(), ex);
        return buildErrorResponse("Storage is currently unavailable. Please try again later.", HttpStatus.SERVICE_UNAVAILABLE);
    }

    // --- 500 Internal Server Error (Generic Fallback) ---
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("An unexpected internal server error occurred:", ex);
        return buildErrorResponse("An unexpected internal error occurred. Please contact support.",
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static boolean isStorageOutage(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException) {
                return true;
            }
        }
        return false;
    }
}
