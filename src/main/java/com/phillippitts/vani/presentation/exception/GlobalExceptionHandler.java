package com.phillippitts.vani.presentation.exception;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST boundary.
 *
 * <p>Turn failures never reach here; they come back as a normal response with a status.
 * Only malformed requests (400) and programming errors (500) are handled.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid turn request: {}", details);
        return badRequest(ex, details);
    }

    /**
     * Client error - body missing or not JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest(ex, "Request body must be JSON with a transcript field");
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
                "Please retry; report the X-Request-ID if it persists",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(Exception ex, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid turn request",
                details,
                Instant.now()
            ));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
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
