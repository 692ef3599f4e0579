package com.xksgroup.downloadtracker.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred",
            ex.getMessage()
        );
    }

    @ExceptionHandler(PriorityChangeRejectedException.class)
    public ResponseEntity<Object> handlePriorityRejected(PriorityChangeRejectedException ex) {
        log.warn("Priority change rejected for {} ({}): {}", ex.getDownloadId(), ex.getReason(), ex.getMessage());
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE -> HttpStatus.CONFLICT;
            case INVALID_LABEL -> HttpStatus.BAD_REQUEST;
            case CONTROLLER_REJECTED -> HttpStatus.BAD_GATEWAY;
        };
        return buildErrorResponse(status, "Priority change rejected: " + ex.getReason(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument provided: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid request parameter",
            ex.getMessage()
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for '{}': {}", ex.getName(), ex.getValue());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid request parameter",
            "Invalid value '" + ex.getValue() + "' for " + ex.getName()
        );
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<Object> handleStoreUnavailable(DataAccessResourceFailureException ex) {
        log.error("Store unavailable", ex);
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Store unavailable",
            ex.getMessage()
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Bad request - unreadable/missing body: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid or missing request body",
            ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage()
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidationErrors(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .orElse("Validation failed");
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation error", msg);
    }

    private ResponseEntity<Object> buildErrorResponse(HttpStatus status, String message, String details) {
        Map<String, Object> errorResponse = Map.of(
            "timestamp", LocalDateTime.now(),
            "status", status.value(),
            "error", status.getReasonPhrase(),
            "message", message,
            "details", details != null ? details : "No additional details available"
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
