package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.exception.DuplicateDispatchException;
import com.sandy.debrisflow.monitor.exception.ExecutorException;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Malformed or out-of-range input. Client error, no stack trace.
     */
    @ExceptionHandler({ValidationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleValidation(Exception ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), null);
    }

    /**
     * A run for the same snapshot and event is already in flight; the caller gets its id.
     */
    @ExceptionHandler(DuplicateDispatchException.class)
    public ResponseEntity<Object> handleDuplicateDispatch(DuplicateDispatchException ex) {
        log.warn("Duplicate dispatch rejected: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "Duplicate dispatch", ex.getMessage(), Map.of("existingRunId", ex.getExistingRunId()));
    }

    @ExceptionHandler(ExecutorException.class)
    public ResponseEntity<Object> handleExecutor(ExecutorException ex) {
        log.warn("Simulation executor error: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "Simulation executor error", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred.", null);
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message, Map<String, Object> extra) {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("timestamp", LocalDateTime.now());
        b.put("status", status.value());
        b.put("error", error);
        b.put("message", message);
        if (extra != null) {
            b.putAll(extra);
        }
        return ResponseEntity.status(status).body(b);
    }
}
