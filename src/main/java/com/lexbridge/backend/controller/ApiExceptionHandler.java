package com.lexbridge.backend.controller;

import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.NotFoundException;
import com.lexbridge.backend.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders failures as {@code {error, reason?, message}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", null, ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", null, ex.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConflictException ex) {
        log.debug("Conflict {}: {}", ex.getReason(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "conflict", ex.getReason().name(), ex.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", null,
                ex.getHeaderName() + " header is required");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", null, "Malformed request body");
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String reason,
                                                               String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (reason != null) {
            body.put("reason", reason);
        }
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
