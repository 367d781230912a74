package com.candidateprep.coach.exception;

import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to JSON error bodies. Stack traces never reach the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** Caller misuse: missing session, no current question, interview already running */
    @ExceptionHandler(SessionStateException.class)
    public ResponseEntity<Map<String, Object>> handleSessionState(SessionStateException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    /** Model or search failures that could not be degraded */
    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<Map<String, Object>> handleCollaborator(CollaboratorException ex) {
        log.error("Upstream {} failure", ex.getCollaborator(), ex);
        return error(HttpStatus.BAD_GATEWAY, "Upstream AI service error. Please try again later.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Request body is missing or malformed.");
    }

    /** Catch-all, never expose internal detail */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "status", status.value(),
                "timestamp", Instant.now().toString()));
    }
}
