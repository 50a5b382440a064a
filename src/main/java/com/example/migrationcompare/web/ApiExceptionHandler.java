package com.example.migrationcompare.web;

import com.example.migrationcompare.exception.ConfigurationException;
import com.example.migrationcompare.exception.JobNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.List;

/**
 * Maps engine and lifecycle exceptions onto HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LogManager.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid comparison configuration", ex.getProblems());
    }

    @ExceptionHandler
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of());
    }

    @ExceptionHandler
    public ResponseEntity<ApiError> handleNotFound(JobNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), List.of());
    }

    @ExceptionHandler
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        log.info("Conflicting request: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), List.of());
    }

    @ExceptionHandler
    public ResponseEntity<ApiError> handleIo(IOException ex) {
        log.error("I/O failure while handling request", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "File processing error: " + ex.getMessage(), List.of());
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message, List<String> problems) {
        return ResponseEntity.status(status).body(new ApiError(status.value(), message, problems));
    }

    public record ApiError(int status, String message, List<String> problems) {}
}
