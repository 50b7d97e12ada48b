package com.easyinstall.backup.exception;

import com.easyinstall.backup.utils.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler class responsible for handling all exceptions
 * thrown by controllers in the application. Every error body has the shape
 * {@code {success: false, error: ...}}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> handleStore(StoreException e) {
        if (e.isDuplicate()) {
            log.warn("Store rejected duplicate: {}", e.getMessage());
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
        log.error("Store failure: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(SnapshotException.class)
    public ResponseEntity<Map<String, Object>> handleSnapshot(SnapshotException e) {
        log.error("Backup failed: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(BackupException.class)
    public ResponseEntity<Map<String, Object>> handleBackup(BackupException e) {
        log.error("Backup request failed due to technical error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e) {
        log.warn("Request failed with {}: {}", e.getStatusCode(), e.getReason());
        return error(e.getStatusCode(), e.getReason() == null ? e.getMessage() : e.getReason());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException e) {
        log.error("Unexpected failure while handling request: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatusCode status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(AppConstants.SUCCESS, false);
        body.put(AppConstants.ERROR, message);
        return new ResponseEntity<>(body, status);
    }
}
