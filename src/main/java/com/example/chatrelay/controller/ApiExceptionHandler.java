package com.example.chatrelay.controller;

import com.example.chatrelay.error.StorageException;
import com.example.chatrelay.error.UpstreamException;
import com.example.chatrelay.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@RestControllerAdvice(assignableTypes = LarkWebhookController.class)
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        logger.warn("Rejected webhook payload: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("code", 1, "message", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(ServerWebInputException ex) {
        logger.warn("Unreadable webhook request: {}", ex.getReason());
        return ResponseEntity.badRequest().body(Map.of("code", 1, "message", "Malformed request body"));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamException ex) {
        logger.error("Downstream query failed", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("code", 1, "message", "Failed to get an answer from the chatflow"));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        logger.error("Storage failure", ex);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        logger.error("Unexpected error handling webhook", ex);
        return internalError();
    }

    private static ResponseEntity<Map<String, Object>> internalError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("code", 1, "message", "Internal Server Error"));
    }
}
