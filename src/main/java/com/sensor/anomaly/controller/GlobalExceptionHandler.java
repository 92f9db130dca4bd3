package com.sensor.anomaly.controller;

import com.sensor.anomaly.exception.EmptyRecordException;
import com.sensor.anomaly.exception.FeatureShapeMismatchException;
import com.sensor.anomaly.exception.InsufficientDataException;
import com.sensor.anomaly.exception.ModelUnavailableException;
import com.sensor.anomaly.exception.SchemaMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({SchemaMismatchException.class, EmptyRecordException.class,
            FeatureShapeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidInput(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Input", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be parsed");
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientData(InsufficientDataException ex) {
        log.warn("Retrain refused: {}", ex.getMessage());
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, "Insufficient Data", ex.getMessage());
        response.getBody().put("available", ex.getAvailable());
        response.getBody().put("required", ex.getRequired());
        return response;
    }

    // Training already running, or cancelled while the request waited
    @ExceptionHandler({IllegalStateException.class, CancellationException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleModelUnavailable(ModelUnavailableException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Model Unavailable", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
