package com.shortspilot.orchestrator.api;

import com.shortspilot.orchestrator.store.TrackingStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps tracking store failures on read endpoints to 503.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TrackingStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStoreFailure(TrackingStoreException ex) {
        log.error("Tracking store unavailable: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status",    HttpStatus.SERVICE_UNAVAILABLE.value());
        body.put("error",     "Tracking store unavailable");
        body.put("message",   ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
