package com.pearlthoughts.mailgateway.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts uncaught faults into JSON error bodies. Internal details are only exposed in
 * development mode.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Value("${mail.gateway.development-mode:false}")
    private boolean developmentMode;

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.debug("Malformed request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("Malformed request body", ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        logger.error("Unexpected error during API operation", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("Internal server error", ex));
    }

    private Map<String, Object> body(String error, Exception ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (developmentMode && ex.getMessage() != null) {
            body.put("message", ex.getMessage());
        }
        return body;
    }
}
