package com.quillkv.gateway.http;

import com.quillkv.store.BackendException;
import com.quillkv.store.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Storage faults become 5xx without SQL detail; the cause goes to the log. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<Map<String, Object>> unavailable(BackendUnavailableException e) {
        log.warn("Backend unavailable: {}", e.getMessage(), e);
        return ApiResponses.error(HttpStatus.SERVICE_UNAVAILABLE, "BACKEND_UNAVAILABLE", "Storage is unavailable");
    }

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<Map<String, Object>> backend(BackendException e) {
        log.error("Backend error: {}", e.getMessage(), e);
        return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "BACKEND_ERROR", "Storage request failed");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> invalid(IllegalArgumentException e) {
        return ApiResponses.error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", e.getMessage());
    }
}
