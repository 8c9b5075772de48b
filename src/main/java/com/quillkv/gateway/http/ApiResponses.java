package com.quillkv.gateway.http;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class ApiResponses {

    static final Map<String, Object> UNAUTHORIZED =
            Map.of("ok", false, "code", "UNAUTHORIZED", "message", "Unauthorized");

    private ApiResponses() {}

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("ok", false, "code", code, "message", message));
    }

    static ResponseEntity<Map<String, Object>> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(UNAUTHORIZED);
    }
}
