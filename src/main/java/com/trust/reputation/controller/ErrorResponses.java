package com.trust.reputation.controller;

import com.trust.reputation.engine.graph.InputValidationException;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        if (e instanceof InputValidationException validation) {
            body.put("subject", validation.getSubject());
            body.put("field", validation.getField());
        }
        return ResponseEntity.badRequest().body(body);
    }

    static ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
