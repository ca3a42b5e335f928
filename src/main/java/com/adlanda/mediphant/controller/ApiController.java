package com.adlanda.mediphant.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Mediphant FAQ",
                "version", appVersion,
                "endpoints", Map.of(
                        "faq", "GET /api/faq?q=... - Answer a question from the knowledge corpus",
                        "history", "GET /api/history - Recent interaction checks",
                        "recordHistory", "POST /api/history - Record an interaction check",
                        "clearHistory", "DELETE /api/history - Clear the history",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
