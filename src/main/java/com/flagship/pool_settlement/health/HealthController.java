package com.flagship.pool_settlement.health;

import com.flagship.pool_settlement.liquidity.Pool;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final Pool pool;

    public HealthController(Pool pool) {
        this.pool = pool;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean booksHealthy = pool.checkValueInvariant();
        response.put("pool", pool.isEnabled() ? "ENABLED" : "DISABLED");
        response.put("books", booksHealthy ? "UP" : "DOWN");

        if (!booksHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
