package com.flagship.lending_pool.health;

import com.flagship.lending_pool.observability.OracleHealthIndicator;
import com.flagship.lending_pool.pool.PoolRegistry;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 * The service stays UP without a price rate; only borrow and liquidate need one.
 */
@RestController
public class HealthController {

    private final OracleHealthIndicator oracleHealth;
    private final PoolRegistry poolRegistry;

    public HealthController(OracleHealthIndicator oracleHealth, PoolRegistry poolRegistry) {
        this.oracleHealth = oracleHealth;
        this.poolRegistry = poolRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("pools", poolRegistry.count());
        response.put("oracle", Status.UP.equals(oracleHealth.health().getStatus()) ? "UP" : "DOWN");
        return ResponseEntity.ok(response);
    }
}
