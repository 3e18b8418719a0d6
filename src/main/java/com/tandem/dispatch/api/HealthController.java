package com.tandem.dispatch.api;

import com.tandem.core.health.HealthCheckService;
import com.tandem.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for service health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health — 200 when every component is up or degraded, 503 if any is down.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        boolean anyDown = checks.stream().anyMatch(HealthStatus::isDown);

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result) : ResponseEntity.ok(result);
    }
}
