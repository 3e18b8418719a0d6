package com.tandem.core.health;

import java.util.Map;

/**
 * Health of one component as reported by {@link HealthCheckService}.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
