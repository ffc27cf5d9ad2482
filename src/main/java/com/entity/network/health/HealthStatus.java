package com.entity.network.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a health check. The engine-wide status nests one of these per check
 * under {@link #details()}.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /** Ordered from healthy to unhealthy. */
    public enum Status {
        UP, DEGRADED, DOWN;

        Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new HealthStatus(status, message, copy);
    }

    /**
     * Flattened form used when this status is nested in an aggregate.
     */
    Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.name());
        summary.put("message", message);
        summary.put("details", details);
        return summary;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
