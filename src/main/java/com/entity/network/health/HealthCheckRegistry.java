package com.entity.network.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates the registered checks. The engine is as healthy as its worst check;
 * the first check to reach that status supplies the message.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status overall = HealthStatus.Status.UP;
        String message = "OK";
        Map<String, Object> perCheck = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            perCheck.put(check.getName(), result.summary());
            HealthStatus.Status worse = overall.worse(result.status());
            if (worse != overall) {
                overall = worse;
                message = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(overall, message, perCheck);
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down(check.getName() + " check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }

    public int size() {
        return checks.size();
    }
}
