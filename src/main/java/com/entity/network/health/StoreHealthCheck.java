package com.entity.network.health;

import com.entity.network.store.GraphStore;

/**
 * Reports whether the graph store answers, with the round-trip latency.
 */
public class StoreHealthCheck implements HealthCheck {

    private final GraphStore store;

    public StoreHealthCheck(GraphStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "graphStore";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try {
            boolean available = store.isAvailable();
            long latencyMs = System.currentTimeMillis() - startMs;
            HealthStatus base = available ? HealthStatus.up() : HealthStatus.down("Graph store not reachable");
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("store", store.getClass().getSimpleName());
        } catch (RuntimeException e) {
            return HealthStatus.down("Graph store check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
