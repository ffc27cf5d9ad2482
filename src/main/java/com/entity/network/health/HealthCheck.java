package com.entity.network.health;

/**
 * A check of one component: store, memory, cache.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
