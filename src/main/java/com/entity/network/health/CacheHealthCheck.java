package com.entity.network.health;

import com.entity.network.cache.AnalyticsCache;
import com.entity.network.cache.CacheStats;

/**
 * Reports analytics cache size and hit rate. DEGRADED once the cache holds
 * nearly its configured capacity in every tier.
 */
public class CacheHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.95;

    private final AnalyticsCache cache;

    public CacheHealthCheck(AnalyticsCache cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "analyticsCache";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = cache.stats();
        long capacity = (long) cache.config().maxSize() * 3;
        double usage = (double) stats.size() / capacity;
        HealthStatus base = !cache.config().enabled()
                ? HealthStatus.up("Cache disabled")
                : usage >= DEGRADED_THRESHOLD
                ? HealthStatus.degraded("Cache near capacity: " + String.format("%.0f%%", usage * 100))
                : HealthStatus.up();
        return base
                .withDetail("size", stats.size())
                .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 1000.0)
                .withDetail("loads", stats.loadCount())
                .withDetail("evictions", stats.evictionCount());
    }
}
