package com.entity.network.metrics;

import com.entity.network.cache.CacheTier;

import java.time.Duration;

/**
 * Cache and computation measurements for the analytics engine. {@link MicrometerMetricsService}
 * publishes them to a meter registry; {@link NoOpMetricsService} is used when none is configured.
 */
public interface MetricsService {

    void recordCacheHit(CacheTier tier);

    void recordCacheMiss(CacheTier tier);

    void recordCacheLoad(CacheTier tier, Duration duration, boolean success);

    void recordCacheInvalidation(CacheTier tier);

    void recordComputationDuration(String operation, Duration duration);

    void recordSnapshotSize(int nodeCount, int edgeCount);

    void incrementRelationshipsDiscovered(int created, int updated);

    void incrementDegradedQuery(String reason);
}
