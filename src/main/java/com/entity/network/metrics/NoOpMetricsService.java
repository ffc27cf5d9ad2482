package com.entity.network.metrics;

import com.entity.network.cache.CacheTier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(CacheTier tier) {
    }

    @Override
    public void recordCacheMiss(CacheTier tier) {
    }

    @Override
    public void recordCacheLoad(CacheTier tier, Duration duration, boolean success) {
    }

    @Override
    public void recordCacheInvalidation(CacheTier tier) {
    }

    @Override
    public void recordComputationDuration(String operation, Duration duration) {
    }

    @Override
    public void recordSnapshotSize(int nodeCount, int edgeCount) {
    }

    @Override
    public void incrementRelationshipsDiscovered(int created, int updated) {
    }

    @Override
    public void incrementDegradedQuery(String reason) {
    }
}
