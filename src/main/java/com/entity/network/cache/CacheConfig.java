package com.entity.network.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the analytics cache.
 *
 * @param snapshotTtl  time-to-live of graph snapshots
 * @param layoutTtl    time-to-live of layouts
 * @param clusterTtl   time-to-live of cluster results
 * @param maxSize      maximum number of entries per tier
 * @param waitTimeout  how long a caller waits for a recomputation started by another caller
 * @param enabled      whether caching is enabled
 */
public record CacheConfig(Duration snapshotTtl, Duration layoutTtl, Duration clusterTtl,
                          int maxSize, Duration waitTimeout, boolean enabled) {

    public CacheConfig {
        requirePositive(snapshotTtl, "snapshotTtl");
        requirePositive(layoutTtl, "layoutTtl");
        requirePositive(clusterTtl, "clusterTtl");
        requirePositive(waitTimeout, "waitTimeout");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    /**
     * Default configuration: 60s snapshots, 300s layouts, 600s clusters,
     * 1,000 entries per tier, 30s wait.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(600),
                1_000, Duration.ofSeconds(30), true);
    }

    /**
     * Every lookup recomputes.
     */
    public static CacheConfig disabled() {
        return defaults().withEnabled(false);
    }

    public Duration ttl(CacheTier tier) {
        return switch (tier) {
            case SNAPSHOT -> snapshotTtl;
            case LAYOUT -> layoutTtl;
            case CLUSTER -> clusterTtl;
        };
    }

    public CacheConfig withTtl(CacheTier tier, Duration ttl) {
        return new CacheConfig(
                tier == CacheTier.SNAPSHOT ? ttl : snapshotTtl,
                tier == CacheTier.LAYOUT ? ttl : layoutTtl,
                tier == CacheTier.CLUSTER ? ttl : clusterTtl,
                maxSize, waitTimeout, enabled);
    }

    public CacheConfig withWaitTimeout(Duration timeout) {
        return new CacheConfig(snapshotTtl, layoutTtl, clusterTtl, maxSize, timeout, enabled);
    }

    public CacheConfig withMaxSize(int size) {
        return new CacheConfig(snapshotTtl, layoutTtl, clusterTtl, size, waitTimeout, enabled);
    }

    public CacheConfig withEnabled(boolean value) {
        return new CacheConfig(snapshotTtl, layoutTtl, clusterTtl, maxSize, waitTimeout, value);
    }
}
