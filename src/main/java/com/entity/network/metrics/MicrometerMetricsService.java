package com.entity.network.metrics;

import com.entity.network.cache.CacheTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code network.cache.hit} / {@code network.cache.miss}: Counter (tag: tier)</li>
 *   <li>{@code network.cache.load}: Timer (tags: tier, outcome)</li>
 *   <li>{@code network.cache.invalidation}: Counter (tag: tier)</li>
 *   <li>{@code network.computation.duration}: Timer (tag: operation)</li>
 *   <li>{@code network.snapshot.nodes} / {@code network.snapshot.edges}: DistributionSummary</li>
 *   <li>{@code network.relationships.discovered}: Counter (tag: change)</li>
 *   <li>{@code network.query.degraded}: Counter (tag: reason)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary snapshotNodes;
    private final DistributionSummary snapshotEdges;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.snapshotNodes = DistributionSummary.builder("network.snapshot.nodes")
                .description("Node count of loaded graph snapshots")
                .register(registry);
        this.snapshotEdges = DistributionSummary.builder("network.snapshot.edges")
                .description("Undirected edge count of loaded graph snapshots")
                .register(registry);
    }

    @Override
    public void recordCacheHit(CacheTier tier) {
        counter("network.cache.hit", "Analytics cache hits", "tier", tier.name()).increment();
    }

    @Override
    public void recordCacheMiss(CacheTier tier) {
        counter("network.cache.miss", "Analytics cache misses", "tier", tier.name()).increment();
    }

    @Override
    public void recordCacheLoad(CacheTier tier, Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = "load:" + tier.name() + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("network.cache.load")
                        .description("Duration of analytics recomputations behind the cache")
                        .tag("tier", tier.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheInvalidation(CacheTier tier) {
        counter("network.cache.invalidation", "Analytics cache invalidations", "tier", tier.name()).increment();
    }

    @Override
    public void recordComputationDuration(String operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("computation:" + operation, k ->
                Timer.builder("network.computation.duration")
                        .description("Duration of graph computations")
                        .tag("operation", operation)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSnapshotSize(int nodeCount, int edgeCount) {
        snapshotNodes.record(nodeCount);
        snapshotEdges.record(edgeCount);
    }

    @Override
    public void incrementRelationshipsDiscovered(int created, int updated) {
        counter("network.relationships.discovered", "Relationships written by discovery", "change", "created")
                .increment(created);
        counter("network.relationships.discovered", "Relationships written by discovery", "change", "updated")
                .increment(updated);
    }

    @Override
    public void incrementDegradedQuery(String reason) {
        counter("network.query.degraded", "Graph queries answered without some views", "reason", reason)
                .increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
