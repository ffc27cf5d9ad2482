package com.entity.network.metrics;

import com.entity.network.cache.CacheTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCacheHit(CacheTier.SNAPSHOT);
                noOp.recordCacheMiss(CacheTier.LAYOUT);
                noOp.recordCacheLoad(CacheTier.CLUSTER, Duration.ofMillis(5), true);
                noOp.recordCacheInvalidation(CacheTier.SNAPSHOT);
                noOp.recordComputationDuration("layout", Duration.ofMillis(10));
                noOp.recordSnapshotSize(10, 20);
                noOp.incrementRelationshipsDiscovered(1, 2);
                noOp.incrementDegradedQuery("layout.too_large");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count hits and misses per tier")
        void cacheHitsAndMisses() {
            metrics.recordCacheHit(CacheTier.SNAPSHOT);
            metrics.recordCacheHit(CacheTier.SNAPSHOT);
            metrics.recordCacheMiss(CacheTier.LAYOUT);

            Counter hits = registry.find("network.cache.hit").tag("tier", "SNAPSHOT").counter();
            Counter misses = registry.find("network.cache.miss").tag("tier", "LAYOUT").counter();

            assertNotNull(hits);
            assertEquals(2.0, hits.count());
            assertNotNull(misses);
            assertEquals(1.0, misses.count());
            assertNull(registry.find("network.cache.hit").tag("tier", "LAYOUT").counter());
        }

        @Test
        @DisplayName("Should time cache loads by outcome")
        void cacheLoads() {
            metrics.recordCacheLoad(CacheTier.CLUSTER, Duration.ofMillis(100), true);
            metrics.recordCacheLoad(CacheTier.CLUSTER, Duration.ofMillis(300), true);
            metrics.recordCacheLoad(CacheTier.CLUSTER, Duration.ofMillis(50), false);

            Timer success = registry.find("network.cache.load")
                    .tag("tier", "CLUSTER").tag("outcome", "success").timer();
            Timer failure = registry.find("network.cache.load")
                    .tag("tier", "CLUSTER").tag("outcome", "failure").timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertEquals(400.0, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertNotNull(failure);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Should count invalidations per tier")
        void invalidations() {
            metrics.recordCacheInvalidation(CacheTier.SNAPSHOT);
            Counter counter = registry.find("network.cache.invalidation").tag("tier", "SNAPSHOT").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should time computations by operation")
        void computationDuration() {
            metrics.recordComputationDuration("betweenness", Duration.ofMillis(20));
            Timer timer = registry.find("network.computation.duration").tag("operation", "betweenness").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should record snapshot sizes as distributions")
        void snapshotSize() {
            metrics.recordSnapshotSize(100, 250);
            metrics.recordSnapshotSize(300, 50);

            DistributionSummary nodes = registry.find("network.snapshot.nodes").summary();
            DistributionSummary edges = registry.find("network.snapshot.edges").summary();
            assertNotNull(nodes);
            assertEquals(2, nodes.count());
            assertEquals(400.0, nodes.totalAmount());
            assertEquals(250.0, edges.max());
        }

        @Test
        @DisplayName("Should count discovered relationships by change")
        void relationshipsDiscovered() {
            metrics.incrementRelationshipsDiscovered(3, 1);
            metrics.incrementRelationshipsDiscovered(2, 0);

            assertEquals(5.0, registry.find("network.relationships.discovered")
                    .tag("change", "created").counter().count());
            assertEquals(1.0, registry.find("network.relationships.discovered")
                    .tag("change", "updated").counter().count());
        }

        @Test
        @DisplayName("Should count degraded queries by reason")
        void degradedQueries() {
            metrics.incrementDegradedQuery("layout.too_large");
            metrics.incrementDegradedQuery("layout.too_large");
            assertEquals(2.0, registry.find("network.query.degraded")
                    .tag("reason", "layout.too_large").counter().count());
        }
    }
}
