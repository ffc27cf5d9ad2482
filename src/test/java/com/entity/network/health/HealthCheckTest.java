package com.entity.network.health;

import com.entity.network.cache.AnalyticsCache;
import com.entity.network.cache.CacheConfig;
import com.entity.network.cache.CacheKey;
import com.entity.network.cache.CacheTier;
import com.entity.network.core.model.Scope;
import com.entity.network.store.GraphStore;
import com.entity.network.store.InMemoryGraphStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private static HealthCheck fixed(String name, HealthStatus status) {
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return status;
            }
        };
    }

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should create the matching status")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.down("Store unreachable").isDown());
            assertTrue(HealthStatus.degraded("Cache near capacity").isDegraded());
        }

        @Test
        @DisplayName("withDetail() should add key-value detail without changing the original")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus status = base.withDetail("latencyMs", 42L).withDetail("store", "InMemoryGraphStore");

            assertEquals(42L, status.details().get("latencyMs"));
            assertEquals("InMemoryGraphStore", status.details().get("store"));
            assertTrue(base.details().isEmpty());
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry is UP")
        void emptyRegistry() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Aggregate takes the worst status")
        void worstStatusWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));
            assertTrue(registry.checkAll().isDegraded());

            registry.register(fixed("c", HealthStatus.down("gone")));
            HealthStatus aggregate = registry.checkAll();
            assertTrue(aggregate.isDown());
            assertEquals("c: gone", aggregate.message());
            assertEquals(3, aggregate.details().size());
        }

        @Test
        @DisplayName("A throwing check counts as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });
            HealthStatus aggregate = registry.checkAll();
            assertTrue(aggregate.isDown());
            @SuppressWarnings("unchecked")
            Map<String, Object> broken = (Map<String, Object>) aggregate.details().get("broken");
            assertEquals("DOWN", broken.get("status"));
        }

        @Test
        @DisplayName("Null checks are ignored")
        void nullIgnored() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(null);
            assertEquals(0, registry.size());
        }
    }

    @Nested
    @DisplayName("Component checks")
    class ComponentTests {

        @Test
        @DisplayName("Store check reflects availability")
        void storeCheck() {
            assertTrue(new StoreHealthCheck(new InMemoryGraphStore()).check().isUp());

            GraphStore down = mock(GraphStore.class);
            when(down.isAvailable()).thenReturn(false);
            assertTrue(new StoreHealthCheck(down).check().isDown());

            GraphStore failing = mock(GraphStore.class);
            when(failing.isAvailable()).thenThrow(new IllegalStateException("driver closed"));
            HealthStatus status = new StoreHealthCheck(failing).check();
            assertTrue(status.isDown());
            assertEquals("IllegalStateException", status.details().get("error"));
        }

        @Test
        @DisplayName("Cache check degrades near capacity")
        void cacheCheck() {
            AnalyticsCache cache = new AnalyticsCache(CacheConfig.defaults().withMaxSize(1));
            CacheHealthCheck check = new CacheHealthCheck(cache);
            assertTrue(check.check().isUp());

            Scope scope = Scope.of("s");
            for (CacheTier tier : CacheTier.values()) {
                cache.get(CacheKey.of(scope, tier), () -> "v");
            }
            HealthStatus status = check.check();
            assertTrue(status.isDegraded());
            assertEquals(3L, status.details().get("size"));
        }

        @Test
        @DisplayName("Memory check reports heap usage")
        void memoryCheck() {
            HealthStatus status = new MemoryHealthCheck().check();
            assertNotNull(status.status());
            assertFalse(status.details().isEmpty());
        }

        @Test
        @DisplayName("Memory check grades heap usage against its thresholds")
        void memoryThresholds() {
            assertTrue(memoryCheckAt(500).check().isUp());
            assertTrue(memoryCheckAt(850).check().isDegraded());

            HealthStatus full = memoryCheckAt(960).check();
            assertTrue(full.isDown());
            assertEquals(96.0, full.details().get("heapUsagePercent"));
        }

        @Test
        @DisplayName("Memory thresholds must be ordered")
        void memoryThresholdValidation() {
            MemoryMXBean bean = mock(MemoryMXBean.class);
            assertThrows(IllegalArgumentException.class, () -> new MemoryHealthCheck(bean, 0.9, 0.8));
        }

        private MemoryHealthCheck memoryCheckAt(long usedMb) {
            long mb = 1024L * 1024L;
            MemoryMXBean bean = mock(MemoryMXBean.class);
            when(bean.getHeapMemoryUsage()).thenReturn(new MemoryUsage(0, usedMb * mb, 1000 * mb, 1000 * mb));
            return new MemoryHealthCheck(bean, 0.80, 0.95);
        }
    }
}
