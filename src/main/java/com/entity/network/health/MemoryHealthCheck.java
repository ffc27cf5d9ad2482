package com.entity.network.health;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Heap headroom for snapshot builds and layouts. Snapshots are held in memory per scope,
 * so a nearly full heap means the next cold load may fail.
 */
public class MemoryHealthCheck implements HealthCheck {

    static final double DEFAULT_DEGRADED_RATIO = 0.80;
    static final double DEFAULT_DOWN_RATIO = 0.95;

    private static final long MB = 1024L * 1024L;

    private final MemoryMXBean memoryBean;
    private final double degradedRatio;
    private final double downRatio;

    public MemoryHealthCheck() {
        this(ManagementFactory.getMemoryMXBean(), DEFAULT_DEGRADED_RATIO, DEFAULT_DOWN_RATIO);
    }

    public MemoryHealthCheck(MemoryMXBean memoryBean, double degradedRatio, double downRatio) {
        if (degradedRatio <= 0 || downRatio > 1 || degradedRatio >= downRatio) {
            throw new IllegalArgumentException(
                    "need 0 < degradedRatio < downRatio <= 1, got " + degradedRatio + " and " + downRatio);
        }
        this.memoryBean = memoryBean;
        this.degradedRatio = degradedRatio;
        this.downRatio = downRatio;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        // max is -1 when the heap is unbounded
        long limit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double ratio = limit > 0 ? (double) heap.getUsed() / limit : 0.0;
        String percent = String.format("%.1f%%", ratio * 100);

        HealthStatus status;
        if (ratio >= downRatio) {
            status = HealthStatus.down("No heap headroom for snapshot loads: " + percent);
        } else if (ratio >= degradedRatio) {
            status = HealthStatus.degraded("Heap usage high: " + percent);
        } else {
            status = HealthStatus.up();
        }
        return status
                .withDetail("heapUsedMB", heap.getUsed() / MB)
                .withDetail("heapLimitMB", limit / MB)
                .withDetail("heapUsagePercent", Math.round(ratio * 1000.0) / 10.0);
    }
}
