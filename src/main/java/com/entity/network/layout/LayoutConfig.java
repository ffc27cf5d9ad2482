package com.entity.network.layout;

import java.time.Duration;

/**
 * Configuration for layout computation.
 *
 * @param maxNodes               graphs above this size are refused
 * @param approximationThreshold components above this size use Barnes-Hut repulsion
 * @param theta                  Barnes-Hut opening angle; larger is faster and coarser
 * @param scale                  base viewport scale, grown by 3 units per node
 * @param componentPadding       minimum gap between packed components, in simulation units
 * @param attraction             edge attraction coefficient
 * @param repulsion              node repulsion coefficient
 * @param gravity                pull toward the component center
 * @param logAttraction          attraction grows with log(1 + distance) instead of distance
 * @param timeLimit              wall-clock budget for one computation
 * @param defaultSeed            seed used when a caller does not supply one
 */
public record LayoutConfig(
        int maxNodes,
        int approximationThreshold,
        double theta,
        double scale,
        double componentPadding,
        double attraction,
        double repulsion,
        double gravity,
        boolean logAttraction,
        Duration timeLimit,
        long defaultSeed
) {
    public LayoutConfig {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive");
        }
        if (approximationThreshold < 0) {
            throw new IllegalArgumentException("approximationThreshold must be non-negative");
        }
        if (theta <= 0.0 || theta > 2.0) {
            throw new IllegalArgumentException("theta must be in (0, 2]");
        }
        if (scale <= 0.0) {
            throw new IllegalArgumentException("scale must be positive");
        }
        if (componentPadding <= 0.0) {
            throw new IllegalArgumentException("componentPadding must be positive");
        }
        if (attraction <= 0.0 || repulsion <= 0.0 || gravity < 0.0) {
            throw new IllegalArgumentException("force coefficients must be positive");
        }
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
    }

    public static LayoutConfig defaults() {
        return new LayoutConfig(20_000, 500, 1.2, 1000.0, 4.0,
                1.0, 1.0, 1.0, true, Duration.ofSeconds(10), 42L);
    }

    public LayoutConfig withApproximationThreshold(int threshold) {
        return new LayoutConfig(maxNodes, threshold, theta, scale, componentPadding,
                attraction, repulsion, gravity, logAttraction, timeLimit, defaultSeed);
    }

    public LayoutConfig withMaxNodes(int max) {
        return new LayoutConfig(max, approximationThreshold, theta, scale, componentPadding,
                attraction, repulsion, gravity, logAttraction, timeLimit, defaultSeed);
    }

    public LayoutConfig withTimeLimit(Duration limit) {
        return new LayoutConfig(maxNodes, approximationThreshold, theta, scale, componentPadding,
                attraction, repulsion, gravity, logAttraction, limit, defaultSeed);
    }
}
