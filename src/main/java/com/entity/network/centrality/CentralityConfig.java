package com.entity.network.centrality;

import java.time.Duration;

/**
 * Configuration for centrality rankings.
 *
 * @param exactBetweennessLimit graphs above this size get sampled betweenness
 * @param maxBetweennessNodes   graphs above this size are refused for betweenness
 * @param pivotCount            number of sampled sources for approximate betweenness
 * @param damping               importance damping factor
 * @param tolerance             importance convergence tolerance per node
 * @param maxIterations         importance iteration cap
 * @param seed                  seed for pivot sampling
 * @param defaultLimit          ranking length used when a caller does not supply one
 * @param timeLimit             wall-clock budget for one computation
 */
public record CentralityConfig(
        int exactBetweennessLimit,
        int maxBetweennessNodes,
        int pivotCount,
        double damping,
        double tolerance,
        int maxIterations,
        long seed,
        int defaultLimit,
        Duration timeLimit
) {
    public CentralityConfig {
        if (exactBetweennessLimit < 0 || maxBetweennessNodes <= 0) {
            throw new IllegalArgumentException("betweenness limits must be positive");
        }
        if (exactBetweennessLimit > maxBetweennessNodes) {
            throw new IllegalArgumentException("exactBetweennessLimit must not exceed maxBetweennessNodes");
        }
        if (pivotCount <= 0) {
            throw new IllegalArgumentException("pivotCount must be positive");
        }
        if (damping <= 0.0 || damping >= 1.0) {
            throw new IllegalArgumentException("damping must be in (0, 1)");
        }
        if (tolerance <= 0.0 || maxIterations <= 0) {
            throw new IllegalArgumentException("tolerance and maxIterations must be positive");
        }
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive");
        }
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
    }

    public static CentralityConfig defaults() {
        return new CentralityConfig(2000, 20_000, 256, 0.85, 1e-6, 100, 42L, 20, Duration.ofSeconds(15));
    }

    public CentralityConfig withBetweennessLimits(int exact, int max) {
        return new CentralityConfig(exact, max, pivotCount, damping, tolerance, maxIterations,
                seed, defaultLimit, timeLimit);
    }

    public CentralityConfig withTimeLimit(Duration limit) {
        return new CentralityConfig(exactBetweennessLimit, maxBetweennessNodes, pivotCount, damping,
                tolerance, maxIterations, seed, defaultLimit, limit);
    }
}
