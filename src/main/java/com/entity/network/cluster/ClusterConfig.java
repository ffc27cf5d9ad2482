package com.entity.network.cluster;

import java.time.Duration;

/**
 * Configuration for community detection.
 *
 * @param refinementThreshold   graphs at or below this size use Louvain, larger ones label propagation
 * @param maxNodes              graphs above this size are refused
 * @param maxLocalMoveSweeps    cap on local-move sweeps per Louvain level
 * @param maxPropagationRounds  cap on label propagation rounds
 * @param seed                  seed for the label propagation visiting order
 * @param defaultMinSize        minimum cluster size used when a caller does not supply one
 * @param timeLimit             wall-clock budget for one computation
 */
public record ClusterConfig(
        int refinementThreshold,
        int maxNodes,
        int maxLocalMoveSweeps,
        int maxPropagationRounds,
        long seed,
        int defaultMinSize,
        Duration timeLimit
) {
    public ClusterConfig {
        if (refinementThreshold < 0) {
            throw new IllegalArgumentException("refinementThreshold must be non-negative");
        }
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive");
        }
        if (maxLocalMoveSweeps <= 0 || maxPropagationRounds <= 0) {
            throw new IllegalArgumentException("iteration caps must be positive");
        }
        if (defaultMinSize < 1) {
            throw new IllegalArgumentException("defaultMinSize must be at least 1");
        }
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
    }

    public static ClusterConfig defaults() {
        return new ClusterConfig(1000, 50_000, 50, 100, 42L, 3, Duration.ofSeconds(10));
    }

    public ClusterConfig withRefinementThreshold(int threshold) {
        return new ClusterConfig(threshold, maxNodes, maxLocalMoveSweeps, maxPropagationRounds,
                seed, defaultMinSize, timeLimit);
    }

    public ClusterConfig withMaxNodes(int max) {
        return new ClusterConfig(refinementThreshold, max, maxLocalMoveSweeps, maxPropagationRounds,
                seed, defaultMinSize, timeLimit);
    }

    public ClusterConfig withTimeLimit(Duration limit) {
        return new ClusterConfig(refinementThreshold, maxNodes, maxLocalMoveSweeps, maxPropagationRounds,
                seed, defaultMinSize, limit);
    }
}
