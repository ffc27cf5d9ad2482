package com.entity.network.path;

/**
 * Bounds for path queries.
 *
 * @param defaultMaxDepth hop bound used when a caller does not supply one
 * @param hardMaxDepth    largest hop bound a caller may request
 * @param defaultLimit    number of alternate paths returned when a caller does not supply a limit
 * @param maxPaths        absolute cap on alternate paths per query
 */
public record PathConfig(int defaultMaxDepth, int hardMaxDepth, int defaultLimit, int maxPaths) {

    public PathConfig {
        if (hardMaxDepth < 1) {
            throw new IllegalArgumentException("hardMaxDepth must be at least 1");
        }
        if (defaultMaxDepth < 1 || defaultMaxDepth > hardMaxDepth) {
            throw new IllegalArgumentException("defaultMaxDepth must be in [1, hardMaxDepth]");
        }
        if (defaultLimit < 1 || maxPaths < 1) {
            throw new IllegalArgumentException("path limits must be positive");
        }
    }

    public static PathConfig defaults() {
        return new PathConfig(6, 10, 10, 100);
    }
}
