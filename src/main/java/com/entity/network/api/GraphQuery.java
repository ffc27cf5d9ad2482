package com.entity.network.api;

import com.entity.network.layout.LayoutAlgorithm;

/**
 * Parameters of a composite graph query.
 *
 * @param includePositions attach layout coordinates to nodes
 * @param includeClusters  detect communities and attach cluster ids to nodes
 * @param includeIsolated  keep nodes without any edge in the node list
 * @param minClusterSize   smallest community reported as a cluster
 * @param iterations       requested layout iterations, 0 for the size-dependent cap
 * @param maxPathDepth     depth bound for path queries issued with this query
 * @param limit            size of ranked lists issued with this query
 */
public record GraphQuery(
        boolean includePositions,
        boolean includeClusters,
        boolean includeIsolated,
        int minClusterSize,
        LayoutAlgorithm layoutAlgorithm,
        int iterations,
        long seed,
        int maxPathDepth,
        int limit
) {
    public GraphQuery {
        if (minClusterSize < 1) {
            throw new IllegalArgumentException("minClusterSize must be >= 1");
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        if (maxPathDepth < 1) {
            throw new IllegalArgumentException("maxPathDepth must be >= 1");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        layoutAlgorithm = layoutAlgorithm != null ? layoutAlgorithm : LayoutAlgorithm.FORCE_DIRECTED;
    }

    /**
     * Positions on, clusters off, isolated nodes left out; force-directed layout with seed 42,
     * clusters of at least 3, paths up to 6 hops, 20 ranked entries.
     */
    public static GraphQuery defaults() {
        return new GraphQuery(true, false, false, 3, LayoutAlgorithm.FORCE_DIRECTED, 0, 42L, 6, 20);
    }

    public GraphQuery withPositions(boolean value) {
        return new GraphQuery(value, includeClusters, includeIsolated, minClusterSize, layoutAlgorithm,
                iterations, seed, maxPathDepth, limit);
    }

    public GraphQuery withClusters(boolean value) {
        return new GraphQuery(includePositions, value, includeIsolated, minClusterSize, layoutAlgorithm,
                iterations, seed, maxPathDepth, limit);
    }

    public GraphQuery withIsolated(boolean value) {
        return new GraphQuery(includePositions, includeClusters, value, minClusterSize, layoutAlgorithm,
                iterations, seed, maxPathDepth, limit);
    }

    public GraphQuery withMinClusterSize(int size) {
        return new GraphQuery(includePositions, includeClusters, includeIsolated, size, layoutAlgorithm,
                iterations, seed, maxPathDepth, limit);
    }

    public GraphQuery withLayout(LayoutAlgorithm algorithm, long layoutSeed) {
        return new GraphQuery(includePositions, includeClusters, includeIsolated, minClusterSize, algorithm,
                iterations, layoutSeed, maxPathDepth, limit);
    }

    public GraphQuery withIterations(int count) {
        return new GraphQuery(includePositions, includeClusters, includeIsolated, minClusterSize, layoutAlgorithm,
                count, seed, maxPathDepth, limit);
    }

    public GraphQuery withMaxPathDepth(int depth) {
        return new GraphQuery(includePositions, includeClusters, includeIsolated, minClusterSize, layoutAlgorithm,
                iterations, seed, depth, limit);
    }

    public GraphQuery withLimit(int value) {
        return new GraphQuery(includePositions, includeClusters, includeIsolated, minClusterSize, layoutAlgorithm,
                iterations, seed, maxPathDepth, value);
    }
}
