package com.entity.network.cluster;

public enum ClusterAlgorithm {
    /** Modularity optimization by local moves and community aggregation. */
    LOUVAIN,
    /** Seeded asynchronous label propagation, near-linear per round. */
    LABEL_PROPAGATION
}
