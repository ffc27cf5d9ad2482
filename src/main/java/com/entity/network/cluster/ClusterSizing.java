package com.entity.network.cluster;

/**
 * Chooses the community detection algorithm from graph size. Pure.
 */
public final class ClusterSizing {

    private ClusterSizing() {
    }

    public static ClusterAlgorithm choose(int nodeCount, ClusterConfig config) {
        return nodeCount <= config.refinementThreshold()
                ? ClusterAlgorithm.LOUVAIN
                : ClusterAlgorithm.LABEL_PROPAGATION;
    }
}
