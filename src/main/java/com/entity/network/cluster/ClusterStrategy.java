package com.entity.network.cluster;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

/**
 * Partitions a snapshot into communities.
 */
public interface ClusterStrategy {

    ClusterAlgorithm algorithm();

    Partition partition(GraphSnapshot snapshot, ComputationBudget budget);
}
