package com.entity.network.cluster;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Communities of a snapshot. Every node is either a member of exactly one
 * cluster or listed as unclustered.
 *
 * @param clusters    clusters at or above the minimum size, largest first
 * @param unclustered ids of nodes whose community was below the minimum size
 * @param algorithm   algorithm the sizing rule selected
 * @param modularity  modularity of the full partition, small communities included
 * @param truncated   true if the algorithm stopped on its budget
 */
public record ClusterResult(
        List<Cluster> clusters,
        List<String> unclustered,
        ClusterAlgorithm algorithm,
        double modularity,
        boolean truncated
) {
    public ClusterResult {
        clusters = List.copyOf(clusters);
        unclustered = List.copyOf(unclustered);
    }

    public static ClusterResult empty(ClusterAlgorithm algorithm) {
        return new ClusterResult(List.of(), List.of(), algorithm, 0.0, false);
    }

    public Optional<String> clusterOf(String entityId) {
        for (Cluster cluster : clusters) {
            if (cluster.members().contains(entityId)) {
                return Optional.of(cluster.id());
            }
        }
        return Optional.empty();
    }

    /**
     * Entity id to cluster id for every clustered node.
     */
    public Map<String, String> assignments() {
        Map<String, String> result = new HashMap<>();
        for (Cluster cluster : clusters) {
            for (String member : cluster.members()) {
                result.put(member, cluster.id());
            }
        }
        return result;
    }

    public int clusteredCount() {
        return clusters.stream().mapToInt(Cluster::size).sum();
    }
}
