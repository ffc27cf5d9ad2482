package com.entity.network.api;

import com.entity.network.cluster.Cluster;
import com.entity.network.core.model.Scope;
import com.entity.network.snapshot.GraphStats;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node-link view of a scope, as consumed by a visualization client.
 *
 * @param layoutApproximate the layout used Barnes-Hut repulsion
 * @param layoutTruncated   the layout ran out of budget before its last iteration
 * @param warnings          views that were skipped or degraded, in the order they happened
 * @param timingsMs         wall time per phase
 */
public record NetworkGraph(
        Scope scope,
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        List<Cluster> clusters,
        GraphStats stats,
        boolean layoutApproximate,
        boolean layoutTruncated,
        List<String> warnings,
        Map<String, Long> timingsMs,
        Instant snapshotLoadedAt
) {
    public NetworkGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        clusters = List.copyOf(clusters);
        warnings = List.copyOf(warnings);
        timingsMs = Collections.unmodifiableMap(new LinkedHashMap<>(timingsMs));
    }

    public boolean isDegraded() {
        return !warnings.isEmpty();
    }
}
