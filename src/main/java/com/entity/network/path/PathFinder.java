package com.entity.network.path;

import com.entity.network.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Hop-bounded path queries over the undirected view of a snapshot. No query
 * ever searches beyond {@link PathConfig#hardMaxDepth()} hops.
 */
public class PathFinder {
    private static final Logger log = LoggerFactory.getLogger(PathFinder.class);

    private final PathConfig config;

    public PathFinder() {
        this(PathConfig.defaults());
    }

    public PathFinder(PathConfig config) {
        this.config = config;
    }

    public PathConfig config() {
        return config;
    }

    public PathResult shortestPath(GraphSnapshot snapshot, String sourceId, String targetId) {
        return shortestPath(snapshot, sourceId, targetId, config.defaultMaxDepth());
    }

    /**
     * Breadth-first search bounded by {@code maxDepth} hops. Among equally short
     * paths the one through lower ids is returned.
     *
     * @throws IllegalArgumentException if maxDepth is outside {@code [1, hardMaxDepth]}
     */
    public PathResult shortestPath(GraphSnapshot snapshot, String sourceId, String targetId, int maxDepth) {
        checkDepth(maxDepth);
        int source = snapshot.indexOf(sourceId);
        int target = snapshot.indexOf(targetId);
        if (source < 0 || target < 0) {
            log.debug("path.unknown-entity scope={} source={} target={}", snapshot.scope(), sourceId, targetId);
            return PathResult.unknownEntity();
        }
        if (source == target) {
            return PathResult.found(List.of(sourceId));
        }
        int n = snapshot.nodeCount();
        int[] parent = new int[n];
        int[] distance = new int[n];
        Arrays.fill(distance, -1);
        distance[source] = 0;
        int[] queue = new int[n];
        int head = 0;
        int tail = 0;
        queue[tail++] = source;
        while (head < tail) {
            int current = queue[head++];
            if (distance[current] == maxDepth) {
                continue;
            }
            for (int next : snapshot.neighbors(current)) {
                if (distance[next] >= 0) {
                    continue;
                }
                distance[next] = distance[current] + 1;
                parent[next] = current;
                if (next == target) {
                    return PathResult.found(trace(snapshot, parent, source, target));
                }
                queue[tail++] = next;
            }
        }
        return PathResult.notFound();
    }

    public PathSequence allPaths(GraphSnapshot snapshot, String sourceId, String targetId) {
        return allPaths(snapshot, sourceId, targetId, config.defaultMaxDepth(), config.defaultLimit());
    }

    /**
     * Simple paths of at most {@code maxDepth} hops, at most
     * {@code min(limit, maxPaths)} of them. Unknown entities yield an empty sequence.
     */
    public PathSequence allPaths(GraphSnapshot snapshot, String sourceId, String targetId, int maxDepth, int limit) {
        checkDepth(maxDepth);
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        int source = snapshot.indexOf(sourceId);
        int target = snapshot.indexOf(targetId);
        if (source < 0 || target < 0) {
            return PathSequence.empty(snapshot);
        }
        return new PathSequence(snapshot, source, target, maxDepth, Math.min(limit, config.maxPaths()));
    }

    private void checkDepth(int maxDepth) {
        if (maxDepth < 1 || maxDepth > config.hardMaxDepth()) {
            throw new IllegalArgumentException("maxDepth must be in [1, " + config.hardMaxDepth()
                    + "], got " + maxDepth);
        }
    }

    private static List<String> trace(GraphSnapshot snapshot, int[] parent, int source, int target) {
        List<String> path = new ArrayList<>();
        for (int node = target; node != source; node = parent[node]) {
            path.add(snapshot.id(node));
        }
        path.add(snapshot.id(source));
        Collections.reverse(path);
        return path;
    }

    /**
     * Hop distances from {@code origin}, -1 beyond {@code maxDepth} or unreachable.
     */
    static int[] boundedDistances(GraphSnapshot snapshot, int origin, int maxDepth) {
        int n = snapshot.nodeCount();
        int[] distance = new int[n];
        Arrays.fill(distance, -1);
        distance[origin] = 0;
        int[] queue = new int[n];
        int head = 0;
        int tail = 0;
        queue[tail++] = origin;
        while (head < tail) {
            int current = queue[head++];
            if (distance[current] == maxDepth) {
                continue;
            }
            for (int next : snapshot.neighbors(current)) {
                if (distance[next] < 0) {
                    distance[next] = distance[current] + 1;
                    queue[tail++] = next;
                }
            }
        }
        return distance;
    }
}
