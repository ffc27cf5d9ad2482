package com.entity.network.path;

import com.entity.network.snapshot.GraphSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Finite, lazily produced sequence of simple paths between two entities.
 *
 * <p>Paths are generated depth-first with neighbors in ascending id order, so the
 * order is deterministic. Each call to {@link #iterator()} restarts the search.
 * Branches that cannot reach the target within the remaining hops are pruned
 * using hop distances from the target.</p>
 */
public final class PathSequence implements Iterable<List<String>> {

    private final GraphSnapshot snapshot;
    private final int source;
    private final int target;
    private final int maxDepth;
    private final int limit;
    private final int[] distanceToTarget;

    PathSequence(GraphSnapshot snapshot, int source, int target, int maxDepth, int limit) {
        this.snapshot = snapshot;
        this.source = source;
        this.target = target;
        this.maxDepth = maxDepth;
        this.limit = limit;
        this.distanceToTarget = source >= 0 && target >= 0
                ? PathFinder.boundedDistances(snapshot, target, maxDepth)
                : null;
    }

    static PathSequence empty(GraphSnapshot snapshot) {
        return new PathSequence(snapshot, -1, -1, 0, 0);
    }

    public int limit() {
        return limit;
    }

    public List<List<String>> toList() {
        List<List<String>> paths = new ArrayList<>();
        for (List<String> path : this) {
            paths.add(path);
        }
        return paths;
    }

    @Override
    public Iterator<List<String>> iterator() {
        if (source < 0 || target < 0 || limit == 0) {
            return Collections.emptyIterator();
        }
        if (source == target) {
            return List.of(List.of(snapshot.id(source))).iterator();
        }
        return new DepthFirstIterator();
    }

    private final class DepthFirstIterator implements Iterator<List<String>> {
        private final int[] path = new int[maxDepth + 1];
        private final int[] cursor = new int[maxDepth + 1];
        private final boolean[] onPath = new boolean[snapshot.nodeCount()];
        private int depth;
        private int emitted;
        private List<String> pending;

        DepthFirstIterator() {
            path[0] = source;
            onPath[source] = true;
            depth = 0;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && emitted < limit) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public List<String> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<String> result = pending;
            pending = null;
            emitted++;
            return result;
        }

        private List<String> advance() {
            while (depth >= 0) {
                int current = path[depth];
                int[] neighbors = snapshot.neighbors(current);
                if (depth < maxDepth && cursor[depth] < neighbors.length) {
                    int next = neighbors[cursor[depth]++];
                    if (onPath[next]) {
                        continue;
                    }
                    int remaining = distanceToTarget[next];
                    if (remaining < 0 || depth + 1 + remaining > maxDepth) {
                        continue;
                    }
                    if (next == target) {
                        return materialize(next);
                    }
                    depth++;
                    path[depth] = next;
                    cursor[depth] = 0;
                    onPath[next] = true;
                    continue;
                }
                onPath[current] = false;
                depth--;
            }
            return null;
        }

        private List<String> materialize(int last) {
            List<String> ids = new ArrayList<>(depth + 2);
            for (int index : Arrays.copyOf(path, depth + 1)) {
                ids.add(snapshot.id(index));
            }
            ids.add(snapshot.id(last));
            return List.copyOf(ids);
        }
    }
}
