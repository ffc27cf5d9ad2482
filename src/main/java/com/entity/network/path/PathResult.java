package com.entity.network.path;

import java.util.List;

/**
 * Outcome of a shortest-path query. {@code path} lists entity ids from source to
 * target and is empty unless the outcome is {@link PathOutcome#FOUND}.
 */
public record PathResult(PathOutcome outcome, List<String> path) {

    public PathResult {
        path = List.copyOf(path);
    }

    public static PathResult found(List<String> path) {
        return new PathResult(PathOutcome.FOUND, path);
    }

    public static PathResult notFound() {
        return new PathResult(PathOutcome.NOT_FOUND, List.of());
    }

    public static PathResult unknownEntity() {
        return new PathResult(PathOutcome.UNKNOWN_ENTITY, List.of());
    }

    public boolean isFound() {
        return outcome == PathOutcome.FOUND;
    }

    public int hops() {
        return path.isEmpty() ? 0 : path.size() - 1;
    }
}
