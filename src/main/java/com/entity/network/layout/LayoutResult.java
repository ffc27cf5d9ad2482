package com.entity.network.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Node coordinates for a snapshot.
 *
 * @param positions   entity id to coordinates, in ascending id order
 * @param algorithm   algorithm used
 * @param seed        seed used for initial placement
 * @param iterations  most iterations run by any component
 * @param approximate true if Barnes-Hut repulsion was used for any component
 * @param truncated   true if the time budget ran out before all iterations completed
 */
public record LayoutResult(
        Map<String, Point> positions,
        LayoutAlgorithm algorithm,
        long seed,
        int iterations,
        boolean approximate,
        boolean truncated
) {
    public LayoutResult {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    public static LayoutResult empty(LayoutAlgorithm algorithm, long seed) {
        return new LayoutResult(Map.of(), algorithm, seed, 0, false, false);
    }

    public Optional<Point> position(String entityId) {
        return Optional.ofNullable(positions.get(entityId));
    }

    public int size() {
        return positions.size();
    }
}
