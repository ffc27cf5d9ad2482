package com.entity.network.layout;

/**
 * Iteration count and repulsion mode chosen for a graph of a given size.
 */
public record LayoutPlan(int iterations, RepulsionMode repulsion) {

    public LayoutPlan {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be non-negative");
        }
        if (repulsion == null) {
            throw new IllegalArgumentException("repulsion is required");
        }
    }

    public boolean approximate() {
        return repulsion == RepulsionMode.BARNES_HUT;
    }
}
