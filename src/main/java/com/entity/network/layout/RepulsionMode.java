package com.entity.network.layout;

/**
 * How pairwise node repulsion is evaluated in a force simulation.
 */
public enum RepulsionMode {
    /** Every pair, quadratic in node count. */
    EXACT,
    /** Quad-tree aggregation of distant nodes. */
    BARNES_HUT
}
