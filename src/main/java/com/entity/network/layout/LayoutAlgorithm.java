package com.entity.network.layout;

public enum LayoutAlgorithm {
    /** Log-attraction force simulation. */
    FORCE_DIRECTED,
    /** Nodes of each component on a circle. */
    CIRCULAR,
    /** Concentric circles of nodes grouped by degree. */
    SHELL
}
