package com.entity.network.layout;

/**
 * Maps graph size to a layout plan. Pure; larger graphs get fewer iterations
 * and approximate repulsion.
 */
public final class LayoutSizing {

    static final int SMALL_GRAPH_ITERATIONS = 100;
    static final int MEDIUM_GRAPH_ITERATIONS = 50;
    static final int LARGE_GRAPH_ITERATIONS = 30;

    private LayoutSizing() {
    }

    /**
     * @param nodeCount  total nodes in the graph
     * @param requested  iterations asked for by the caller; 0 or less means "as many as allowed"
     */
    public static LayoutPlan plan(int nodeCount, int requested, LayoutConfig config) {
        if (nodeCount <= 1) {
            return new LayoutPlan(0, RepulsionMode.EXACT);
        }
        int cap = iterationCap(nodeCount);
        int iterations = requested <= 0 ? cap : Math.min(requested, cap);
        return new LayoutPlan(iterations, repulsionFor(nodeCount, config));
    }

    public static int iterationCap(int nodeCount) {
        if (nodeCount > 2000) {
            return LARGE_GRAPH_ITERATIONS;
        }
        if (nodeCount > 1000) {
            return MEDIUM_GRAPH_ITERATIONS;
        }
        return SMALL_GRAPH_ITERATIONS;
    }

    public static RepulsionMode repulsionFor(int nodeCount, LayoutConfig config) {
        return nodeCount > config.approximationThreshold() ? RepulsionMode.BARNES_HUT : RepulsionMode.EXACT;
    }

    /**
     * Viewport scale for the final coordinates: more nodes get more room.
     */
    public static double viewportScale(int nodeCount, LayoutConfig config) {
        return config.scale() + 3.0 * nodeCount;
    }
}
