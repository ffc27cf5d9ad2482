package com.entity.network.layout;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

import java.util.SplittableRandom;

/**
 * Places the members of one connected component in local coordinates.
 */
public interface LayoutStrategy {

    LayoutAlgorithm algorithm();

    /**
     * @param members sorted snapshot indices of the component
     */
    ComponentLayout layout(GraphSnapshot snapshot, int[] members, LayoutPlan plan,
                           SplittableRandom random, ComputationBudget budget);
}
