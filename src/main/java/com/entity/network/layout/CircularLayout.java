package com.entity.network.layout;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

import java.util.SplittableRandom;

/**
 * Places component members evenly on a circle in ascending id order.
 */
public class CircularLayout implements LayoutStrategy {

    @Override
    public LayoutAlgorithm algorithm() {
        return LayoutAlgorithm.CIRCULAR;
    }

    @Override
    public ComponentLayout layout(GraphSnapshot snapshot, int[] members, LayoutPlan plan,
                                  SplittableRandom random, ComputationBudget budget) {
        int m = members.length;
        if (m == 1) {
            return ComponentLayout.single();
        }
        double radius = Math.max(1.0, m / Math.PI);
        double[] x = new double[m];
        double[] y = new double[m];
        for (int i = 0; i < m; i++) {
            double angle = 2.0 * Math.PI * i / m;
            x[i] = radius * Math.cos(angle);
            y[i] = radius * Math.sin(angle);
        }
        return new ComponentLayout(x, y, 0, false, false);
    }
}
