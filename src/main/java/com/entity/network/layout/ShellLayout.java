package com.entity.network.layout;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Concentric circles grouped by degree. Up to five degree bands; the lowest band
 * is the innermost shell. A shell holding a single node sits at the center.
 */
public class ShellLayout implements LayoutStrategy {

    static final int MAX_SHELLS = 5;

    @Override
    public LayoutAlgorithm algorithm() {
        return LayoutAlgorithm.SHELL;
    }

    @Override
    public ComponentLayout layout(GraphSnapshot snapshot, int[] members, LayoutPlan plan,
                                  SplittableRandom random, ComputationBudget budget) {
        int m = members.length;
        if (m == 1) {
            return ComponentLayout.single();
        }
        int maxDegree = 0;
        for (int member : members) {
            maxDegree = Math.max(maxDegree, snapshot.degree(member));
        }
        int bands = Math.min(MAX_SHELLS, maxDegree + 1);
        List<List<Integer>> shells = new ArrayList<>();
        for (int b = 0; b < bands; b++) {
            shells.add(new ArrayList<>());
        }
        for (int i = 0; i < m; i++) {
            int band = Math.min(MAX_SHELLS - 1, snapshot.degree(members[i]) * (MAX_SHELLS - 1) / (maxDegree + 1));
            shells.get(Math.min(band, bands - 1)).add(i);
        }
        shells.removeIf(List::isEmpty);

        double[] x = new double[m];
        double[] y = new double[m];
        double radiusStep = Math.max(1.0, Math.sqrt(m));
        boolean centerFirst = shells.get(0).size() == 1;
        for (int s = 0; s < shells.size(); s++) {
            List<Integer> shell = shells.get(s);
            double radius = centerFirst ? s * radiusStep : (s + 1) * radiusStep;
            for (int k = 0; k < shell.size(); k++) {
                double angle = 2.0 * Math.PI * k / shell.size();
                x[shell.get(k)] = radius * Math.cos(angle);
                y[shell.get(k)] = radius * Math.sin(angle);
            }
        }
        return new ComponentLayout(x, y, 0, false, false);
    }
}
