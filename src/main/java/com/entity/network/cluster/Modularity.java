package com.entity.network.cluster;

import com.entity.network.snapshot.GraphSnapshot;

import java.util.Arrays;

/**
 * Weighted Newman modularity of a partition.
 */
public final class Modularity {

    private Modularity() {
    }

    public static double of(GraphSnapshot snapshot, int[] communityOf, int communityCount) {
        int n = snapshot.nodeCount();
        double twiceTotal = 0.0;
        for (int i = 0; i < n; i++) {
            twiceTotal += snapshot.strength(i);
        }
        if (twiceTotal == 0.0) {
            return 0.0;
        }
        double[] inside = new double[communityCount];
        double[] total = new double[communityCount];
        for (int i = 0; i < n; i++) {
            int c = communityOf[i];
            total[c] += snapshot.strength(i);
            int[] neighbors = snapshot.neighbors(i);
            double[] weights = snapshot.weights(i);
            for (int k = 0; k < neighbors.length; k++) {
                if (communityOf[neighbors[k]] == c) {
                    inside[c] += weights[k];
                }
            }
        }
        double q = 0.0;
        for (int c = 0; c < communityCount; c++) {
            double share = total[c] / twiceTotal;
            q += inside[c] / twiceTotal - share * share;
        }
        return q;
    }

    /**
     * Renumbers labels densely in order of first appearance by node index.
     *
     * @return the number of distinct communities
     */
    static int renumber(int[] labels) {
        int[] mapping = new int[labels.length];
        Arrays.fill(mapping, -1);
        int next = 0;
        for (int i = 0; i < labels.length; i++) {
            int label = labels[i];
            if (mapping[label] < 0) {
                mapping[label] = next++;
            }
            labels[i] = mapping[label];
        }
        return next;
    }
}
