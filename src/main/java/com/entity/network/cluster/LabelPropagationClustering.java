package com.entity.network.cluster;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

import java.util.SplittableRandom;

/**
 * Asynchronous label propagation. Each round visits nodes in an order shuffled
 * from the configured seed; a node adopts the label with the greatest total
 * edge weight among its neighbors, keeping its own label when that is among the
 * best and otherwise taking the smallest. Converges when a round changes nothing.
 */
public class LabelPropagationClustering implements ClusterStrategy {

    private final ClusterConfig config;

    public LabelPropagationClustering(ClusterConfig config) {
        this.config = config;
    }

    @Override
    public ClusterAlgorithm algorithm() {
        return ClusterAlgorithm.LABEL_PROPAGATION;
    }

    @Override
    public Partition partition(GraphSnapshot snapshot, ComputationBudget budget) {
        int n = snapshot.nodeCount();
        int[] labels = new int[n];
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            labels[i] = i;
            order[i] = i;
        }
        SplittableRandom random = new SplittableRandom(config.seed());
        double[] score = new double[n];
        int[] touched = new int[n];
        boolean converged = false;

        for (int round = 0; round < config.maxPropagationRounds(); round++) {
            if (budget.isExpired()) {
                break;
            }
            shuffle(order, random);
            boolean changed = false;
            for (int i : order) {
                int[] neighbors = snapshot.neighbors(i);
                if (neighbors.length == 0) {
                    continue;
                }
                double[] weights = snapshot.weights(i);
                int touchedCount = 0;
                for (int k = 0; k < neighbors.length; k++) {
                    int label = labels[neighbors[k]];
                    if (score[label] == 0.0) {
                        touched[touchedCount++] = label;
                    }
                    score[label] += weights[k];
                }
                double best = 0.0;
                for (int t = 0; t < touchedCount; t++) {
                    best = Math.max(best, score[touched[t]]);
                }
                int chosen = labels[i];
                if (score[chosen] < best) {
                    chosen = Integer.MAX_VALUE;
                    for (int t = 0; t < touchedCount; t++) {
                        int label = touched[t];
                        if (score[label] == best && label < chosen) {
                            chosen = label;
                        }
                    }
                }
                for (int t = 0; t < touchedCount; t++) {
                    score[touched[t]] = 0.0;
                }
                if (chosen != labels[i]) {
                    labels[i] = chosen;
                    changed = true;
                }
            }
            if (!changed) {
                converged = true;
                break;
            }
        }
        int count = Modularity.renumber(labels);
        return new Partition(labels, count, !converged && n > 0);
    }

    private static void shuffle(int[] values, SplittableRandom random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
