package com.entity.network.cluster;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

import java.util.TreeMap;

/**
 * Louvain community detection on the weighted undirected view.
 *
 * <p>Each level moves nodes one at a time, in index order, to the neighboring
 * community with the largest modularity gain; a node only moves on a strict
 * improvement, and equal gains go to the lower community number. Communities
 * found at one level become the nodes of the next. Stops when a level moves
 * nothing.</p>
 */
public class LouvainClustering implements ClusterStrategy {

    private static final double EPSILON = 1e-12;

    private final ClusterConfig config;

    public LouvainClustering(ClusterConfig config) {
        this.config = config;
    }

    @Override
    public ClusterAlgorithm algorithm() {
        return ClusterAlgorithm.LOUVAIN;
    }

    /**
     * Weighted graph at one aggregation level. {@code loops[i]} is twice the
     * weight of the edges folded inside node i.
     */
    private record Level(int[][] neighbors, double[][] weights, double[] loops) {
        int size() {
            return neighbors.length;
        }

        double degree(int i) {
            double sum = loops[i];
            for (double w : weights[i]) {
                sum += w;
            }
            return sum;
        }
    }

    @Override
    public Partition partition(GraphSnapshot snapshot, ComputationBudget budget) {
        int n = snapshot.nodeCount();
        int[] membership = new int[n];
        for (int i = 0; i < n; i++) {
            membership[i] = i;
        }
        if (n == 0) {
            return new Partition(membership, 0, false);
        }

        int[][] neighbors = new int[n][];
        double[][] weights = new double[n][];
        for (int i = 0; i < n; i++) {
            neighbors[i] = snapshot.neighbors(i).clone();
            weights[i] = snapshot.weights(i).clone();
        }
        Level level = new Level(neighbors, weights, new double[n]);
        boolean truncated = false;

        while (true) {
            int[] community = new int[level.size()];
            MoveOutcome outcome = moveNodes(level, community, budget);
            boolean moved = outcome.moved();
            truncated = outcome.exhausted();
            int count = Modularity.renumber(community);
            for (int i = 0; i < n; i++) {
                membership[i] = community[membership[i]];
            }
            if (!moved || truncated || count == level.size()) {
                return new Partition(membership, count, truncated);
            }
            level = aggregate(level, community, count);
        }
    }

    private record MoveOutcome(boolean moved, boolean exhausted) {
    }

    private MoveOutcome moveNodes(Level level, int[] community, ComputationBudget budget) {
        int size = level.size();
        double[] degree = new double[size];
        double[] total = new double[size];
        double twiceTotal = 0.0;
        for (int i = 0; i < size; i++) {
            community[i] = i;
            degree[i] = level.degree(i);
            total[i] = degree[i];
            twiceTotal += degree[i];
        }
        if (twiceTotal == 0.0) {
            return new MoveOutcome(false, false);
        }

        double[] linkTo = new double[size];
        int[] touched = new int[size];
        boolean movedAny = false;
        for (int sweep = 0; sweep < config.maxLocalMoveSweeps(); sweep++) {
            if (budget.isExpired()) {
                return new MoveOutcome(movedAny, true);
            }
            boolean movedThisSweep = false;
            for (int i = 0; i < size; i++) {
                int current = community[i];
                int touchedCount = 0;
                int[] nbrs = level.neighbors()[i];
                double[] w = level.weights()[i];
                for (int k = 0; k < nbrs.length; k++) {
                    int c = community[nbrs[k]];
                    if (linkTo[c] == 0.0) {
                        touched[touchedCount++] = c;
                    }
                    linkTo[c] += w[k];
                }

                total[current] -= degree[i];
                int best = current;
                double bestGain = linkTo[current] - total[current] * degree[i] / twiceTotal;
                for (int t = 0; t < touchedCount; t++) {
                    int c = touched[t];
                    double gain = linkTo[c] - total[c] * degree[i] / twiceTotal;
                    if (gain > bestGain + EPSILON || (Math.abs(gain - bestGain) <= EPSILON && c < best && best != current)) {
                        best = c;
                        bestGain = gain;
                    }
                }
                total[best] += degree[i];
                if (best != current) {
                    community[i] = best;
                    movedThisSweep = true;
                }
                for (int t = 0; t < touchedCount; t++) {
                    linkTo[touched[t]] = 0.0;
                }
                linkTo[current] = 0.0;
            }
            if (!movedThisSweep) {
                break;
            }
            movedAny = true;
        }
        return new MoveOutcome(movedAny, false);
    }

    private static Level aggregate(Level level, int[] community, int count) {
        double[] loops = new double[count];
        @SuppressWarnings("unchecked")
        TreeMap<Integer, Double>[] links = new TreeMap[count];
        for (int c = 0; c < count; c++) {
            links[c] = new TreeMap<>();
        }
        for (int i = 0; i < level.size(); i++) {
            int ci = community[i];
            loops[ci] += level.loops()[i];
            int[] nbrs = level.neighbors()[i];
            double[] w = level.weights()[i];
            for (int k = 0; k < nbrs.length; k++) {
                int cj = community[nbrs[k]];
                if (ci == cj) {
                    loops[ci] += w[k];
                } else {
                    links[ci].merge(cj, w[k], Double::sum);
                }
            }
        }
        int[][] neighbors = new int[count][];
        double[][] weights = new double[count][];
        for (int c = 0; c < count; c++) {
            neighbors[c] = links[c].keySet().stream().mapToInt(Integer::intValue).toArray();
            weights[c] = links[c].values().stream().mapToDouble(Double::doubleValue).toArray();
        }
        return new Level(neighbors, weights, loops);
    }
}
