package com.entity.network.layout;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.snapshot.GraphSnapshot;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Force simulation in the ForceAtlas style.
 *
 * <ul>
 *   <li>Repulsion between every pair: {@code kr * (deg_i + 1)(deg_j + 1) / d}, exact or Barnes-Hut.</li>
 *   <li>Attraction along edges: {@code ka * w * log(1 + d)} in log mode, {@code ka * w * d} otherwise.</li>
 *   <li>Gravity toward the component center: {@code kg * (deg + 1)}.</li>
 * </ul>
 * Per-iteration displacement is capped by a temperature that cools linearly.
 */
public class ForceDirectedLayout implements LayoutStrategy {

    private static final double MIN_DISTANCE = 1e-6;
    private static final double FINAL_TEMPERATURE_RATIO = 0.01;

    private final LayoutConfig config;

    public ForceDirectedLayout(LayoutConfig config) {
        this.config = config;
    }

    @Override
    public LayoutAlgorithm algorithm() {
        return LayoutAlgorithm.FORCE_DIRECTED;
    }

    @Override
    public ComponentLayout layout(GraphSnapshot snapshot, int[] members, LayoutPlan plan,
                                  SplittableRandom random, ComputationBudget budget) {
        int m = members.length;
        if (m == 1) {
            return ComponentLayout.single();
        }
        boolean approximate = plan.approximate();

        double spread = Math.sqrt(m) * 2.0;
        double[] x = new double[m];
        double[] y = new double[m];
        double[] mass = new double[m];
        for (int i = 0; i < m; i++) {
            x[i] = random.nextDouble(-spread, spread);
            y[i] = random.nextDouble(-spread, spread);
            mass[i] = snapshot.degree(members[i]) + 1.0;
        }

        // Local edge list, each undirected edge once
        int[][] localNeighbors = new int[m][];
        for (int i = 0; i < m; i++) {
            int[] global = snapshot.neighbors(members[i]);
            localNeighbors[i] = new int[global.length];
            for (int k = 0; k < global.length; k++) {
                localNeighbors[i][k] = Arrays.binarySearch(members, global[k]);
            }
        }

        double[] fx = new double[m];
        double[] fy = new double[m];
        double[] force = new double[2];
        double initialTemperature = spread;
        int iterations = plan.iterations();
        int ran = 0;
        boolean truncated = false;

        for (int iteration = 0; iteration < iterations; iteration++) {
            if (budget.isExpired()) {
                truncated = true;
                break;
            }
            Arrays.fill(fx, 0.0);
            Arrays.fill(fy, 0.0);

            if (approximate) {
                QuadTree tree = new QuadTree(x, y, mass);
                for (int i = 0; i < m; i++) {
                    force[0] = 0.0;
                    force[1] = 0.0;
                    tree.accumulateRepulsion(i, config.repulsion(), config.theta(), force);
                    fx[i] += force[0];
                    fy[i] += force[1];
                }
            } else {
                for (int i = 0; i < m; i++) {
                    for (int j = i + 1; j < m; j++) {
                        force[0] = 0.0;
                        force[1] = 0.0;
                        addRepulsion(x[i], y[i], x[j], y[j], config.repulsion() * mass[i] * mass[j], i, j, force);
                        fx[i] += force[0];
                        fy[i] += force[1];
                        fx[j] -= force[0];
                        fy[j] -= force[1];
                    }
                }
            }

            for (int i = 0; i < m; i++) {
                double[] w = snapshot.weights(members[i]);
                for (int k = 0; k < localNeighbors[i].length; k++) {
                    int j = localNeighbors[i][k];
                    if (j <= i) {
                        continue;
                    }
                    double dx = x[j] - x[i];
                    double dy = y[j] - y[i];
                    double distance = Math.max(Math.hypot(dx, dy), MIN_DISTANCE);
                    double magnitude = config.attraction() * w[k]
                            * (config.logAttraction() ? Math.log1p(distance) : distance);
                    double ux = dx / distance;
                    double uy = dy / distance;
                    fx[i] += ux * magnitude;
                    fy[i] += uy * magnitude;
                    fx[j] -= ux * magnitude;
                    fy[j] -= uy * magnitude;
                }
            }

            double cx = 0.0;
            double cy = 0.0;
            for (int i = 0; i < m; i++) {
                cx += x[i];
                cy += y[i];
            }
            cx /= m;
            cy /= m;
            for (int i = 0; i < m; i++) {
                double dx = x[i] - cx;
                double dy = y[i] - cy;
                double distance = Math.hypot(dx, dy);
                if (distance > MIN_DISTANCE) {
                    double magnitude = config.gravity() * mass[i];
                    fx[i] -= dx / distance * magnitude;
                    fy[i] -= dy / distance * magnitude;
                }
            }

            double progress = (double) iteration / iterations;
            double temperature = initialTemperature * (1.0 - progress)
                    + initialTemperature * FINAL_TEMPERATURE_RATIO;
            for (int i = 0; i < m; i++) {
                double length = Math.hypot(fx[i], fy[i]);
                if (length > 0.0) {
                    double step = Math.min(length, temperature);
                    x[i] += fx[i] / length * step;
                    y[i] += fy[i] / length * step;
                }
            }
            ran++;
        }
        return new ComponentLayout(x, y, ran, approximate, truncated);
    }

    /**
     * Adds the repulsion pushing point 1 away from point 2 into {@code force}.
     * Coincident points are separated along a direction derived from their indices.
     */
    static void addRepulsion(double x1, double y1, double x2, double y2, double strength,
                             int a, int b, double[] force) {
        double dx = x1 - x2;
        double dy = y1 - y2;
        double distance = Math.hypot(dx, dy);
        if (distance < MIN_DISTANCE) {
            double angle = Math.floorMod(a * 31L + b * 17L, 360L) * Math.PI / 180.0;
            dx = Math.cos(angle);
            dy = Math.sin(angle);
            distance = MIN_DISTANCE;
            force[0] += dx * strength / distance;
            force[1] += dy * strength / distance;
            return;
        }
        double magnitude = strength / distance;
        force[0] += dx / distance * magnitude;
        force[1] += dy / distance * magnitude;
    }
}
