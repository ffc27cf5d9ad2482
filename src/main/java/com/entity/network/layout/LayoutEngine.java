package com.entity.network.layout;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.core.exception.GraphTooLargeException;
import com.entity.network.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/**
 * Computes 2D coordinates for a snapshot.
 *
 * <p>Connected components are laid out independently, each from its own seeded
 * random stream, then packed so that no two components overlap. The packed
 * coordinates are scaled uniformly to the viewport. The same snapshot, algorithm
 * and seed always produce the same coordinates unless the run was truncated.</p>
 */
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutConfig config;
    private final Map<LayoutAlgorithm, LayoutStrategy> strategies;

    public LayoutEngine() {
        this(LayoutConfig.defaults());
    }

    public LayoutEngine(LayoutConfig config) {
        this.config = config;
        this.strategies = new EnumMap<>(LayoutAlgorithm.class);
        register(new ForceDirectedLayout(config));
        register(new CircularLayout());
        register(new ShellLayout());
    }

    private void register(LayoutStrategy strategy) {
        strategies.put(strategy.algorithm(), strategy);
    }

    public LayoutConfig config() {
        return config;
    }

    public LayoutResult compute(GraphSnapshot snapshot) {
        return compute(snapshot, LayoutAlgorithm.FORCE_DIRECTED, 0, config.defaultSeed());
    }

    /**
     * @param iterations requested iterations; 0 lets the sizing rule decide, larger values are capped by it
     * @throws GraphTooLargeException if the snapshot exceeds {@link LayoutConfig#maxNodes()}
     */
    public LayoutResult compute(GraphSnapshot snapshot, LayoutAlgorithm algorithm, int iterations, long seed) {
        int n = snapshot.nodeCount();
        if (n > config.maxNodes()) {
            throw new GraphTooLargeException("layout", n, config.maxNodes());
        }
        if (n == 0) {
            return LayoutResult.empty(algorithm, seed);
        }
        long start = System.nanoTime();
        LayoutStrategy strategy = strategies.get(algorithm);
        LayoutPlan graphPlan = LayoutSizing.plan(n, iterations, config);
        ComputationBudget budget = ComputationBudget.of(config.timeLimit());

        List<int[]> components = snapshot.components();
        List<ComponentLayout> layouts = new ArrayList<>(components.size());
        int ran = 0;
        boolean approximate = false;
        boolean truncated = false;
        for (int c = 0; c < components.size(); c++) {
            int[] members = components.get(c);
            LayoutPlan plan = new LayoutPlan(graphPlan.iterations(),
                    LayoutSizing.repulsionFor(members.length, config));
            ComponentLayout layout = strategy.layout(snapshot, members, plan,
                    new SplittableRandom(seed + c), budget);
            layouts.add(layout);
            ran = Math.max(ran, layout.iterations());
            approximate |= layout.approximate();
            truncated |= layout.truncated();
        }

        double[][] offsets = ComponentPacker.pack(layouts, config.componentPadding());
        double[][] xy = new double[n][2];
        double extent = 0.0;
        for (int c = 0; c < components.size(); c++) {
            int[] members = components.get(c);
            ComponentLayout layout = layouts.get(c);
            for (int i = 0; i < members.length; i++) {
                double px = layout.x()[i] + offsets[c][0];
                double py = layout.y()[i] + offsets[c][1];
                xy[members[i]][0] = px;
                xy[members[i]][1] = py;
                extent = Math.max(extent, Math.max(Math.abs(px), Math.abs(py)));
            }
        }
        double factor = extent > 0.0 ? LayoutSizing.viewportScale(n, config) / extent : 0.0;

        Map<String, Point> positions = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            positions.put(snapshot.id(i), new Point(xy[i][0] * factor, xy[i][1] * factor));
        }
        if (truncated) {
            log.warn("layout.truncated scope={} nodes={} timeLimitMs={}",
                    snapshot.scope(), n, config.timeLimit().toMillis());
        }
        log.debug("layout.computed scope={} algorithm={} nodes={} components={} iterations={} approximate={} durationMs={}",
                snapshot.scope(), algorithm, n, components.size(), ran, approximate,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return new LayoutResult(positions, algorithm, seed, ran, approximate, truncated);
    }
}
