package com.entity.network.centrality;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.core.exception.ComputationTimeoutException;
import com.entity.network.core.exception.GraphTooLargeException;
import com.entity.network.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/**
 * Degree, betweenness and importance rankings over the undirected view of a snapshot.
 * Disconnected graphs are handled component by component.
 */
public class CentralityEngine {
    private static final Logger log = LoggerFactory.getLogger(CentralityEngine.class);

    private final CentralityConfig config;

    public CentralityEngine() {
        this(CentralityConfig.defaults());
    }

    public CentralityEngine(CentralityConfig config) {
        this.config = config;
    }

    public CentralityConfig config() {
        return config;
    }

    public CentralityResult compute(GraphSnapshot snapshot, CentralityMeasure measure, int limit) {
        return switch (measure) {
            case DEGREE -> degree(snapshot, limit);
            case BETWEENNESS -> betweenness(snapshot, limit);
            case IMPORTANCE -> importance(snapshot, limit);
        };
    }

    /**
     * Number of distinct neighbors.
     */
    public CentralityResult degree(GraphSnapshot snapshot, int limit) {
        int n = snapshot.nodeCount();
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = snapshot.degree(i);
        }
        return new CentralityResult(CentralityMeasure.DEGREE, rank(snapshot, scores, limit), false, false);
    }

    /**
     * Normalized shortest-path betweenness (Brandes), hop-count distances.
     * Sampled from seeded pivot sources above {@link CentralityConfig#exactBetweennessLimit()}.
     *
     * @throws GraphTooLargeException       above {@link CentralityConfig#maxBetweennessNodes()}
     * @throws ComputationTimeoutException  if the time budget runs out
     */
    public CentralityResult betweenness(GraphSnapshot snapshot, int limit) {
        int n = snapshot.nodeCount();
        if (n > config.maxBetweennessNodes()) {
            throw new GraphTooLargeException("betweenness", n, config.maxBetweennessNodes());
        }
        long start = System.nanoTime();
        boolean approximate = n > config.exactBetweennessLimit() && config.pivotCount() < n;
        int[] sources = approximate ? samplePivots(n) : allNodes(n);
        ComputationBudget budget = ComputationBudget.of(config.timeLimit());

        double[] centrality = new double[n];
        int[] distance = new int[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        int[] order = new int[n];
        for (int s : sources) {
            if (budget.isExpired()) {
                log.warn("centrality.betweenness.timeout scope={} nodes={} timeLimitMs={}",
                        snapshot.scope(), n, config.timeLimit().toMillis());
                throw new ComputationTimeoutException("Betweenness for " + n + " nodes exceeded "
                        + config.timeLimit().toMillis() + "ms");
            }
            accumulateFromSource(snapshot, s, centrality, distance, sigma, delta, order);
        }

        if (n > 2) {
            double scale = 1.0 / ((double) (n - 1) * (n - 2));
            if (approximate) {
                scale *= (double) n / sources.length;
            }
            for (int i = 0; i < n; i++) {
                centrality[i] *= scale;
            }
        } else {
            Arrays.fill(centrality, 0.0);
        }
        log.debug("centrality.betweenness scope={} nodes={} sources={} approximate={} durationMs={}",
                snapshot.scope(), n, sources.length, approximate,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return new CentralityResult(CentralityMeasure.BETWEENNESS, rank(snapshot, centrality, limit),
                approximate, false);
    }

    private static void accumulateFromSource(GraphSnapshot snapshot, int s, double[] centrality,
                                             int[] distance, double[] sigma, double[] delta, int[] order) {
        Arrays.fill(distance, -1);
        Arrays.fill(sigma, 0.0);
        Arrays.fill(delta, 0.0);
        distance[s] = 0;
        sigma[s] = 1.0;
        int head = 0;
        int tail = 0;
        order[tail++] = s;
        while (head < tail) {
            int v = order[head++];
            for (int w : snapshot.neighbors(v)) {
                if (distance[w] < 0) {
                    distance[w] = distance[v] + 1;
                    order[tail++] = w;
                }
                if (distance[w] == distance[v] + 1) {
                    sigma[w] += sigma[v];
                }
            }
        }
        // Predecessors of w are the neighbors one hop closer to s
        for (int k = tail - 1; k > 0; k--) {
            int w = order[k];
            for (int v : snapshot.neighbors(w)) {
                if (distance[v] == distance[w] - 1) {
                    delta[v] += sigma[v] / sigma[w] * (1.0 + delta[w]);
                }
            }
            centrality[w] += delta[w];
        }
    }

    private int[] samplePivots(int n) {
        int[] all = allNodes(n);
        SplittableRandom random = new SplittableRandom(config.seed());
        int k = config.pivotCount();
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] pivots = Arrays.copyOf(all, k);
        Arrays.sort(pivots);
        return pivots;
    }

    private static int[] allNodes(int n) {
        int[] nodes = new int[n];
        for (int i = 0; i < n; i++) {
            nodes[i] = i;
        }
        return nodes;
    }

    /**
     * Weighted PageRank computed per component and scaled by the component's share
     * of nodes, so scores over the whole graph sum to one.
     */
    public CentralityResult importance(GraphSnapshot snapshot, int limit) {
        int n = snapshot.nodeCount();
        double[] scores = new double[n];
        ComputationBudget budget = ComputationBudget.of(config.timeLimit(), config.maxIterations());
        boolean truncated = false;
        double[] next = new double[n];

        for (int[] component : snapshot.components()) {
            int m = component.length;
            double share = (double) m / n;
            if (m == 1) {
                scores[component[0]] = share;
                continue;
            }
            for (int node : component) {
                scores[node] = 1.0 / m;
            }
            boolean converged = false;
            int iteration = 0;
            while (budget.allowsIteration(iteration)) {
                double change = 0.0;
                for (int node : component) {
                    double incoming = 0.0;
                    int[] neighbors = snapshot.neighbors(node);
                    double[] weights = snapshot.weights(node);
                    for (int k = 0; k < neighbors.length; k++) {
                        int from = neighbors[k];
                        incoming += scores[from] * weights[k] / snapshot.strength(from);
                    }
                    next[node] = (1.0 - config.damping()) / m + config.damping() * incoming;
                    change += Math.abs(next[node] - scores[node]);
                }
                for (int node : component) {
                    scores[node] = next[node];
                }
                iteration++;
                if (change < m * config.tolerance()) {
                    converged = true;
                    break;
                }
            }
            truncated |= !converged;
            for (int node : component) {
                scores[node] *= share;
            }
        }
        if (truncated) {
            log.warn("centrality.importance.unconverged scope={} nodes={} maxIterations={}",
                    snapshot.scope(), n, config.maxIterations());
        }
        return new CentralityResult(CentralityMeasure.IMPORTANCE, rank(snapshot, scores, limit), false, truncated);
    }

    private List<RankedEntity> rank(GraphSnapshot snapshot, double[] scores, int limit) {
        int effectiveLimit = limit > 0 ? limit : config.defaultLimit();
        List<RankedEntity> ranked = new ArrayList<>(scores.length);
        for (int i = 0; i < scores.length; i++) {
            ranked.add(new RankedEntity(snapshot.id(i), scores[i]));
        }
        ranked.sort(Comparator.comparingDouble(RankedEntity::score).reversed()
                .thenComparing(RankedEntity::entityId));
        return ranked.size() > effectiveLimit ? ranked.subList(0, effectiveLimit) : ranked;
    }
}
