package com.entity.network.cluster;

import com.entity.network.compute.ComputationBudget;
import com.entity.network.core.exception.GraphTooLargeException;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityType;
import com.entity.network.layout.LayoutResult;
import com.entity.network.layout.Point;
import com.entity.network.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Detects communities and describes each one: representative, label, centroid
 * and dominant type. Communities below the minimum size are reported as
 * unclustered members, never dropped.
 */
public class ClusterEngine {
    private static final Logger log = LoggerFactory.getLogger(ClusterEngine.class);

    private final ClusterConfig config;
    private final Map<ClusterAlgorithm, ClusterStrategy> strategies;

    public ClusterEngine() {
        this(ClusterConfig.defaults());
    }

    public ClusterEngine(ClusterConfig config) {
        this.config = config;
        this.strategies = new EnumMap<>(ClusterAlgorithm.class);
        strategies.put(ClusterAlgorithm.LOUVAIN, new LouvainClustering(config));
        strategies.put(ClusterAlgorithm.LABEL_PROPAGATION, new LabelPropagationClustering(config));
    }

    public ClusterConfig config() {
        return config;
    }

    public ClusterResult detect(GraphSnapshot snapshot, int minSize) {
        return detect(snapshot, minSize, null);
    }

    /**
     * @param layout positions used for centroids; may be null
     * @throws GraphTooLargeException if the snapshot exceeds {@link ClusterConfig#maxNodes()}
     */
    public ClusterResult detect(GraphSnapshot snapshot, int minSize, LayoutResult layout) {
        if (minSize < 1) {
            throw new IllegalArgumentException("minSize must be at least 1, got " + minSize);
        }
        int n = snapshot.nodeCount();
        if (n > config.maxNodes()) {
            throw new GraphTooLargeException("clustering", n, config.maxNodes());
        }
        ClusterAlgorithm algorithm = ClusterSizing.choose(n, config);
        if (n == 0) {
            return ClusterResult.empty(algorithm);
        }
        long start = System.nanoTime();
        Partition partition = strategies.get(algorithm)
                .partition(snapshot, ComputationBudget.of(config.timeLimit()));
        double modularity = Modularity.of(snapshot, partition.communityOf(), partition.count());

        List<List<Integer>> communities = new ArrayList<>(partition.count());
        for (int c = 0; c < partition.count(); c++) {
            communities.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            communities.get(partition.communityOf()[i]).add(i);
        }
        // Largest first, then by smallest member id
        communities.sort(Comparator.comparingInt((List<Integer> c) -> c.size()).reversed()
                .thenComparingInt(c -> c.get(0)));

        List<Cluster> clusters = new ArrayList<>();
        List<String> unclustered = new ArrayList<>();
        for (List<Integer> members : communities) {
            if (members.size() < minSize) {
                for (int member : members) {
                    unclustered.add(snapshot.id(member));
                }
                continue;
            }
            clusters.add(describe("cluster_" + clusters.size(), snapshot, members,
                    partition.communityOf(), layout));
        }
        unclustered.sort(Comparator.naturalOrder());

        if (partition.truncated()) {
            log.warn("clustering.truncated scope={} algorithm={} nodes={}", snapshot.scope(), algorithm, n);
        }
        log.debug("clustering.computed scope={} algorithm={} nodes={} communities={} clusters={} modularity={} durationMs={}",
                snapshot.scope(), algorithm, n, partition.count(), clusters.size(),
                String.format("%.4f", modularity), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return new ClusterResult(clusters, unclustered, algorithm, modularity, partition.truncated());
    }

    private Cluster describe(String id, GraphSnapshot snapshot, List<Integer> members,
                             int[] communityOf, LayoutResult layout) {
        int community = communityOf[members.get(0)];
        int representative = members.get(0);
        int bestDegree = -1;
        Map<EntityType, Integer> distribution = new EnumMap<>(EntityType.class);
        List<String> ids = new ArrayList<>(members.size());
        double sumX = 0.0;
        double sumY = 0.0;
        int positioned = 0;

        for (int member : members) {
            int inside = 0;
            for (int neighbor : snapshot.neighbors(member)) {
                if (communityOf[neighbor] == community) {
                    inside++;
                }
            }
            // members are in index order, so strict comparison keeps the smallest id on ties
            if (inside > bestDegree) {
                bestDegree = inside;
                representative = member;
            }
            Entity entity = snapshot.entity(member);
            distribution.merge(entity.getType(), 1, Integer::sum);
            ids.add(entity.getId());
            if (layout != null) {
                Optional<Point> position = layout.position(entity.getId());
                if (position.isPresent()) {
                    sumX += position.get().x();
                    sumY += position.get().y();
                    positioned++;
                }
            }
        }

        Point centroid = positioned > 0 ? new Point(sumX / positioned, sumY / positioned) : Point.ORIGIN;
        String name = snapshot.entity(representative).getName();
        String label = members.size() > 1 ? name + " +" + (members.size() - 1) : name;
        return new Cluster(id, label, snapshot.id(representative), ids, centroid,
                dominantType(distribution), distribution);
    }

    /**
     * Plurality vote; ties go to the type declared first.
     */
    static EntityType dominantType(Map<EntityType, Integer> distribution) {
        EntityType dominant = EntityType.OTHER;
        int best = 0;
        for (EntityType type : EntityType.values()) {
            int count = distribution.getOrDefault(type, 0);
            if (count > best) {
                best = count;
                dominant = type;
            }
        }
        return dominant;
    }
}
