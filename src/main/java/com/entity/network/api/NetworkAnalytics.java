package com.entity.network.api;

import com.entity.network.bulk.ImportResult;
import com.entity.network.bulk.JsonRecordImporter;
import com.entity.network.bulk.ProgressCallback;
import com.entity.network.cache.AnalyticsCache;
import com.entity.network.cache.CacheConfig;
import com.entity.network.cache.CacheKey;
import com.entity.network.cache.CacheStats;
import com.entity.network.cache.CacheStatus;
import com.entity.network.cache.CacheTier;
import com.entity.network.centrality.CentralityConfig;
import com.entity.network.centrality.CentralityEngine;
import com.entity.network.centrality.CentralityMeasure;
import com.entity.network.centrality.CentralityResult;
import com.entity.network.cluster.ClusterConfig;
import com.entity.network.cluster.ClusterEngine;
import com.entity.network.cluster.ClusterResult;
import com.entity.network.core.exception.EntityNotFoundException;
import com.entity.network.core.exception.GraphTooLargeException;
import com.entity.network.core.model.ContentItem;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.core.model.Scope;
import com.entity.network.discovery.DiscoveryOptions;
import com.entity.network.discovery.DiscoveryResult;
import com.entity.network.discovery.KeywordRelationshipClassifier;
import com.entity.network.discovery.RelationshipClassifier;
import com.entity.network.discovery.RelationshipDiscovery;
import com.entity.network.discovery.RelationshipStats;
import com.entity.network.graph.FalkorDBConnection;
import com.entity.network.graph.GraphConnection;
import com.entity.network.health.CacheHealthCheck;
import com.entity.network.health.HealthCheck;
import com.entity.network.health.HealthCheckRegistry;
import com.entity.network.health.HealthStatus;
import com.entity.network.health.MemoryHealthCheck;
import com.entity.network.health.StoreHealthCheck;
import com.entity.network.layout.LayoutAlgorithm;
import com.entity.network.layout.LayoutConfig;
import com.entity.network.layout.LayoutEngine;
import com.entity.network.layout.LayoutResult;
import com.entity.network.layout.Point;
import com.entity.network.lock.DistributedLock;
import com.entity.network.lock.LocalDistributedLock;
import com.entity.network.logging.LogContext;
import com.entity.network.merge.EntityMerger;
import com.entity.network.merge.MergeResult;
import com.entity.network.metrics.MetricsService;
import com.entity.network.metrics.NoOpMetricsService;
import com.entity.network.path.PathConfig;
import com.entity.network.path.PathFinder;
import com.entity.network.path.PathResult;
import com.entity.network.path.PathSequence;
import com.entity.network.snapshot.ActivityEntry;
import com.entity.network.snapshot.ActivityPeriod;
import com.entity.network.snapshot.GraphBuilder;
import com.entity.network.snapshot.GraphSnapshot;
import com.entity.network.snapshot.GraphStats;
import com.entity.network.snapshot.GraphSubset;
import com.entity.network.snapshot.Neighborhood;
import com.entity.network.snapshot.SubsetQuery;
import com.entity.network.snapshot.TimelineEntry;
import com.entity.network.store.CypherGraphStore;
import com.entity.network.store.GraphStore;
import com.entity.network.store.StoreConfig;
import com.entity.network.tracing.NoOpTracingService;
import com.entity.network.tracing.Span;
import com.entity.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Main entry point for the network analytics engine.
 *
 * <p>Reads go through the {@link AnalyticsCache}: snapshots, layouts and cluster results
 * are cached per scope in independently expiring tiers; centrality and paths are computed
 * on the cached snapshot. Every write path invalidates the scope before returning.</p>
 *
 * <pre>
 * NetworkAnalytics analytics = NetworkAnalytics.builder()
 *     .graphConnection(connection)
 *     .build();
 *
 * Scope scope = Scope.of("user-42");
 * NetworkGraph graph = analytics.graph(scope, GraphQuery.defaults().withClusters(true));
 * PathResult path = analytics.shortestPath(scope, "acme", "globex", 4);
 * </pre>
 */
public class NetworkAnalytics implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NetworkAnalytics.class);

    static final int MIN_ACTIVITY_DAYS = 7;
    static final int MAX_ACTIVITY_DAYS = 365;
    static final Duration RECENT_RELATIONSHIPS = Duration.ofDays(7);

    private final GraphStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final GraphBuilder graphBuilder;
    private final LayoutEngine layoutEngine;
    private final ClusterEngine clusterEngine;
    private final CentralityEngine centralityEngine;
    private final PathFinder pathFinder;
    private final RelationshipDiscovery discovery;
    private final EntityMerger merger;
    private final JsonRecordImporter importer;
    private final DistributedLock lock;
    private final Clock clock;
    private final AnalyticsCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final HealthCheckRegistry healthCheckRegistry;

    private NetworkAnalytics(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.store = builder.store != null ? builder.store : new CypherGraphStore(connection);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.graphBuilder = new GraphBuilder(store, builder.storeConfig, clock);
        this.layoutEngine = new LayoutEngine(builder.layoutConfig);
        this.clusterEngine = new ClusterEngine(builder.clusterConfig);
        this.centralityEngine = new CentralityEngine(builder.centralityConfig);
        this.pathFinder = new PathFinder(builder.pathConfig);

        this.cache = builder.cache != null
                ? builder.cache : new AnalyticsCache(builder.cacheConfig, metricsService);

        this.lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock();
        RelationshipClassifier classifier = builder.classifier != null
                ? builder.classifier : new KeywordRelationshipClassifier();
        this.discovery = new RelationshipDiscovery(store, classifier, lock, clock);
        discovery.addMutationListener(cache);
        this.merger = new EntityMerger(store, lock);
        merger.addMutationListener(cache);
        this.importer = new JsonRecordImporter(store);
        importer.addMutationListener(cache);

        if (builder.createIndexes && connection != null) {
            connection.createIndexes();
        }

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new StoreHealthCheck(store));
        healthCheckRegistry.register(new CacheHealthCheck(cache));
        healthCheckRegistry.register(new MemoryHealthCheck());
        builder.healthChecks.forEach(healthCheckRegistry::register);

        log.info("NetworkAnalytics initialized with store: {}", store.getClass().getSimpleName());
    }

    // ========== Snapshot API ==========

    /**
     * Returns the cached snapshot of the scope, loading it from the store on a miss.
     *
     * @throws com.entity.network.core.exception.StoreUnavailableException if the store cannot be read
     */
    public GraphSnapshot snapshot(Scope scope) {
        return cache.get(CacheKey.of(scope, CacheTier.SNAPSHOT), () -> {
            GraphSnapshot snapshot = timed("snapshot", scope, () -> graphBuilder.load(scope));
            metricsService.recordSnapshotSize(snapshot.nodeCount(), snapshot.edgeCount());
            return snapshot;
        });
    }

    public GraphStats stats(Scope scope) {
        return snapshot(scope).stats();
    }

    public Neighborhood neighborhood(Scope scope, String entityId, int depth) {
        return snapshot(scope).neighborhood(entityId, depth);
    }

    public Neighborhood neighborhood(Scope scope, String entityId, int depth, Set<RelationshipType> types) {
        return snapshot(scope).neighborhood(entityId, depth, types);
    }

    /**
     * @throws EntityNotFoundException if the entity is not part of the scope
     */
    public List<TimelineEntry> timeline(Scope scope, String entityId) {
        GraphSnapshot snapshot = snapshot(scope);
        if (!snapshot.contains(entityId)) {
            throw new EntityNotFoundException(entityId);
        }
        return snapshot.timeline(entityId);
    }

    /**
     * Neighborhood of the first entity, in id order, whose name matches ignoring case.
     *
     * @throws EntityNotFoundException if no entity of the scope has that name
     */
    public Neighborhood neighborhoodByName(Scope scope, String name, int depth) {
        GraphSnapshot snapshot = snapshot(scope);
        Entity entity = snapshot.findByName(name).orElseThrow(() -> new EntityNotFoundException(name));
        return snapshot.neighborhood(entity.getId(), depth);
    }

    /**
     * A page of the scope's most connected entities and the relationships among them.
     */
    public GraphSubset subset(Scope scope, SubsetQuery query) {
        return snapshot(scope).subset(query);
    }

    /**
     * Scope activity over the last {@code days} days, bucketed by day or week.
     *
     * @param days       between 7 and 365
     * @param entityType restrict to one entity type; null for all
     */
    public List<ActivityEntry> activityTimeline(Scope scope, ActivityPeriod period, int days, EntityType entityType) {
        if (days < MIN_ACTIVITY_DAYS || days > MAX_ACTIVITY_DAYS) {
            throw new IllegalArgumentException("days must be in [" + MIN_ACTIVITY_DAYS + ", "
                    + MAX_ACTIVITY_DAYS + "], got " + days);
        }
        Instant now = clock.instant();
        return snapshot(scope).activity(period, now.minus(Duration.ofDays(days)), now, entityType);
    }

    /**
     * Relationship counts per type; relationships first observed in the last 7 days count as recent.
     */
    public RelationshipStats relationshipStats(Scope scope) {
        return RelationshipStats.of(snapshot(scope).relationships(), clock.instant().minus(RECENT_RELATIONSHIPS));
    }

    // ========== Layout and cluster API ==========

    /**
     * Cached layout for (algorithm, iterations, seed).
     *
     * @throws GraphTooLargeException above {@link LayoutConfig#maxNodes()}
     */
    public LayoutResult layout(Scope scope, LayoutAlgorithm algorithm, int iterations, long seed) {
        String variant = algorithm.name() + ":" + iterations + ":" + seed;
        return cache.get(CacheKey.of(scope, CacheTier.LAYOUT, variant), () -> {
            GraphSnapshot snapshot = snapshot(scope);
            return timed("layout", scope, () -> layoutEngine.compute(snapshot, algorithm, iterations, seed));
        });
    }

    public LayoutResult layout(Scope scope) {
        return layout(scope, LayoutAlgorithm.FORCE_DIRECTED, 0, layoutEngine.config().defaultSeed());
    }

    /**
     * Cached clusters without centroids.
     *
     * @throws GraphTooLargeException above {@link ClusterConfig#maxNodes()}
     */
    public ClusterResult clusters(Scope scope, int minSize) {
        return clusters(scope, minSize, null);
    }

    /**
     * Cached clusters with centroids taken from {@code layout}, which may be null.
     */
    public ClusterResult clusters(Scope scope, int minSize, LayoutResult layout) {
        String variant = layout == null
                ? minSize + ":none"
                : minSize + ":" + layout.algorithm() + ":" + layout.iterations() + ":" + layout.seed();
        return cache.get(CacheKey.of(scope, CacheTier.CLUSTER, variant), () -> {
            GraphSnapshot snapshot = snapshot(scope);
            return timed("clusters", scope, () -> clusterEngine.detect(snapshot, minSize, layout));
        });
    }

    // ========== Centrality and path API ==========

    public CentralityResult centrality(Scope scope, CentralityMeasure measure, int limit) {
        GraphSnapshot snapshot = snapshot(scope);
        return timed("centrality." + measure.name().toLowerCase(), scope,
                () -> centralityEngine.compute(snapshot, measure, limit));
    }

    public PathResult shortestPath(Scope scope, String sourceId, String targetId) {
        return pathFinder.shortestPath(snapshot(scope), sourceId, targetId);
    }

    public PathResult shortestPath(Scope scope, String sourceId, String targetId, int maxDepth) {
        return pathFinder.shortestPath(snapshot(scope), sourceId, targetId, maxDepth);
    }

    public PathSequence allPaths(Scope scope, String sourceId, String targetId, int maxDepth, int limit) {
        return pathFinder.allPaths(snapshot(scope), sourceId, targetId, maxDepth, limit);
    }

    /**
     * Ranking bounded by {@link GraphQuery#limit()}.
     */
    public CentralityResult centrality(Scope scope, CentralityMeasure measure, GraphQuery query) {
        return centrality(scope, measure, query.limit());
    }

    /**
     * Shortest path bounded by {@link GraphQuery#maxPathDepth()}.
     */
    public PathResult shortestPath(Scope scope, String sourceId, String targetId, GraphQuery query) {
        return shortestPath(scope, sourceId, targetId, query.maxPathDepth());
    }

    /**
     * Alternate paths bounded by {@link GraphQuery#maxPathDepth()}, at most {@link GraphQuery#limit()} of them.
     */
    public PathSequence allPaths(Scope scope, String sourceId, String targetId, GraphQuery query) {
        return allPaths(scope, sourceId, targetId, query.maxPathDepth(), query.limit());
    }

    // ========== Composite graph API ==========

    /**
     * Builds the node-link view of a scope. Layout or clustering that exceeds its size
     * limit is skipped with a warning instead of failing the query.
     */
    public NetworkGraph graph(Scope scope, GraphQuery query) {
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), scope.id(), "graph");
             Span span = tracingService.startScopedSpan("graph", scope)) {
            Map<String, Long> timings = new LinkedHashMap<>();
            List<String> warnings = new ArrayList<>();

            GraphSnapshot snapshot = phase("snapshot", timings, () -> snapshot(scope));
            span.setAttribute("nodes", snapshot.nodeCount());

            LayoutResult layout = null;
            if (query.includePositions()) {
                try {
                    layout = phase("layout", timings,
                            () -> layout(scope, query.layoutAlgorithm(), query.iterations(), query.seed()));
                    if (layout.truncated()) {
                        warnings.add("layout truncated after " + layout.iterations() + " iterations");
                    }
                } catch (GraphTooLargeException e) {
                    degrade(warnings, "layout", e);
                }
            }

            ClusterResult clusters = null;
            if (query.includeClusters()) {
                try {
                    LayoutResult positions = layout;
                    clusters = phase("clusters", timings, () -> clusters(scope, query.minClusterSize(), positions));
                    if (clusters.truncated()) {
                        warnings.add("clustering truncated before convergence");
                    }
                } catch (GraphTooLargeException e) {
                    degrade(warnings, "clusters", e);
                }
            }

            NetworkGraph graph = assemble(snapshot, query, layout, clusters, warnings, timings);
            span.setAttribute("warnings", warnings.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("graph.query.completed scope={} nodes={} edges={} warnings={}",
                    scope, graph.nodes().size(), graph.edges().size(), warnings.size());
            return graph;
        }
    }

    private void degrade(List<String> warnings, String view, GraphTooLargeException e) {
        warnings.add(view + " skipped: " + e.getMessage());
        metricsService.incrementDegradedQuery(view + ".too_large");
        log.warn("graph.query.degraded view={} nodes={} limit={}", view, e.getNodeCount(), e.getLimit());
    }

    private static NetworkGraph assemble(GraphSnapshot snapshot, GraphQuery query, LayoutResult layout,
                                         ClusterResult clusters, List<String> warnings, Map<String, Long> timings) {
        Map<String, String> assignments = clusters != null ? clusters.assignments() : Map.of();
        List<GraphNode> nodes = new ArrayList<>(snapshot.nodeCount());
        for (int i = 0; i < snapshot.nodeCount(); i++) {
            if (!query.includeIsolated() && snapshot.degree(i) == 0) {
                continue;
            }
            Entity entity = snapshot.entity(i);
            Optional<Point> position = layout != null ? layout.position(entity.getId()) : Optional.empty();
            nodes.add(new GraphNode(entity.getId(), entity.getName(), entity.getType(),
                    position.map(Point::x).orElse(null),
                    position.map(Point::y).orElse(null),
                    assignments.get(entity.getId())));
        }
        List<GraphEdge> edges = snapshot.relationships().stream().map(GraphEdge::of).toList();
        return new NetworkGraph(snapshot.scope(), nodes, edges,
                clusters != null ? clusters.clusters() : List.of(),
                snapshot.stats(),
                layout != null && layout.approximate(),
                layout != null && layout.truncated(),
                warnings, timings, snapshot.loadedAt());
    }

    // ========== Mutation API ==========

    public Entity saveEntity(Scope scope, Entity entity) {
        return mutate(scope, "saveEntity", () -> store.saveEntity(scope, entity));
    }

    /**
     * @throws com.entity.network.core.exception.InvalidRelationshipException for a self-loop
     *         or an endpoint that is not part of the scope
     */
    public Relationship saveRelationship(Scope scope, Relationship relationship) {
        return mutate(scope, "saveRelationship", () -> store.saveRelationship(scope, relationship));
    }

    public boolean deleteRelationship(Scope scope, RelationshipKey key) {
        return mutate(scope, "deleteRelationship", () -> store.deleteRelationship(scope, key));
    }

    /**
     * Deletes the entity and every relationship touching it.
     */
    public boolean deleteEntity(Scope scope, String entityId) {
        return mutate(scope, "deleteEntity", () -> store.deleteEntity(scope, entityId));
    }

    /**
     * Merges {@code sourceEntityId} into {@code targetEntityId}: relationships move to the
     * target, the source name becomes an alias, and the source is deleted.
     *
     * @throws EntityNotFoundException if either entity is not part of the scope
     */
    public MergeResult mergeEntities(Scope scope, String sourceEntityId, String targetEntityId) {
        MergeResult result = mutate(scope, "mergeEntities",
                () -> merger.merge(scope, sourceEntityId, targetEntityId));
        result.failure().ifPresent(e -> log.warn("merge.partial scope={} migrated={} error={}",
                scope, result.migrated().size(), e.getMessage()));
        return result;
    }

    /**
     * Infers relationships from co-occurrence. The scope is invalidated when at least one
     * relationship was committed, including when the run stopped on a store failure.
     */
    public DiscoveryResult discover(Scope scope, Collection<ContentItem> items, DiscoveryOptions options) {
        try (LogContext ctx = LogContext.forMutation(LogContext.generateCorrelationId(), scope.id(), "discover");
             Span span = tracingService.startScopedSpan("discover", scope)) {
            DiscoveryResult result = timed("discovery", scope, () -> discovery.discover(scope, items, options));
            metricsService.incrementRelationshipsDiscovered(result.created().size(), result.updated().size());
            span.setAttribute("created", result.created().size());
            span.setAttribute("updated", result.updated().size());
            result.failure().ifPresentOrElse(span::fail, () -> span.setStatus(Span.SpanStatus.OK));
            return result;
        }
    }

    public DiscoveryResult discover(Scope scope, Collection<ContentItem> items,
                                    int minCoOccurrences, Duration timeWindow) {
        return discover(scope, items, DiscoveryOptions.of(minCoOccurrences, timeWindow));
    }

    /**
     * Imports JSON Lines records into the scope. Content records are returned, not stored;
     * pass them to {@link #discover} to turn them into relationships.
     */
    public ImportResult importRecords(Scope scope, Reader reader, ProgressCallback callback) {
        try (LogContext ctx = LogContext.forImport(LogContext.generateCorrelationId(), scope.id())) {
            return locked(scope, () -> importer.importRecords(scope, reader, callback));
        }
    }

    private <T> T mutate(Scope scope, String operation, Supplier<T> write) {
        try (LogContext ctx = LogContext.forMutation(LogContext.generateCorrelationId(), scope.id(), operation);
             Span span = tracingService.startScopedSpan(operation, scope)) {
            try {
                T result = locked(scope, write);
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            } finally {
                // A failed write may still have committed on the store side
                cache.invalidate(scope);
            }
        }
    }

    private <T> T locked(Scope scope, Supplier<T> write) {
        String key = DistributedLock.writeKey(scope);
        lock.lock(key);
        try {
            return write.get();
        } finally {
            lock.unlock(key);
        }
    }

    // ========== Cache control ==========

    public void invalidate(Scope scope) {
        cache.invalidate(scope);
        log.info("cache.invalidate.requested scope={}", scope);
    }

    public CacheStatus cacheStatus(Scope scope) {
        return cache.status(scope);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    // ========== Health and accessors ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public GraphStore getStore() {
        return store;
    }

    public AnalyticsCache getCache() {
        return cache;
    }

    private <T> T timed(String operation, Scope scope, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            return work.get();
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordComputationDuration(operation, elapsed);
            log.debug("computation.completed operation={} scope={} durationMs={}",
                    operation, scope, elapsed.toMillis());
        }
    }

    private static <T> T phase(String name, Map<String, Long> timings, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            return work.get();
        } finally {
            timings.put(name, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    @Override
    public void close() {
        graphBuilder.close();
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Error closing connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphStore store;
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private StoreConfig storeConfig = StoreConfig.defaults();
        private LayoutConfig layoutConfig = LayoutConfig.defaults();
        private ClusterConfig clusterConfig = ClusterConfig.defaults();
        private CentralityConfig centralityConfig = CentralityConfig.defaults();
        private PathConfig pathConfig = PathConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private AnalyticsCache cache;
        private RelationshipClassifier classifier;
        private DistributedLock distributedLock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        /**
         * Uses the given store directly. Takes precedence over a graph connection.
         */
        public Builder store(GraphStore store) {
            this.store = store;
            return this;
        }

        /**
         * Reads and writes through a Cypher store over the given connection.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned by this instance and closed with it.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder storeConfig(StoreConfig storeConfig) {
            this.storeConfig = storeConfig;
            return this;
        }

        public Builder layoutConfig(LayoutConfig layoutConfig) {
            this.layoutConfig = layoutConfig;
            return this;
        }

        public Builder clusterConfig(ClusterConfig clusterConfig) {
            this.clusterConfig = clusterConfig;
            return this;
        }

        public Builder centralityConfig(CentralityConfig centralityConfig) {
            this.centralityConfig = centralityConfig;
            return this;
        }

        public Builder pathConfig(PathConfig pathConfig) {
            this.pathConfig = pathConfig;
            return this;
        }

        /**
         * Configures the cache built by this instance. Ignored if {@link #cache} is set.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Shares an existing cache, e.g. one built with a test ticker.
         */
        public Builder cache(AnalyticsCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder classifier(RelationshipClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder healthCheck(HealthCheck check) {
            this.healthChecks.add(check);
            return this;
        }

        public NetworkAnalytics build() {
            if (store == null && connection == null) {
                throw new IllegalStateException("A GraphStore or GraphConnection is required");
            }
            return new NetworkAnalytics(this);
        }
    }
}
