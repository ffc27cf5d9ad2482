package com.entity.network.snapshot;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable point-in-time materialization of a scope's graph.
 *
 * <p>Nodes are indexed densely in ascending id order. The undirected view merges
 * parallel relationships between the same pair into one edge whose weight is the
 * sum of their weights; self-loops are excluded. Neighbor lists are sorted by
 * index so every traversal is deterministic. The directed relationships
 * are kept for export.</p>
 */
public final class GraphSnapshot {
    private static final Logger log = LoggerFactory.getLogger(GraphSnapshot.class);

    private final Scope scope;
    private final Instant loadedAt;
    private final List<Entity> nodes;
    private final Map<String, Integer> indexById;
    private final List<Relationship> relationships;
    private final int[][] neighbors;
    private final double[][] weights;
    private final double[] strength;
    private final int edgeCount;
    private final int[] componentOf;
    private final List<int[]> components;

    private GraphSnapshot(Scope scope, Instant loadedAt, List<Entity> nodes,
                          List<Relationship> relationships) {
        this.scope = scope;
        this.loadedAt = loadedAt;
        this.nodes = nodes;
        this.indexById = new HashMap<>(nodes.size() * 2);
        for (int i = 0; i < nodes.size(); i++) {
            indexById.put(nodes.get(i).getId(), i);
        }

        List<Relationship> kept = new ArrayList<>(relationships.size());
        List<TreeMap<Integer, Double>> adjacency = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            adjacency.add(new TreeMap<>());
        }
        for (Relationship relationship : relationships) {
            Integer source = indexById.get(relationship.getSourceEntityId());
            Integer target = indexById.get(relationship.getTargetEntityId());
            if (source == null || target == null) {
                log.warn("snapshot.relationship.skipped scope={} source={} target={} reason=unknown-endpoint",
                        scope, relationship.getSourceEntityId(), relationship.getTargetEntityId());
                continue;
            }
            if (source.equals(target)) {
                log.warn("snapshot.relationship.skipped scope={} entity={} reason=self-loop",
                        scope, relationship.getSourceEntityId());
                continue;
            }
            kept.add(relationship);
            adjacency.get(source).merge(target, relationship.getWeight(), Double::sum);
            adjacency.get(target).merge(source, relationship.getWeight(), Double::sum);
        }
        kept.sort(Comparator.comparing(Relationship::getSourceEntityId)
                .thenComparing(Relationship::getTargetEntityId)
                .thenComparing(Relationship::getType));
        this.relationships = Collections.unmodifiableList(kept);

        int n = nodes.size();
        this.neighbors = new int[n][];
        this.weights = new double[n][];
        this.strength = new double[n];
        int degreeSum = 0;
        for (int i = 0; i < n; i++) {
            TreeMap<Integer, Double> row = adjacency.get(i);
            neighbors[i] = new int[row.size()];
            weights[i] = new double[row.size()];
            int k = 0;
            for (Map.Entry<Integer, Double> entry : row.entrySet()) {
                neighbors[i][k] = entry.getKey();
                weights[i][k] = entry.getValue();
                strength[i] += entry.getValue();
                k++;
            }
            degreeSum += row.size();
        }
        this.edgeCount = degreeSum / 2;

        this.componentOf = new int[n];
        this.components = Collections.unmodifiableList(findComponents());
    }

    /**
     * Builds a snapshot. Relationships whose endpoints are not among the given
     * entities are skipped with a warning.
     */
    public static GraphSnapshot of(Scope scope, Collection<Entity> entities,
                                   Collection<Relationship> relationships, Instant loadedAt) {
        List<Entity> sorted = new ArrayList<>(entities);
        sorted.sort(Comparator.comparing(Entity::getId));
        return new GraphSnapshot(scope, loadedAt, Collections.unmodifiableList(sorted), List.copyOf(relationships));
    }

    public static GraphSnapshot empty(Scope scope) {
        return new GraphSnapshot(scope, Instant.now(), List.of(), List.of());
    }

    private List<int[]> findComponents() {
        int n = nodes.size();
        Arrays.fill(componentOf, -1);
        List<int[]> found = new ArrayList<>();
        int[] queue = new int[n];
        for (int start = 0; start < n; start++) {
            if (componentOf[start] >= 0) {
                continue;
            }
            int head = 0;
            int tail = 0;
            queue[tail++] = start;
            componentOf[start] = found.size();
            while (head < tail) {
                int current = queue[head++];
                for (int next : neighbors[current]) {
                    if (componentOf[next] < 0) {
                        componentOf[next] = found.size();
                        queue[tail++] = next;
                    }
                }
            }
            int[] members = Arrays.copyOf(queue, tail);
            Arrays.sort(members);
            found.add(members);
        }
        // Largest first; equal sizes keep discovery order (smallest member first)
        List<int[]> ordered = new ArrayList<>(found);
        ordered.sort(Comparator.comparingInt((int[] c) -> c.length).reversed());
        for (int c = 0; c < ordered.size(); c++) {
            for (int member : ordered.get(c)) {
                componentOf[member] = c;
            }
        }
        return ordered;
    }

    // ========== Accessors ==========

    public Scope scope() {
        return scope;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Entity> entities() {
        return nodes;
    }

    public Entity entity(int index) {
        return nodes.get(index);
    }

    public String id(int index) {
        return nodes.get(index).getId();
    }

    /**
     * @return the dense index of the entity, or -1 if absent
     */
    public int indexOf(String entityId) {
        Integer index = indexById.get(entityId);
        return index != null ? index : -1;
    }

    public boolean contains(String entityId) {
        return indexById.containsKey(entityId);
    }

    /**
     * Neighbor indices in ascending order. The returned array must not be modified.
     */
    public int[] neighbors(int index) {
        return neighbors[index];
    }

    /**
     * Merged edge weights, parallel to {@link #neighbors(int)}. The returned array must not be modified.
     */
    public double[] weights(int index) {
        return weights[index];
    }

    public int degree(int index) {
        return neighbors[index].length;
    }

    public double strength(int index) {
        return strength[index];
    }

    /**
     * Connected components as sorted index arrays, largest first.
     */
    public List<int[]> components() {
        return components;
    }

    public int componentOf(int index) {
        return componentOf[index];
    }

    public List<Relationship> relationships() {
        return relationships;
    }

    // ========== Derived views ==========

    public GraphStats stats() {
        int n = nodes.size();
        double density = n > 1 ? (2.0 * edgeCount) / ((double) n * (n - 1)) : 0.0;
        double averageDegree = n > 0 ? (2.0 * edgeCount) / n : 0.0;
        Map<EntityType, Integer> entityTypes = new EnumMap<>(EntityType.class);
        for (Entity entity : nodes) {
            entityTypes.merge(entity.getType(), 1, Integer::sum);
        }
        Map<RelationshipType, Integer> relationshipTypes = new EnumMap<>(RelationshipType.class);
        for (Relationship relationship : relationships) {
            relationshipTypes.merge(relationship.getType(), 1, Integer::sum);
        }
        return new GraphStats(n, edgeCount, relationships.size(), density, components.size(),
                averageDegree, entityTypes, relationshipTypes);
    }

    /**
     * Entities within {@code depth} hops of the center, and the relationships among them.
     *
     * @param relationshipTypes types to keep, or empty for all
     */
    public Neighborhood neighborhood(String entityId, int depth, Set<RelationshipType> relationshipTypes) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
        int center = indexOf(entityId);
        if (center < 0) {
            return new Neighborhood(null, depth, List.of(), List.of());
        }
        int[] distance = new int[nodes.size()];
        Arrays.fill(distance, -1);
        distance[center] = 0;
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(center);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (distance[current] == depth) {
                continue;
            }
            for (int next : neighbors[current]) {
                if (distance[next] < 0) {
                    distance[next] = distance[current] + 1;
                    queue.add(next);
                }
            }
        }
        List<Entity> members = new ArrayList<>();
        for (int i = 0; i < distance.length; i++) {
            if (distance[i] >= 0) {
                members.add(nodes.get(i));
            }
        }
        List<Relationship> edges = relationships.stream()
                .filter(r -> distance[indexOf(r.getSourceEntityId())] >= 0
                        && distance[indexOf(r.getTargetEntityId())] >= 0)
                .filter(r -> relationshipTypes == null || relationshipTypes.isEmpty()
                        || relationshipTypes.contains(r.getType()))
                .toList();
        return new Neighborhood(nodes.get(center), depth, members, edges);
    }

    public Neighborhood neighborhood(String entityId, int depth) {
        return neighborhood(entityId, depth, Set.of());
    }

    /**
     * Relationships involving the entity, oldest first observation first.
     */
    public List<TimelineEntry> timeline(String entityId) {
        if (!contains(entityId)) {
            return List.of();
        }
        List<TimelineEntry> entries = new ArrayList<>();
        for (Relationship relationship : relationships) {
            if (relationship.getSourceEntityId().equals(entityId)) {
                entries.add(new TimelineEntry(nodes.get(indexOf(relationship.getTargetEntityId())),
                        TimelineEntry.Direction.OUTGOING, relationship));
            } else if (relationship.getTargetEntityId().equals(entityId)) {
                entries.add(new TimelineEntry(nodes.get(indexOf(relationship.getSourceEntityId())),
                        TimelineEntry.Direction.INCOMING, relationship));
            }
        }
        entries.sort(Comparator.comparing((TimelineEntry e) -> e.relationship().getFirstObserved())
                .thenComparing(e -> e.counterpart().getId()));
        return entries;
    }

    /**
     * First entity in id order whose name equals {@code name}, ignoring case.
     */
    public Optional<Entity> findByName(String name) {
        return nodes.stream().filter(e -> e.getName().equalsIgnoreCase(name)).findFirst();
    }

    /**
     * Filters, ranks and pages the entities; ties keep id order.
     */
    public GraphSubset subset(SubsetQuery query) {
        String prefix = query.namePrefix() != null ? query.namePrefix().toLowerCase(Locale.ROOT) : null;
        double scale = nodes.size() > 1 ? 1.0 / (nodes.size() - 1) : 0.0;
        List<GraphSubset.Node> filtered = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            Entity entity = nodes.get(i);
            if (query.entityType() != null && entity.getType() != query.entityType()) {
                continue;
            }
            if (prefix != null && !entity.getName().toLowerCase(Locale.ROOT).startsWith(prefix)) {
                continue;
            }
            filtered.add(new GraphSubset.Node(entity, degree(i), degree(i) * scale));
        }
        Comparator<GraphSubset.Node> ranking = switch (query.order()) {
            case CENTRALITY -> Comparator.comparingDouble(GraphSubset.Node::centrality).reversed();
            case MENTIONS -> Comparator.comparingInt(GraphSubset.Node::degree).reversed();
            case RECENT -> Comparator.comparing((GraphSubset.Node n) -> n.entity().getFirstSeen()).reversed();
        };
        filtered.sort(ranking);

        List<GraphSubset.Node> page = filtered.subList(Math.min(query.offset(), filtered.size()),
                Math.min(query.offset() + query.limit(), filtered.size()));
        List<Relationship> edges = List.of();
        if (query.includeRelationships()) {
            Set<String> ids = new HashSet<>();
            page.forEach(node -> ids.add(node.entity().getId()));
            edges = relationships.stream()
                    .filter(r -> ids.contains(r.getSourceEntityId()) && ids.contains(r.getTargetEntityId()))
                    .toList();
        }
        return new GraphSubset(page, edges, nodes.size(), relationships.size(), filtered.size(),
                query.limit(), query.offset());
    }

    /**
     * Activity per bucket between {@code from} and {@code to}, both inclusive, oldest
     * bucket first. Buckets without activity are omitted.
     *
     * @param entityType count only entities of this type, and relationships touching one; null counts all
     */
    public List<ActivityEntry> activity(ActivityPeriod period, Instant from, Instant to, EntityType entityType) {
        Map<LocalDate, Set<String>> active = new TreeMap<>();
        Map<LocalDate, Integer> newEntities = new TreeMap<>();
        Map<LocalDate, Integer> newRelationships = new TreeMap<>();
        for (Entity entity : nodes) {
            if (entityType != null && entity.getType() != entityType) {
                continue;
            }
            if (within(entity.getFirstSeen(), from, to)) {
                LocalDate bucket = period.bucketOf(entity.getFirstSeen());
                newEntities.merge(bucket, 1, Integer::sum);
                active.computeIfAbsent(bucket, b -> new HashSet<>()).add(entity.getId());
            }
            if (within(entity.getLastSeen(), from, to)) {
                active.computeIfAbsent(period.bucketOf(entity.getLastSeen()), b -> new HashSet<>())
                        .add(entity.getId());
            }
        }
        for (Relationship relationship : relationships) {
            List<String> counted = new ArrayList<>(2);
            for (String endpoint : List.of(relationship.getSourceEntityId(), relationship.getTargetEntityId())) {
                if (entityType == null || nodes.get(indexOf(endpoint)).getType() == entityType) {
                    counted.add(endpoint);
                }
            }
            if (counted.isEmpty()) {
                continue;
            }
            if (within(relationship.getFirstObserved(), from, to)) {
                LocalDate bucket = period.bucketOf(relationship.getFirstObserved());
                newRelationships.merge(bucket, 1, Integer::sum);
                active.computeIfAbsent(bucket, b -> new HashSet<>()).addAll(counted);
            }
            if (within(relationship.getLastObserved(), from, to)) {
                active.computeIfAbsent(period.bucketOf(relationship.getLastObserved()), b -> new HashSet<>())
                        .addAll(counted);
            }
        }
        List<ActivityEntry> entries = new ArrayList<>(active.size());
        active.forEach((bucket, ids) -> entries.add(new ActivityEntry(bucket, ids.size(),
                newEntities.getOrDefault(bucket, 0), newRelationships.getOrDefault(bucket, 0))));
        return entries;
    }

    private static boolean within(Instant instant, Instant from, Instant to) {
        return !instant.isBefore(from) && !instant.isAfter(to);
    }

    @Override
    public String toString() {
        return "GraphSnapshot{scope=" + scope + ", nodes=" + nodes.size() + ", edges=" + edgeCount + '}';
    }
}
