package com.entity.network.discovery;

import com.entity.network.cache.MutationListener;
import com.entity.network.core.model.ContentItem;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.Scope;
import com.entity.network.lock.DistributedLock;
import com.entity.network.store.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Infers relationships from entities mentioned together in content.
 *
 * <p>Every unordered entity pair mentioned by at least {@code minCoOccurrences}
 * distinct items inside the time window yields one relationship, keyed with the
 * lexicographically smaller id as source. Content item ids are recorded as
 * evidence, so re-running over the same items changes nothing and only new items
 * strengthen an existing edge. When new items change the classification of a pair,
 * its discovered edge is retyped in place rather than duplicated.</p>
 *
 * <p>Runs hold the scope write lock, so they never interleave with other writers. A run stops at the first failed
 * write and reports what it committed; listeners are notified only when at
 * least one write was committed.</p>
 */
public class RelationshipDiscovery {
    private static final Logger log = LoggerFactory.getLogger(RelationshipDiscovery.class);

    static final double BASE_CONFIDENCE = 0.5;
    static final double OBSERVATION_STEP = 0.05;
    static final double KEYWORD_STEP = 0.05;
    static final int MAX_KEYWORD_HITS = 3;
    static final double MAX_CONFIDENCE = 0.95;

    private final GraphStore store;
    private final RelationshipClassifier classifier;
    private final DistributedLock lock;
    private final Clock clock;
    private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();

    public RelationshipDiscovery(GraphStore store, RelationshipClassifier classifier,
                                 DistributedLock lock, Clock clock) {
        this.store = store;
        this.classifier = classifier;
        this.lock = lock;
        this.clock = clock;
    }

    public void addMutationListener(MutationListener listener) {
        listeners.add(listener);
    }

    /**
     * Confidence for a pair: grows with observations and keyword hits, capped at 0.95.
     */
    public static double confidence(int observations, int keywordHits) {
        double value = BASE_CONFIDENCE
                + OBSERVATION_STEP * observations
                + KEYWORD_STEP * Math.min(keywordHits, MAX_KEYWORD_HITS);
        return Math.min(MAX_CONFIDENCE, value);
    }

    private record Pair(String source, String target) {
    }

    public DiscoveryResult discover(Scope scope, Collection<ContentItem> items, DiscoveryOptions options) {
        String lockKey = DistributedLock.writeKey(scope);
        lock.lock(lockKey);
        try {
            return run(scope, items, options);
        } finally {
            lock.unlock(lockKey);
        }
    }

    private DiscoveryResult run(Scope scope, Collection<ContentItem> items, DiscoveryOptions options) {
        Instant reference = options.referenceTime() != null ? options.referenceTime() : clock.instant();
        Instant cutoff = options.timeWindow() != null ? reference.minus(options.timeWindow()) : null;

        Set<String> known = store.findEntities(scope).stream()
                .map(Entity::getId)
                .collect(Collectors.toSet());
        Set<String> unknown = new TreeSet<>();

        // Distinct items per pair; TreeMap keeps pair processing order stable
        Map<Pair, Map<String, ContentItem>> support = new TreeMap<>(
                Comparator.comparing(Pair::source).thenComparing(Pair::target));
        int considered = 0;
        for (ContentItem item : items) {
            if (cutoff != null && item.timestamp().isBefore(cutoff)) {
                continue;
            }
            considered++;
            List<String> mentioned = new ArrayList<>();
            for (String entityId : new TreeSet<>(item.entityIds())) {
                if (known.contains(entityId)) {
                    mentioned.add(entityId);
                } else {
                    unknown.add(entityId);
                }
            }
            for (int i = 0; i < mentioned.size(); i++) {
                for (int j = i + 1; j < mentioned.size(); j++) {
                    Pair pair = new Pair(mentioned.get(i), mentioned.get(j));
                    support.computeIfAbsent(pair, p -> new TreeMap<>()).putIfAbsent(item.id(), item);
                }
            }
        }

        List<Map.Entry<Pair, Map<String, ContentItem>>> candidates = support.entrySet().stream()
                .filter(e -> e.getValue().size() >= options.minCoOccurrences())
                .sorted(Comparator.comparingInt((Map.Entry<Pair, Map<String, ContentItem>> e) -> e.getValue().size())
                        .reversed())
                .limit(options.maxPairs())
                .toList();
        if (!unknown.isEmpty()) {
            log.warn("discovery.entities.skipped scope={} count={} sample={}",
                    scope, unknown.size(), unknown.iterator().next());
        }
        log.info("discovery.started scope={} items={} consideredItems={} candidatePairs={}",
                scope, items.size(), considered, candidates.size());

        List<Relationship> created = new ArrayList<>();
        List<Relationship> updated = new ArrayList<>();
        int unchanged = 0;
        RuntimeException error = null;
        try {
            for (Map.Entry<Pair, Map<String, ContentItem>> candidate : candidates) {
                Pair pair = candidate.getKey();
                Collection<ContentItem> supporting = candidate.getValue().values();
                Classification classification = classifier.classify(
                        supporting.stream().map(ContentItem::text).toList());
                RelationshipKey key = new RelationshipKey(pair.source(), pair.target(), classification.type());
                Optional<Relationship> existing = findDiscovered(scope, key, candidate.getValue().keySet());

                Relationship next = existing
                        .map(current -> strengthen(current, supporting, classification))
                        .orElseGet(() -> create(key, supporting, classification));
                if (next == null) {
                    unchanged++;
                    continue;
                }
                if (existing.isEmpty()) {
                    created.add(store.saveRelationship(scope, next));
                    continue;
                }
                updated.add(store.replaceRelationship(scope, next));
                RelationshipKey previous = existing.get().key();
                if (!previous.equals(next.key())) {
                    store.deleteRelationship(scope, previous);
                    log.info("discovery.retyped scope={} source={} target={} from={} to={}",
                            scope, pair.source(), pair.target(), previous.type(), next.getType());
                }
            }
        } catch (RuntimeException e) {
            error = e;
            log.error("discovery.failed scope={} committed={} error={}",
                    scope, created.size() + updated.size(), e.getMessage());
        } finally {
            if (!created.isEmpty() || !updated.isEmpty()) {
                notifyListeners(scope);
            }
        }

        DiscoveryResult result = new DiscoveryResult(created, updated, unchanged, unknown.size(),
                candidates.size(), error);
        log.info("discovery.completed scope={} result={}", scope, result);
        return result;
    }

    /**
     * The pair's relationship under the classified type, or else the one of another
     * type that shares evidence with the supporting items: a relationship discovered
     * earlier whose classification has since changed.
     */
    private Optional<Relationship> findDiscovered(Scope scope, RelationshipKey key, Set<String> supportingIds) {
        Optional<Relationship> exact = store.findRelationship(scope, key);
        if (exact.isPresent()) {
            return exact;
        }
        return store.findRelationshipsOf(scope, key.sourceEntityId()).stream()
                .filter(r -> r.getSourceEntityId().equals(key.sourceEntityId())
                        && r.getTargetEntityId().equals(key.targetEntityId()))
                .filter(r -> r.getEvidenceIds().stream().anyMatch(supportingIds::contains))
                .min(Comparator.comparing(Relationship::getType));
    }

    private Relationship create(RelationshipKey key, Collection<ContentItem> supporting,
                                Classification classification) {
        int observations = supporting.size();
        return Relationship.builder()
                .sourceEntityId(key.sourceEntityId())
                .targetEntityId(key.targetEntityId())
                .type(key.type())
                .confidence(confidence(observations, classification.hits()))
                .weight(observations)
                .firstObserved(earliest(supporting))
                .lastObserved(latest(supporting))
                .observationCount(observations)
                .evidenceIds(supporting.stream().map(ContentItem::id).collect(Collectors.toSet()))
                .build();
    }

    /**
     * Folds the fresh supporting items into {@code current} and moves it to the
     * classified type.
     *
     * @return the strengthened relationship, or null if every supporting item is already evidence
     */
    private Relationship strengthen(Relationship current, Collection<ContentItem> supporting,
                                    Classification classification) {
        Set<String> evidence = new HashSet<>(current.getEvidenceIds());
        List<ContentItem> fresh = supporting.stream()
                .filter(item -> !evidence.contains(item.id()))
                .toList();
        if (fresh.isEmpty()) {
            return null;
        }
        fresh.forEach(item -> evidence.add(item.id()));
        int observations = evidence.size();
        Instant first = earliest(fresh);
        Instant last = latest(fresh);
        return current.toBuilder()
                .type(classification.type())
                .confidence(Math.max(current.getConfidence(), confidence(observations, classification.hits())))
                .weight(Math.max(current.getWeight(), observations))
                .firstObserved(first.isBefore(current.getFirstObserved()) ? first : current.getFirstObserved())
                .lastObserved(last.isAfter(current.getLastObserved()) ? last : current.getLastObserved())
                .observationCount(observations)
                .evidenceIds(evidence)
                .build();
    }

    private static Instant earliest(Collection<ContentItem> items) {
        return items.stream().map(ContentItem::timestamp).min(Comparator.naturalOrder()).orElseThrow();
    }

    private static Instant latest(Collection<ContentItem> items) {
        return items.stream().map(ContentItem::timestamp).max(Comparator.naturalOrder()).orElseThrow();
    }

    private void notifyListeners(Scope scope) {
        for (MutationListener listener : listeners) {
            try {
                listener.onMutation(scope);
            } catch (RuntimeException e) {
                log.warn("discovery.listener.failed scope={} error={}", scope, e.getMessage());
            }
        }
    }
}
