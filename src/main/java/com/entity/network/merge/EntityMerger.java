package com.entity.network.merge;

import com.entity.network.cache.MutationListener;
import com.entity.network.core.exception.EntityNotFoundException;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityMetadata;
import com.entity.network.core.model.MetadataKey;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.Scope;
import com.entity.network.lock.DistributedLock;
import com.entity.network.store.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges a source entity into a target entity of the same scope.
 *
 * Merge process:
 * 1. Relationship migration: every relationship of the source is rewritten onto the
 *    target. One that already exists on the target is re-observed through
 *    {@link Relationship#reobserve(Relationship)}; one between
 *    source and target would become a self-loop and is dropped.
 * 2. Target update: the source name and aliases become target aliases, metadata keys
 *    missing on the target are copied, and the observation window is widened.
 * 3. Source deletion, which also removes its original relationships.
 *
 * The merge holds the scope write lock, stops at the first failed write and reports
 * what it committed.
 * Listeners are notified when anything was committed.
 */
public class EntityMerger {
    private static final Logger log = LoggerFactory.getLogger(EntityMerger.class);

    private final GraphStore store;
    private final DistributedLock lock;
    private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();

    public EntityMerger(GraphStore store, DistributedLock lock) {
        this.store = store;
        this.lock = lock;
    }

    public void addMutationListener(MutationListener listener) {
        listeners.add(listener);
    }

    /**
     * @throws EntityNotFoundException  if either entity is not part of the scope
     * @throws IllegalArgumentException if source and target are the same entity
     */
    public MergeResult merge(Scope scope, String sourceEntityId, String targetEntityId) {
        if (sourceEntityId.equals(targetEntityId)) {
            throw new IllegalArgumentException("Cannot merge entity " + sourceEntityId + " into itself");
        }
        String lockKey = DistributedLock.writeKey(scope);
        lock.lock(lockKey);
        try {
            return run(scope, sourceEntityId, targetEntityId);
        } finally {
            lock.unlock(lockKey);
        }
    }

    private MergeResult run(Scope scope, String sourceEntityId, String targetEntityId) {
        Entity source = store.findEntity(scope, sourceEntityId)
                .orElseThrow(() -> new EntityNotFoundException(sourceEntityId));
        Entity target = store.findEntity(scope, targetEntityId)
                .orElseThrow(() -> new EntityNotFoundException(targetEntityId));
        log.info("merge.starting scope={} sourceEntityId={} targetEntityId={}",
                scope, sourceEntityId, targetEntityId);

        List<Relationship> owned = new ArrayList<>(store.findRelationshipsOf(scope, sourceEntityId));
        owned.sort(Comparator.comparing(Relationship::getSourceEntityId)
                .thenComparing(Relationship::getTargetEntityId)
                .thenComparing(Relationship::getType));

        List<Relationship> migrated = new ArrayList<>();
        int combined = 0;
        int dropped = 0;
        Entity canonical = null;
        boolean sourceDeleted = false;
        RuntimeException error = null;
        try {
            for (Relationship relationship : owned) {
                Relationship moved = repoint(relationship, sourceEntityId, targetEntityId);
                if (moved.isSelfLoop()) {
                    dropped++;
                    continue;
                }
                boolean existing = store.findRelationship(scope, moved.key()).isPresent();
                migrated.add(store.saveRelationship(scope, moved));
                if (existing) {
                    combined++;
                }
            }
            canonical = store.saveEntity(scope, absorb(target, source));
            sourceDeleted = store.deleteEntity(scope, sourceEntityId);
        } catch (RuntimeException e) {
            error = e;
            log.error("merge.failed scope={} sourceEntityId={} targetEntityId={} migrated={} error={}",
                    scope, sourceEntityId, targetEntityId, migrated.size(), e.getMessage());
        }

        MergeResult result = new MergeResult(canonical, sourceEntityId, migrated, combined, dropped,
                sourceDeleted, error);
        if (result.hasCommitted()) {
            notifyListeners(scope);
        }
        log.info("merge.completed scope={} sourceEntityId={} targetEntityId={} migrated={} combined={} dropped={}",
                scope, sourceEntityId, targetEntityId, migrated.size(), combined, dropped);
        return result;
    }

    private static Relationship repoint(Relationship relationship, String from, String to) {
        return relationship.toBuilder()
                .sourceEntityId(relationship.getSourceEntityId().equals(from) ? to : relationship.getSourceEntityId())
                .targetEntityId(relationship.getTargetEntityId().equals(from) ? to : relationship.getTargetEntityId())
                .build();
    }

    static Entity absorb(Entity target, Entity source) {
        Entity.Builder builder = target.toBuilder();
        if (!source.getName().equals(target.getName())) {
            builder.alias(source.getName());
        }
        source.getAliases().stream()
                .filter(alias -> !alias.equals(target.getName()))
                .forEach(builder::alias);

        Map<MetadataKey, String> metadata = new EnumMap<>(MetadataKey.class);
        metadata.putAll(source.getMetadata().asMap());
        metadata.putAll(target.getMetadata().asMap());
        return builder
                .metadata(EntityMetadata.of(metadata))
                .firstSeen(earlier(target.getFirstSeen(), source.getFirstSeen()))
                .lastSeen(later(target.getLastSeen(), source.getLastSeen()))
                .build();
    }

    private static Instant earlier(Instant a, Instant b) {
        return b.isBefore(a) ? b : a;
    }

    private static Instant later(Instant a, Instant b) {
        return b.isAfter(a) ? b : a;
    }

    private void notifyListeners(Scope scope) {
        for (MutationListener listener : listeners) {
            try {
                listener.onMutation(scope);
            } catch (RuntimeException e) {
                log.warn("merge.listener.failed scope={} error={}", scope, e.getMessage());
            }
        }
    }
}
