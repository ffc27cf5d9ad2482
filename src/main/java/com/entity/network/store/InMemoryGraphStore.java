package com.entity.network.store;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory graph store for embedded use and testing.
 * Writes to one scope are synchronized on that scope's partition.
 */
public class InMemoryGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final ConcurrentHashMap<Scope, Partition> partitions = new ConcurrentHashMap<>();

    private static final class Partition {
        final Map<String, Entity> entities = new ConcurrentHashMap<>();
        final Map<RelationshipKey, Relationship> relationships = new ConcurrentHashMap<>();
    }

    private Partition partition(Scope scope) {
        return partitions.computeIfAbsent(scope, s -> new Partition());
    }

    @Override
    public List<Entity> findEntities(Scope scope) {
        List<Entity> result = new ArrayList<>(partition(scope).entities.values());
        result.sort(Comparator.comparing(Entity::getId));
        return result;
    }

    @Override
    public List<Relationship> findRelationships(Scope scope) {
        return new ArrayList<>(partition(scope).relationships.values());
    }

    @Override
    public Optional<Entity> findEntity(Scope scope, String entityId) {
        return Optional.ofNullable(partition(scope).entities.get(entityId));
    }

    @Override
    public Optional<Relationship> findRelationship(Scope scope, RelationshipKey key) {
        return Optional.ofNullable(partition(scope).relationships.get(key));
    }

    @Override
    public List<Relationship> findRelationshipsOf(Scope scope, String entityId) {
        return partition(scope).relationships.values().stream()
                .filter(r -> r.key().involves(entityId))
                .toList();
    }

    @Override
    public Entity saveEntity(Scope scope, Entity entity) {
        Partition partition = partition(scope);
        synchronized (partition) {
            partition.entities.put(entity.getId(), entity);
        }
        log.debug("Saved entity {} in scope {}", entity.getId(), scope);
        return entity;
    }

    @Override
    public Relationship saveRelationship(Scope scope, Relationship relationship) {
        Partition partition = partition(scope);
        synchronized (partition) {
            validate(scope, partition, relationship);
            return partition.relationships.merge(relationship.key(), relationship, Relationship::reobserve);
        }
    }

    @Override
    public Relationship replaceRelationship(Scope scope, Relationship relationship) {
        Partition partition = partition(scope);
        synchronized (partition) {
            validate(scope, partition, relationship);
            partition.relationships.put(relationship.key(), relationship);
        }
        return relationship;
    }

    private static void validate(Scope scope, Partition partition, Relationship relationship) {
        RelationshipValidation.check(scope, relationship,
                partition.entities.containsKey(relationship.getSourceEntityId()),
                partition.entities.containsKey(relationship.getTargetEntityId()));
    }

    @Override
    public boolean deleteRelationship(Scope scope, RelationshipKey key) {
        Partition partition = partition(scope);
        synchronized (partition) {
            return partition.relationships.remove(key) != null;
        }
    }

    @Override
    public boolean deleteEntity(Scope scope, String entityId) {
        Partition partition = partition(scope);
        synchronized (partition) {
            if (partition.entities.remove(entityId) == null) {
                return false;
            }
            partition.relationships.keySet().removeIf(key -> key.involves(entityId));
        }
        log.debug("Deleted entity {} in scope {}", entityId, scope);
        return true;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
