package com.entity.network.store;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.Scope;

import java.util.List;
import java.util.Optional;

/**
 * Queryable store of entities and relationships, partitioned by {@link Scope}.
 *
 * <p>Implementations raise {@link com.entity.network.core.exception.StoreUnavailableException}
 * on driver failures and {@link com.entity.network.core.exception.InvalidRelationshipException}
 * when a relationship write violates the model (unknown endpoint, self-loop).</p>
 */
public interface GraphStore {

    List<Entity> findEntities(Scope scope);

    List<Relationship> findRelationships(Scope scope);

    Optional<Entity> findEntity(Scope scope, String entityId);

    Optional<Relationship> findRelationship(Scope scope, RelationshipKey key);

    /**
     * Relationships where the entity is either the source or the target.
     */
    List<Relationship> findRelationshipsOf(Scope scope, String entityId);

    Entity saveEntity(Scope scope, Entity entity);

    /**
     * Records an observation of a relationship. A new key is inserted as given; an
     * existing one is updated in place through {@link Relationship#reobserve(Relationship)}.
     *
     * @return the relationship as stored
     */
    Relationship saveRelationship(Scope scope, Relationship relationship);

    /**
     * Writes the relationship exactly as given, overwriting any stored state for its key.
     * For callers that already folded the stored state into {@code relationship}.
     */
    Relationship replaceRelationship(Scope scope, Relationship relationship);

    boolean deleteRelationship(Scope scope, RelationshipKey key);

    /**
     * Deletes the entity and every relationship touching it.
     *
     * @return true if the entity existed
     */
    boolean deleteEntity(Scope scope, String entityId);

    boolean isAvailable();
}
