package com.entity.network.snapshot;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;

import java.util.List;

/**
 * Entities within a hop radius of a center entity, and the relationships among them.
 * {@code center} is null when the entity is not part of the snapshot.
 */
public record Neighborhood(Entity center, int depth, List<Entity> entities, List<Relationship> relationships) {

    public Neighborhood {
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
    }

    public boolean isEmpty() {
        return center == null;
    }
}
