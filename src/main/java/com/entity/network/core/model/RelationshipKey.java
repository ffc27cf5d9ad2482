package com.entity.network.core.model;

import java.util.Objects;

/**
 * Identity of a relationship within a scope. At most one relationship
 * exists per key; re-observation updates it in place.
 */
public record RelationshipKey(String sourceEntityId, String targetEntityId, RelationshipType type) {

    public RelationshipKey {
        Objects.requireNonNull(sourceEntityId, "sourceEntityId is required");
        Objects.requireNonNull(targetEntityId, "targetEntityId is required");
        Objects.requireNonNull(type, "type is required");
    }

    public boolean involves(String entityId) {
        return sourceEntityId.equals(entityId) || targetEntityId.equals(entityId);
    }
}
