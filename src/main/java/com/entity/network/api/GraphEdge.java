package com.entity.network.api;

import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipType;

/**
 * A directed edge of an exported graph.
 */
public record GraphEdge(String source, String target, RelationshipType type, double weight, double confidence) {

    public static GraphEdge of(Relationship relationship) {
        return new GraphEdge(relationship.getSourceEntityId(), relationship.getTargetEntityId(),
                relationship.getType(), relationship.getWeight(), relationship.getConfidence());
    }
}
