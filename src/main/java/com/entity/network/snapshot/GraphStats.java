package com.entity.network.snapshot;

import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.RelationshipType;

import java.util.Map;

/**
 * Summary statistics of a snapshot.
 *
 * @param nodeCount         number of entities
 * @param edgeCount         number of undirected node pairs joined by at least one relationship
 * @param relationshipCount number of directed typed relationships
 * @param density           edgeCount over the number of possible undirected pairs
 * @param componentCount    number of connected components, isolated nodes included
 * @param averageDegree     mean distinct-neighbor count
 */
public record GraphStats(
        int nodeCount,
        int edgeCount,
        int relationshipCount,
        double density,
        int componentCount,
        double averageDegree,
        Map<EntityType, Integer> entityTypes,
        Map<RelationshipType, Integer> relationshipTypes
) {
    public GraphStats {
        entityTypes = Map.copyOf(entityTypes);
        relationshipTypes = Map.copyOf(relationshipTypes);
    }
}
