package com.entity.network.snapshot;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;

import java.util.List;

/**
 * One page of a scope's entities with the relationships among them.
 *
 * @param totalEntities    entities in the snapshot
 * @param filteredEntities entities left after the type and name filters
 */
public record GraphSubset(
        List<Node> nodes,
        List<Relationship> relationships,
        int totalEntities,
        int totalRelationships,
        int filteredEntities,
        int limit,
        int offset
) {
    public GraphSubset {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
    }

    public boolean hasMore() {
        return offset + limit < filteredEntities;
    }

    /**
     * @param centrality degree over {@code nodeCount - 1}
     */
    public record Node(Entity entity, int degree, double centrality) {
    }
}
