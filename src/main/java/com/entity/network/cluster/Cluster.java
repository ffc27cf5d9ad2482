package com.entity.network.cluster;

import com.entity.network.core.model.EntityType;
import com.entity.network.layout.Point;

import java.util.List;
import java.util.Map;

/**
 * One detected community.
 *
 * @param id                 identifier, only meaningful within the result that produced it
 * @param label              display label, {@code "<representative name> +<others>"}
 * @param representative     id of the member with the most in-cluster connections
 * @param members            member ids in ascending order
 * @param centroid           mean member position, or the origin when no layout was supplied
 * @param dominantType       most frequent member type
 * @param typeDistribution   member count per type
 */
public record Cluster(
        String id,
        String label,
        String representative,
        List<String> members,
        Point centroid,
        EntityType dominantType,
        Map<EntityType, Integer> typeDistribution
) {
    public Cluster {
        members = List.copyOf(members);
        typeDistribution = Map.copyOf(typeDistribution);
    }

    public int size() {
        return members.size();
    }
}
