package com.entity.network.api;

import com.entity.network.core.model.EntityType;

/**
 * A node of an exported graph. Coordinates and cluster id are null when the
 * query did not ask for them or they could not be computed.
 */
public record GraphNode(String id, String label, EntityType type, Double x, Double y, String clusterId) {

    public boolean hasPosition() {
        return x != null && y != null;
    }
}
