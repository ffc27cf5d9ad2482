package com.entity.network.discovery;

import com.entity.network.core.model.RelationshipType;

/**
 * Inferred relationship type and the number of keyword hits supporting it.
 */
public record Classification(RelationshipType type, int hits) {

    public static Classification generic() {
        return new Classification(RelationshipType.ASSOCIATED_WITH, 0);
    }
}
