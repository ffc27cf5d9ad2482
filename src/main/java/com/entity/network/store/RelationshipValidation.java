package com.entity.network.store;

import com.entity.network.core.exception.InvalidRelationshipException;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.Scope;

/**
 * Write-side checks shared by store implementations.
 */
final class RelationshipValidation {

    private RelationshipValidation() {
    }

    static void check(Scope scope, Relationship relationship, boolean sourceExists, boolean targetExists) {
        if (relationship.isSelfLoop()) {
            throw new InvalidRelationshipException(
                    "Self-loop relationships are not allowed: " + relationship.getSourceEntityId());
        }
        if (!sourceExists) {
            throw new InvalidRelationshipException("Unknown source entity '"
                    + relationship.getSourceEntityId() + "' in scope " + scope);
        }
        if (!targetExists) {
            throw new InvalidRelationshipException("Unknown target entity '"
                    + relationship.getTargetEntityId() + "' in scope " + scope);
        }
    }
}
