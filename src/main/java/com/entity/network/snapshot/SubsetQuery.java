package com.entity.network.snapshot;

import com.entity.network.core.model.EntityType;

/**
 * Page of the most connected entities of a scope.
 *
 * @param limit                page size, between 10 and 200
 * @param offset               entities to skip after filtering and ranking
 * @param order                ranking of the filtered entities
 * @param entityType           keep only this type; null keeps all
 * @param namePrefix           keep only names starting with this, ignoring case; null keeps all
 * @param includeRelationships whether to return the relationships among the page
 */
public record SubsetQuery(int limit, int offset, SubsetOrder order, EntityType entityType,
                          String namePrefix, boolean includeRelationships) {

    public static final int MIN_LIMIT = 10;
    public static final int MAX_LIMIT = 200;

    public SubsetQuery {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be in [" + MIN_LIMIT + ", " + MAX_LIMIT + "], got " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        order = order != null ? order : SubsetOrder.CENTRALITY;
    }

    /**
     * First 50 entities by centrality, with their relationships.
     */
    public static SubsetQuery defaults() {
        return new SubsetQuery(50, 0, SubsetOrder.CENTRALITY, null, null, true);
    }

    public static SubsetQuery top(int limit) {
        return new SubsetQuery(limit, 0, SubsetOrder.CENTRALITY, null, null, true);
    }

    public SubsetQuery withOffset(int offset) {
        return new SubsetQuery(limit, offset, order, entityType, namePrefix, includeRelationships);
    }

    public SubsetQuery withOrder(SubsetOrder order) {
        return new SubsetQuery(limit, offset, order, entityType, namePrefix, includeRelationships);
    }

    public SubsetQuery withEntityType(EntityType entityType) {
        return new SubsetQuery(limit, offset, order, entityType, namePrefix, includeRelationships);
    }

    public SubsetQuery withNamePrefix(String namePrefix) {
        return new SubsetQuery(limit, offset, order, entityType, namePrefix, includeRelationships);
    }

    public SubsetQuery withRelationships(boolean include) {
        return new SubsetQuery(limit, offset, order, entityType, namePrefix, include);
    }
}
