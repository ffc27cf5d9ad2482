package com.entity.network.core.model;

import java.util.Objects;

/**
 * Tenant/user boundary under which entities, relationships and cached
 * analytics are partitioned.
 *
 * @param id the scope identifier
 */
public record Scope(String id) {

    public Scope {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("scope id must not be blank");
        }
    }

    public static Scope of(String id) {
        return new Scope(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
