package com.entity.network.merge;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of merging one entity into another.
 *
 * <p>{@code migrated} lists the relationships written with the target as endpoint,
 * in commit order. When the merge stopped on a store failure, {@code error} holds
 * the cause; everything listed was committed and nothing after it was attempted.</p>
 *
 * @param canonical      the target entity as saved, or null if it was not saved
 * @param mergedEntityId id of the entity merged away
 * @param combined       migrated relationships that folded into an existing one
 * @param dropped        relationships between source and target, removed with the source
 * @param sourceDeleted  whether the source entity was deleted
 */
public record MergeResult(
        Entity canonical,
        String mergedEntityId,
        List<Relationship> migrated,
        int combined,
        int dropped,
        boolean sourceDeleted,
        RuntimeException error
) {
    public MergeResult {
        migrated = List.copyOf(migrated);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasCommitted() {
        return !migrated.isEmpty() || canonical != null || sourceDeleted;
    }

    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(error);
    }
}
