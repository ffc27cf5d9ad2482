package com.entity.network.discovery;

import com.entity.network.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a discovery run. {@code created} and {@code updated} list exactly the
 * relationships that were committed to the store, in commit order. When the run
 * stopped on a store failure, {@code error} holds the cause and the pairs after
 * it were not attempted.
 *
 * @param unchanged       qualifying pairs whose relationship already held all the evidence
 * @param skippedEntities distinct entity ids mentioned in content but unknown in the scope
 * @param candidatePairs  pairs that met the co-occurrence threshold
 */
public record DiscoveryResult(
        List<Relationship> created,
        List<Relationship> updated,
        int unchanged,
        int skippedEntities,
        int candidatePairs,
        RuntimeException error
) {
    public DiscoveryResult {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
    }

    public List<Relationship> committed() {
        List<Relationship> all = new ArrayList<>(created.size() + updated.size());
        all.addAll(created);
        all.addAll(updated);
        return all;
    }

    public boolean hasCommitted() {
        return !created.isEmpty() || !updated.isEmpty();
    }

    public boolean isComplete() {
        return error == null;
    }

    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "DiscoveryResult{created=" + created.size()
                + ", updated=" + updated.size()
                + ", unchanged=" + unchanged
                + ", skippedEntities=" + skippedEntities
                + ", candidatePairs=" + candidatePairs
                + ", error=" + (error != null ? error.getMessage() : "none") + '}';
    }
}
