package com.entity.network.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * State of one tier for one scope.
 *
 * @param entries    valid entries held for the scope
 * @param age        age of the most recently loaded valid entry, empty when none is present
 * @param generation invalidation generation; changes on every invalidation of the tier
 */
public record TierStatus(CacheTier tier, int entries, Optional<Duration> age, long hits, long misses,
                         AccessOutcome lastAccess, long generation) {

    public boolean present() {
        return entries > 0;
    }
}
