package com.entity.network.cache;

import com.entity.network.core.model.Scope;

/**
 * Listener for committed writes to a scope. Implementations react to mutations,
 * e.g. by invalidating cached analytics for the scope.
 */
public interface MutationListener {

    /**
     * Called after at least one write to the scope has been committed.
     */
    void onMutation(Scope scope);
}
