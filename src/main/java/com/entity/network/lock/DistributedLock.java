package com.entity.network.lock;

import com.entity.network.core.model.Scope;

/**
 * Named mutual exclusion for writers of a scope. Every writer of a scope takes the
 * same {@link #writeKey(Scope)}, so merges, discovery runs and direct writes on one
 * scope never interleave. Implementations are re-entrant for the holding thread.
 */
public interface DistributedLock {

    static String writeKey(Scope scope) {
        return "write:" + scope.id();
    }

    /**
     * Blocks until the key is free or the configured timeout elapses.
     *
     * @throws LockAcquisitionException if the key was not granted in time
     */
    void lock(String key);

    /**
     * Releases one hold on the key. A no-op when the current thread holds nothing.
     */
    void unlock(String key);
}
