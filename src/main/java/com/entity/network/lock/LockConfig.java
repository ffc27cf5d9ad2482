package com.entity.network.lock;

import java.time.Duration;

/**
 * @param timeout maximum time to wait for lock acquisition
 */
public record LockConfig(Duration timeout) {

    public LockConfig {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Default configuration: 30s timeout, long enough for one discovery run to finish.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(30));
    }
}
