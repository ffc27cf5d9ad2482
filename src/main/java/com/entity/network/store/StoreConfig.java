package com.entity.network.store;

import java.time.Duration;

/**
 * Store access configuration.
 *
 * @param readTimeout maximum time a full-scope read may take before it is reported as unavailable
 */
public record StoreConfig(Duration readTimeout) {

    public StoreConfig {
        if (readTimeout == null || readTimeout.isZero() || readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
    }

    public static StoreConfig defaults() {
        return new StoreConfig(Duration.ofSeconds(10));
    }
}
