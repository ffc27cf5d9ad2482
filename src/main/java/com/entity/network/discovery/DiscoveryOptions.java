package com.entity.network.discovery;

import java.time.Duration;
import java.time.Instant;

/**
 * Options for one discovery run.
 *
 * @param minCoOccurrences minimum number of distinct items that must mention both entities
 * @param timeWindow       only items at most this old relative to {@code referenceTime} count; null counts all
 * @param referenceTime    "now" for the time window; null uses the discovery clock
 * @param maxPairs         cap on pairs processed per run, most frequent first
 */
public record DiscoveryOptions(int minCoOccurrences, Duration timeWindow, Instant referenceTime, int maxPairs) {

    public DiscoveryOptions {
        if (minCoOccurrences < 1) {
            throw new IllegalArgumentException("minCoOccurrences must be at least 1");
        }
        if (timeWindow != null && timeWindow.isNegative()) {
            throw new IllegalArgumentException("timeWindow must not be negative");
        }
        if (maxPairs < 1) {
            throw new IllegalArgumentException("maxPairs must be at least 1");
        }
    }

    /**
     * Two co-occurrences within the last 30 days, at most 100 pairs.
     */
    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(2, Duration.ofDays(30), null, 100);
    }

    public static DiscoveryOptions of(int minCoOccurrences, Duration timeWindow) {
        return new DiscoveryOptions(minCoOccurrences, timeWindow, null, 100);
    }

    public DiscoveryOptions withReferenceTime(Instant reference) {
        return new DiscoveryOptions(minCoOccurrences, timeWindow, reference, maxPairs);
    }

    public DiscoveryOptions withMaxPairs(int max) {
        return new DiscoveryOptions(minCoOccurrences, timeWindow, referenceTime, max);
    }
}
