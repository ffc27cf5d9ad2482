package com.entity.network.compute;

import java.time.Duration;

/**
 * Time and iteration allowance for a single computation.
 * Checked cooperatively by the algorithms between iterations.
 */
public final class ComputationBudget {

    private final long deadlineNanos;
    private final int maxIterations;
    private final boolean unlimited;

    private ComputationBudget(long deadlineNanos, int maxIterations, boolean unlimited) {
        this.deadlineNanos = deadlineNanos;
        this.maxIterations = maxIterations;
        this.unlimited = unlimited;
    }

    public static ComputationBudget of(Duration timeLimit, int maxIterations) {
        if (timeLimit == null || timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must be non-negative");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        return new ComputationBudget(System.nanoTime() + timeLimit.toNanos(), maxIterations, false);
    }

    public static ComputationBudget of(Duration timeLimit) {
        return of(timeLimit, Integer.MAX_VALUE);
    }

    public static ComputationBudget unlimited() {
        return new ComputationBudget(Long.MAX_VALUE, Integer.MAX_VALUE, true);
    }

    public boolean isExpired() {
        return !unlimited && System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean allowsIteration(int iteration) {
        return iteration < maxIterations && !isExpired();
    }

    public int maxIterations() {
        return maxIterations;
    }
}
