package com.entity.network.core.exception;

/**
 * Thrown when a computation, or a wait on another caller's computation,
 * exceeds its time budget and no meaningful partial result exists.
 */
public class ComputationTimeoutException extends NetworkAnalyticsException {

    public ComputationTimeoutException(String message) {
        super(message);
    }

    public ComputationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
