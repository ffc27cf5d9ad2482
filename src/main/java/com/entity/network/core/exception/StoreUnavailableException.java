package com.entity.network.core.exception;

/**
 * Thrown when the backing graph store cannot be read or written within the
 * configured timeout, or the driver reports a failure.
 */
public class StoreUnavailableException extends NetworkAnalyticsException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
