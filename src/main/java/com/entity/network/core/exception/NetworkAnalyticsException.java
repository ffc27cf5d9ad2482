package com.entity.network.core.exception;

/**
 * Base class for all runtime failures raised by the network analytics engine.
 */
public class NetworkAnalyticsException extends RuntimeException {

    public NetworkAnalyticsException(String message) {
        super(message);
    }

    public NetworkAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
