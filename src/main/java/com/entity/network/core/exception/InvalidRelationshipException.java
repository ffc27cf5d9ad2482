package com.entity.network.core.exception;

/**
 * Thrown by a store when a relationship write is rejected: unknown endpoint,
 * self-loop, or confidence out of range.
 */
public class InvalidRelationshipException extends NetworkAnalyticsException {

    public InvalidRelationshipException(String message) {
        super(message);
    }
}
