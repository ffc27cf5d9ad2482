package com.entity.network.core.exception;

public class EntityNotFoundException extends NetworkAnalyticsException {

    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
