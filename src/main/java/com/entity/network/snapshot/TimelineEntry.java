package com.entity.network.snapshot;

import com.entity.network.core.model.Entity;
import com.entity.network.core.model.Relationship;

/**
 * One relationship of an entity, seen from that entity.
 */
public record TimelineEntry(Entity counterpart, Direction direction, Relationship relationship) {

    public enum Direction {
        OUTGOING,
        INCOMING
    }
}
