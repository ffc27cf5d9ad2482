package com.entity.network.path;

public enum PathOutcome {
    FOUND,
    /** Both entities exist but no path within the hop bound connects them. */
    NOT_FOUND,
    /** Source or target is not part of the snapshot. */
    UNKNOWN_ENTITY
}
