package com.entity.network.core.model;

/**
 * Enumeration of entity types tracked in the network.
 * Declaration order is the fixed priority used to break ties
 * when voting for a dominant type.
 */
public enum EntityType {
    PERSON("person"),
    ORGANIZATION("organization"),
    LOCATION("location"),
    EVENT("event"),
    OTHER("other");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a stored label or enum name. Unknown values map to {@link #OTHER}.
     */
    public static EntityType fromLabel(String value) {
        if (value == null) {
            return OTHER;
        }
        for (EntityType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return OTHER;
    }
}
