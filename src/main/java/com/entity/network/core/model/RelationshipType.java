package com.entity.network.core.model;

/**
 * Relationship types between entities. {@link #ASSOCIATED_WITH} is the
 * generic type used when nothing more specific can be inferred.
 */
public enum RelationshipType {
    SUPPORTS("supports"),
    OPPOSES("opposes"),
    COLLABORATES_WITH("collaborates_with"),
    IMPLEMENTS("implements"),
    IMPACTS("impacts"),
    RESPONDS_TO("responds_to"),
    PART_OF("part_of"),
    LEADS("leads"),
    FUNDS("funds"),
    REGULATES("regulates"),
    ASSOCIATED_WITH("associated_with");

    private final String label;

    RelationshipType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a stored label or enum name. Unknown values map to {@link #ASSOCIATED_WITH}.
     */
    public static RelationshipType fromLabel(String value) {
        if (value == null) {
            return ASSOCIATED_WITH;
        }
        for (RelationshipType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return ASSOCIATED_WITH;
    }
}
