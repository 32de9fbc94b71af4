package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.graphrag.exception.ValidationException;

/**
 * Edge types. Symmetric types describe an unordered pair; the stored edge is
 * normalised so that its source id sorts before its target id.
 *
 * @since 1.0.0
 */
public enum RelationshipType {

    COMPATIBLE_WITH("compatible-with", false),
    BELONGS_TO_CATEGORY("belongs-to-category", true),
    USED_IN_PATTERN("used-in-pattern", true),
    SOLVES("solves", false),
    REQUIRES("requires", false),
    TRIGGERED_BY("triggered-by", false),
    SIMILAR_TO("similar-to", true);

    private final String wireName;
    private final boolean symmetric;

    RelationshipType(String wireName, boolean symmetric) {
        this.wireName = wireName;
        this.symmetric = symmetric;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isSymmetric() {
        return symmetric;
    }

    @JsonCreator
    public static RelationshipType fromWireName(String value) {
        for (RelationshipType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("Unknown relationship type: " + value);
    }
}
