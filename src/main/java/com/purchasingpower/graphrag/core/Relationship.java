package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Typed, weighted edge between two entities.
 *
 * <p>At most one edge exists per (source, type, target). Symmetric edges are
 * stored with the lexicographically smaller id as source, so (A,B) and (B,A)
 * collapse to the same logical edge.
 *
 * @since 1.0.0
 */
@Value
public class Relationship {

    String sourceId;
    String targetId;
    RelationshipType type;
    double strength;
    String reasoning;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    RelationshipHints hints;

    @Builder
    @Jacksonized
    private Relationship(String sourceId,
                         String targetId,
                         RelationshipType type,
                         double strength,
                         String reasoning,
                         RelationshipHints hints) {
        if (type != null && type.isSymmetric() && sourceId != null && targetId != null
                && sourceId.compareTo(targetId) > 0) {
            this.sourceId = targetId;
            this.targetId = sourceId;
        } else {
            this.sourceId = sourceId;
            this.targetId = targetId;
        }
        this.type = type;
        this.strength = strength;
        this.reasoning = reasoning == null ? "" : reasoning;
        this.hints = hints;
    }

    public static String key(String sourceId, RelationshipType type, String targetId) {
        return sourceId + "|" + type.wireName() + "|" + targetId;
    }

    public String id() {
        return key(sourceId, type, targetId);
    }

    /**
     * The endpoint opposite {@code entityId}.
     */
    public String other(String entityId) {
        return sourceId.equals(entityId) ? targetId : sourceId;
    }

    public boolean touches(String entityId) {
        return sourceId.equals(entityId) || targetId.equals(entityId);
    }
}
