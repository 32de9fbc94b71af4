package com.purchasingpower.graphrag.config;

import com.purchasingpower.graphrag.core.RelationshipType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Relationship inference thresholds and weights.
 *
 * <p>Edge strength is {@code clamp01(typeBase + similarityWeight * s + cooccurrenceWeight * c)}
 * where {@code s} is the cosine similarity of the pair (zero below
 * {@code candidateSimilarityThreshold}) and {@code c} is the pair's pattern
 * co-occurrence count relative to the catalog maximum.
 */
@Data
public class BuilderProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double candidateSimilarityThreshold = 0.6;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarToThreshold = 0.85;

    @Min(1)
    private int maxEdgesPerEntity = 30;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityWeight = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double cooccurrenceWeight = 0.3;

    @Min(1)
    private int minUseCases = 2;

    @Min(1)
    private int maxUseCases = 6;

    private Map<RelationshipType, Double> typeBase = defaultTypeBase();

    public double baseFor(RelationshipType type) {
        return typeBase.getOrDefault(type, 0.3);
    }

    private static Map<RelationshipType, Double> defaultTypeBase() {
        Map<RelationshipType, Double> base = new EnumMap<>(RelationshipType.class);
        base.put(RelationshipType.BELONGS_TO_CATEGORY, 0.2);
        base.put(RelationshipType.USED_IN_PATTERN, 0.4);
        base.put(RelationshipType.COMPATIBLE_WITH, 0.4);
        base.put(RelationshipType.TRIGGERED_BY, 0.4);
        base.put(RelationshipType.REQUIRES, 0.5);
        base.put(RelationshipType.SIMILAR_TO, 0.1);
        base.put(RelationshipType.SOLVES, 0.3);
        return base;
    }
}
