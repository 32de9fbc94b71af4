package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable float vector tagged with the model that produced it.
 *
 * @since 1.0.0
 */
public final class EmbeddingVector {

    private final float[] values;
    private final String modelId;
    private final double norm;

    @JsonCreator
    public EmbeddingVector(@JsonProperty("values") float[] values, @JsonProperty("modelId") String modelId) {
        this.values = Objects.requireNonNull(values, "values").clone();
        this.modelId = modelId;
        double sum = 0;
        for (float v : this.values) {
            sum += (double) v * v;
        }
        this.norm = Math.sqrt(sum);
    }

    @JsonGetter("values")
    public float[] values() {
        return values.clone();
    }

    @JsonGetter("modelId")
    public String modelId() {
        return modelId;
    }

    public int dimension() {
        return values.length;
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero norm.
     */
    public double cosine(EmbeddingVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + values.length + " vs " + other.values.length);
        }
        if (norm == 0 || other.norm == 0) {
            return 0.0;
        }
        double dot = 0;
        for (int i = 0; i < values.length; i++) {
            dot += (double) values[i] * other.values[i];
        }
        double cos = dot / (norm * other.norm);
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingVector that)) return false;
        return Arrays.equals(values, that.values) && Objects.equals(modelId, that.modelId);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Objects.hashCode(modelId);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dim=" + values.length + ", model=" + modelId + "]";
    }
}
