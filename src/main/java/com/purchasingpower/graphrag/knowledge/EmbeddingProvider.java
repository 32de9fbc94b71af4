package com.purchasingpower.graphrag.knowledge;

import com.purchasingpower.graphrag.core.EmbeddingVector;

import java.util.List;

/**
 * Maps text to a fixed-length vector.
 *
 * <p>Implementations must be deterministic for a given model version: the same
 * text always yields the same vector. Every returned vector carries
 * {@link #modelId()}.
 *
 * @since 1.0.0
 */
public interface EmbeddingProvider {

    /**
     * Generate embedding for a single text.
     *
     * @param text Text to embed
     * @return Vector of {@link #dimension()} floats
     */
    EmbeddingVector embed(String text);

    /**
     * Generate embeddings for several texts, in input order.
     */
    List<EmbeddingVector> embedBatch(List<String> texts);

    int dimension();

    String modelId();
}
