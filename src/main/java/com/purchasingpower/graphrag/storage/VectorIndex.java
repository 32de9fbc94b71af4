package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.EmbeddingVector;

import java.util.List;
import java.util.Optional;

/**
 * Read-only similarity index over the vectors of one snapshot.
 *
 * <p>Results are ordered by descending cosine similarity, ties broken by
 * ascending entity id, so the same query always yields the same list.
 *
 * @since 1.0.0
 */
public interface VectorIndex {

    List<NeighborMatch> search(EmbeddingVector query, int k);

    Optional<EmbeddingVector> vector(String entityId);

    int size();
}
