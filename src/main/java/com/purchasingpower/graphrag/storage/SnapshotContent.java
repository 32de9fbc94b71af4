package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;

import java.util.List;
import java.util.Map;

/**
 * Serialized graph body: entity records without vectors (id order), edges in
 * insertion order, vectors keyed by entity id, store-wide metadata.
 */
public record SnapshotContent(
    List<Entity> entities,
    List<Relationship> edges,
    Map<String, EmbeddingVector> embeddings,
    Map<String, String> metadata
) {
}
