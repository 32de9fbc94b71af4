package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;

/**
 * Write operations shared by staging areas.
 */
public interface GraphWriter {

    void putEntity(Entity entity);

    void putEmbedding(String entityId, EmbeddingVector vector);

    void putEdge(Relationship edge);

    void setMetadata(String key, String value);
}
