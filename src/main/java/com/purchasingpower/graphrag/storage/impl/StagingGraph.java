package com.purchasingpower.graphrag.storage.impl;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.exception.DanglingReferenceException;
import com.purchasingpower.graphrag.exception.NotFoundException;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.GraphWriter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable working copy of a graph. Not thread-safe; only the lock holder touches it.
 *
 * <p>All structural checks happen here so that nothing invalid can reach a
 * published snapshot.
 */
class StagingGraph implements GraphWriter {

    private final int dimension;
    private final Map<String, Entity> entities = new TreeMap<>();
    private final Map<String, EmbeddingVector> vectors = new TreeMap<>();
    private final Map<String, Relationship> edges = new LinkedHashMap<>();
    private final Map<String, String> metadata = new TreeMap<>();
    private String embeddingModel;

    StagingGraph(int dimension) {
        this.dimension = dimension;
    }

    static StagingGraph copyOf(GraphSnapshot snapshot) {
        StagingGraph staging = new StagingGraph(snapshot.dimension());
        for (Entity entity : snapshot.entities()) {
            staging.entities.put(entity.getId(), entity.withEmbedding(null));
            if (entity.getEmbedding() != null) {
                staging.vectors.put(entity.getId(), entity.getEmbedding());
            }
        }
        for (Relationship edge : snapshot.edges()) {
            staging.edges.put(edge.id(), edge);
        }
        staging.metadata.putAll(snapshot.metadata());
        staging.embeddingModel = snapshot.embeddingModel();
        return staging;
    }

    @Override
    public void putEntity(Entity entity) {
        if (entity == null || isBlank(entity.getId())) {
            throw new ValidationException("Entity id must not be blank");
        }
        if (isBlank(entity.getLabel())) {
            throw new ValidationException("Entity " + entity.getId() + " has a blank label");
        }
        if (entity.getEmbedding() != null) {
            checkDimension(entity.getId(), entity.getEmbedding());
            vectors.put(entity.getId(), entity.getEmbedding());
            trackModel(entity.getEmbedding());
        }
        entities.put(entity.getId(), entity.withEmbedding(null));
    }

    @Override
    public void putEmbedding(String entityId, EmbeddingVector vector) {
        if (!entities.containsKey(entityId)) {
            throw new NotFoundException(entityId);
        }
        if (vector == null) {
            vectors.remove(entityId);
            return;
        }
        checkDimension(entityId, vector);
        vectors.put(entityId, vector);
        trackModel(vector);
    }

    @Override
    public void putEdge(Relationship edge) {
        if (edge == null || edge.getType() == null || isBlank(edge.getSourceId()) || isBlank(edge.getTargetId())) {
            throw new ValidationException("Edge requires a source, a target and a type");
        }
        double strength = edge.getStrength();
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new ValidationException("Edge " + edge.id() + " has strength outside [0, 1]: " + strength);
        }
        if (edge.getSourceId().equals(edge.getTargetId())) {
            throw new ValidationException("Self-loop edges are not stored: " + edge.id());
        }
        if (!entities.containsKey(edge.getSourceId())) {
            throw new DanglingReferenceException(edge.id(), edge.getSourceId());
        }
        if (!entities.containsKey(edge.getTargetId())) {
            throw new DanglingReferenceException(edge.id(), edge.getTargetId());
        }
        edges.put(edge.id(), edge);
    }

    @Override
    public void setMetadata(String key, String value) {
        if (isBlank(key)) {
            throw new ValidationException("Metadata key must not be blank");
        }
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    Entity entity(String id) {
        Entity entity = entities.get(id);
        if (entity == null) {
            throw new NotFoundException(id);
        }
        return entity;
    }

    int entityCount() {
        return entities.size();
    }

    GraphSnapshot freeze(long version) {
        Map<String, Entity> merged = new TreeMap<>();
        entities.forEach((id, entity) -> merged.put(id, entity.withEmbedding(vectors.get(id))));
        return GraphSnapshot.of(
            version,
            dimension,
            vectors.isEmpty() ? null : embeddingModel,
            merged,
            edges.values().stream().toList(),
            new TreeMap<>(metadata),
            new BruteForceVectorIndex(vectors));
    }

    private void checkDimension(String entityId, EmbeddingVector vector) {
        if (vector.dimension() != dimension) {
            throw new ValidationException("Embedding for " + entityId + " has dimension "
                + vector.dimension() + ", store expects " + dimension);
        }
    }

    private void trackModel(EmbeddingVector vector) {
        if (vector.modelId() != null) {
            embeddingModel = vector.modelId();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
