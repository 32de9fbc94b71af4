package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Embedded single-writer, many-reader store for the catalog graph.
 *
 * <p>Reads always go to the last committed {@link GraphSnapshot} and never block.
 * Mutations are serialised by one write lock; a build stages a complete graph in
 * a {@link GraphTransaction} and publishes it atomically.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Entity Operations
    // =========================================================================

    /**
     * Store or overwrite an entity. A non-null embedding replaces the stored vector;
     * a null embedding leaves any stored vector in place.
     *
     * @param entity Entity to store
     * @throws com.purchasingpower.graphrag.exception.ValidationException on blank id/label or wrong dimension
     */
    void putEntity(Entity entity);

    /**
     * Get an entity by ID.
     *
     * @throws com.purchasingpower.graphrag.exception.NotFoundException when absent
     */
    Entity getEntity(String entityId);

    Optional<Entity> findEntity(String entityId);

    /**
     * Replace the vector of an existing entity without rewriting its record.
     */
    void putEmbedding(String entityId, EmbeddingVector vector);

    /**
     * Narrow write path for the learning component. Empty optionals leave the
     * current value untouched.
     */
    void updateEntityMetrics(String entityId, OptionalDouble successRate, OptionalLong usageCount, OptionalDouble rating);

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    /**
     * @throws com.purchasingpower.graphrag.exception.DanglingReferenceException when an endpoint is missing
     * @throws com.purchasingpower.graphrag.exception.ValidationException when strength is outside [0, 1]
     */
    void putEdge(Relationship edge);

    /**
     * Edges stored with {@code entityId} as source, in insertion order.
     */
    List<Relationship> edgesFrom(String entityId);

    /**
     * Edges stored with {@code entityId} as target, in insertion order.
     */
    List<Relationship> edgesTo(String entityId);

    // =========================================================================
    // Vector Search
    // =========================================================================

    /**
     * Top-k entities by descending cosine similarity, ties by ascending id.
     */
    List<NeighborMatch> nearestNeighbors(EmbeddingVector query, int k);

    int dimension();

    // =========================================================================
    // Metadata, Stats & Snapshots
    // =========================================================================

    void setMetadata(String key, String value);

    Optional<String> getMetadata(String key);

    Map<String, String> getAllMetadata();

    GraphStoreStats stats();

    /**
     * The current committed snapshot. Callers should read one snapshot per request.
     *
     * @throws com.purchasingpower.graphrag.exception.StorageCorruptionException when the
     *         persisted graph failed verification and nothing has been committed since
     */
    GraphSnapshot snapshot();

    /**
     * Acquire the write lock and open an empty staging area.
     *
     * @throws com.purchasingpower.graphrag.exception.BuildInProgressException when a build is already open
     */
    GraphTransaction beginBuild();

    boolean isBuildInProgress();

    // =========================================================================
    // Query Telemetry
    // =========================================================================

    void recordQuery(QueryTrace trace);

    /**
     * Most recent traces, newest first.
     */
    List<QueryTrace> recentQueries(int limit);
}
