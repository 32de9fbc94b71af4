package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.TraversalDirection;
import com.purchasingpower.graphrag.exception.NotFoundException;
import com.purchasingpower.graphrag.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Immutable, versioned view of the whole graph.
 *
 * <p>Readers obtain a snapshot once per request and keep using it; a commit
 * publishes a new snapshot without touching the old one, so a reader never
 * observes a half-applied build. Derived indexes (keyword postings and the
 * like) are memoised per snapshot through {@link #memo}.
 *
 * @since 1.0.0
 */
public final class GraphSnapshot {

    private final long version;
    private final int dimension;
    private final String embeddingModel;
    private final Map<String, Entity> entities;
    private final List<Relationship> edges;
    private final Map<String, Relationship> edgesById;
    private final Map<String, List<Relationship>> outgoing;
    private final Map<String, List<Relationship>> incoming;
    private final Map<String, String> metadata;
    private final VectorIndex vectorIndex;
    private final Map<Class<?>, Object> memo = new ConcurrentHashMap<>();

    private GraphSnapshot(long version,
                          int dimension,
                          String embeddingModel,
                          Map<String, Entity> entities,
                          List<Relationship> edges,
                          Map<String, String> metadata,
                          VectorIndex vectorIndex) {
        this.version = version;
        this.dimension = dimension;
        this.embeddingModel = embeddingModel;
        this.entities = Collections.unmodifiableMap(entities);
        this.edges = List.copyOf(edges);
        this.metadata = Collections.unmodifiableMap(metadata);
        this.vectorIndex = vectorIndex;

        Map<String, Relationship> byId = new LinkedHashMap<>();
        Map<String, List<Relationship>> out = new LinkedHashMap<>();
        Map<String, List<Relationship>> in = new LinkedHashMap<>();
        for (Relationship edge : this.edges) {
            byId.put(edge.id(), edge);
            out.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
        }
        this.edgesById = Collections.unmodifiableMap(byId);
        this.outgoing = freezeLists(out);
        this.incoming = freezeLists(in);
    }

    /**
     * @param entities entities keyed by id, already merged with their vectors and ordered by id
     * @param edges    edges in insertion order
     */
    public static GraphSnapshot of(long version,
                                   int dimension,
                                   String embeddingModel,
                                   Map<String, Entity> entities,
                                   List<Relationship> edges,
                                   Map<String, String> metadata,
                                   VectorIndex vectorIndex) {
        return new GraphSnapshot(version, dimension, embeddingModel, entities, edges, metadata, vectorIndex);
    }

    public long version() {
        return version;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * Model id recorded for the vectors of this snapshot, or null when it holds none.
     */
    public String embeddingModel() {
        return embeddingModel;
    }

    // ================================================================
    // ENTITIES
    // ================================================================

    public Optional<Entity> findEntity(String id) {
        return Optional.ofNullable(id == null ? null : entities.get(id));
    }

    public Entity entity(String id) {
        return findEntity(id).orElseThrow(() -> new NotFoundException(id));
    }

    public boolean containsEntity(String id) {
        return id != null && entities.containsKey(id);
    }

    /**
     * All entities ordered by id.
     */
    public Collection<Entity> entities() {
        return entities.values();
    }

    public int entityCount() {
        return entities.size();
    }

    // ================================================================
    // EDGES
    // ================================================================

    public List<Relationship> edges() {
        return edges;
    }

    public Optional<Relationship> edge(String sourceId, RelationshipType type, String targetId) {
        Relationship direct = edgesById.get(Relationship.key(sourceId, type, targetId));
        if (direct == null && type.isSymmetric()) {
            direct = edgesById.get(Relationship.key(targetId, type, sourceId));
        }
        return Optional.ofNullable(direct);
    }

    public List<Relationship> edgesFrom(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Relationship> edgesTo(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Edges a traversal may follow out of {@code id}. Symmetric edges qualify in every direction.
     */
    public List<Relationship> adjacent(String id, TraversalDirection direction) {
        List<Relationship> result = new ArrayList<>();
        for (Relationship edge : edgesFrom(id)) {
            if (direction != TraversalDirection.INCOMING || edge.getType().isSymmetric()) {
                result.add(edge);
            }
        }
        for (Relationship edge : edgesTo(id)) {
            if (direction != TraversalDirection.OUTGOING || edge.getType().isSymmetric()) {
                result.add(edge);
            }
        }
        return result;
    }

    // ================================================================
    // VECTORS
    // ================================================================

    public List<NeighborMatch> nearestNeighbors(EmbeddingVector query, int k) {
        if (query.dimension() != dimension) {
            throw new ValidationException("Query vector has dimension " + query.dimension()
                + ", store expects " + dimension);
        }
        if (k <= 0) {
            return List.of();
        }
        return vectorIndex.search(query, k);
    }

    public Optional<EmbeddingVector> vector(String entityId) {
        return vectorIndex.vector(entityId);
    }

    public int embeddingCount() {
        return vectorIndex.size();
    }

    // ================================================================
    // METADATA & STATS
    // ================================================================

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public GraphStoreStats stats() {
        Map<EntityCategory, Integer> byCategory = new EnumMap<>(EntityCategory.class);
        for (Entity entity : entities.values()) {
            byCategory.merge(entity.getCategory(), 1, Integer::sum);
        }
        Map<RelationshipType, Integer> byType = new EnumMap<>(RelationshipType.class);
        double strengthSum = 0;
        for (Relationship edge : edges) {
            byType.merge(edge.getType(), 1, Integer::sum);
            strengthSum += edge.getStrength();
        }
        return new GraphStoreStats(
            version,
            entities.size(),
            edges.size(),
            vectorIndex.size(),
            edges.isEmpty() ? 0.0 : strengthSum / edges.size(),
            Collections.unmodifiableMap(byCategory),
            Collections.unmodifiableMap(byType));
    }

    /**
     * Returns the value derived from this snapshot for {@code key}, computing it once.
     */
    @SuppressWarnings("unchecked")
    public <T> T memo(Class<T> key, Function<GraphSnapshot, T> factory) {
        return (T) memo.computeIfAbsent(key, k -> factory.apply(this));
    }

    private static Map<String, List<Relationship>> freezeLists(Map<String, List<Relationship>> source) {
        Map<String, List<Relationship>> frozen = new LinkedHashMap<>();
        source.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}
