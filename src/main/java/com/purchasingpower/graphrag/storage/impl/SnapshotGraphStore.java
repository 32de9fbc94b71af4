package com.purchasingpower.graphrag.storage.impl;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.MetadataKeys;
import com.purchasingpower.graphrag.core.MetadataValue;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.exception.BuildInProgressException;
import com.purchasingpower.graphrag.exception.GraphRagException;
import com.purchasingpower.graphrag.exception.StorageCorruptionException;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.GraphStore;
import com.purchasingpower.graphrag.storage.GraphStoreStats;
import com.purchasingpower.graphrag.storage.GraphTransaction;
import com.purchasingpower.graphrag.storage.NeighborMatch;
import com.purchasingpower.graphrag.storage.QueryTrace;
import com.purchasingpower.graphrag.storage.SnapshotCodec;
import com.purchasingpower.graphrag.storage.SnapshotDocument;
import com.purchasingpower.graphrag.storage.SnapshotPersistence;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * {@link GraphStore} that publishes immutable snapshots through an atomic reference.
 *
 * <p>Every mutation, single or bulk, runs under one write lock against a staging
 * copy; the staged graph is persisted first and only then swapped live, so a
 * failed write leaves both the durable and the visible graph unchanged.
 *
 * @since 1.0.0
 */
@Slf4j
public class SnapshotGraphStore implements GraphStore {

    private final int dimension;
    private final String schemaVersion;
    private final int maxQueryTraces;
    private final SnapshotPersistence persistence;
    private final SnapshotCodec codec = new SnapshotCodec();

    private final AtomicReference<GraphSnapshot> current;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Deque<QueryTrace> traces = new ArrayDeque<>();

    private volatile StorageCorruptionException corruption;
    private long lastVersion;

    public SnapshotGraphStore(int dimension, String schemaVersion, int maxQueryTraces, SnapshotPersistence persistence) {
        if (dimension <= 0) {
            throw new ValidationException("Store dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.schemaVersion = schemaVersion;
        this.maxQueryTraces = maxQueryTraces;
        this.persistence = persistence;
        this.current = new AtomicReference<>(new StagingGraph(dimension).freeze(0));
    }

    /**
     * Loads the persisted snapshot, if any. A snapshot that fails verification
     * leaves the store unavailable for reads until a new graph is committed.
     */
    public void open() {
        writeLock.lock();
        try {
            Optional<SnapshotDocument> loaded = persistence.load();
            if (loaded.isEmpty()) {
                log.info("📭 No persisted graph found, starting empty (dimension={})", dimension);
                return;
            }
            SnapshotDocument document = loaded.get();
            if (document.manifest().embeddingDimension() != dimension) {
                throw new StorageCorruptionException(Path.of("snapshot"),
                    "Persisted graph has dimension " + document.manifest().embeddingDimension()
                        + " but the embedding provider produces " + dimension);
            }
            StagingGraph staging = new StagingGraph(dimension);
            codec.applyTo(document.content(), staging);
            GraphSnapshot snapshot = staging.freeze(document.manifest().snapshotVersion());
            lastVersion = snapshot.version();
            current.set(snapshot);
            corruption = null;
            log.info("✅ Loaded graph v{}: {} entities, {} edges, {} embeddings",
                snapshot.version(), snapshot.entityCount(), snapshot.edges().size(), snapshot.embeddingCount());
        } catch (StorageCorruptionException e) {
            corruption = e;
            log.error("❌ Persisted graph failed verification, refusing reads until rebuild or import: {}",
                e.getMessage());
        } catch (GraphRagException e) {
            corruption = new StorageCorruptionException(Path.of("snapshot"), "Persisted graph is inconsistent", e);
            log.error("❌ Persisted graph is inconsistent, refusing reads until rebuild or import: {}",
                e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isAvailable() {
        return corruption == null;
    }

    // ================================================================
    // READS
    // ================================================================

    @Override
    public GraphSnapshot snapshot() {
        StorageCorruptionException failure = corruption;
        if (failure != null) {
            throw failure;
        }
        return current.get();
    }

    @Override
    public Entity getEntity(String entityId) {
        return snapshot().entity(entityId);
    }

    @Override
    public Optional<Entity> findEntity(String entityId) {
        return snapshot().findEntity(entityId);
    }

    @Override
    public List<Relationship> edgesFrom(String entityId) {
        return snapshot().edgesFrom(entityId);
    }

    @Override
    public List<Relationship> edgesTo(String entityId) {
        return snapshot().edgesTo(entityId);
    }

    @Override
    public List<NeighborMatch> nearestNeighbors(EmbeddingVector query, int k) {
        return snapshot().nearestNeighbors(query, k);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public Optional<String> getMetadata(String key) {
        return snapshot().metadata(key);
    }

    @Override
    public Map<String, String> getAllMetadata() {
        return snapshot().metadata();
    }

    @Override
    public GraphStoreStats stats() {
        return snapshot().stats();
    }

    // ================================================================
    // SINGLE WRITES
    // ================================================================

    @Override
    public void putEntity(Entity entity) {
        mutate(staging -> staging.putEntity(entity));
    }

    @Override
    public void putEmbedding(String entityId, EmbeddingVector vector) {
        mutate(staging -> staging.putEmbedding(entityId, vector));
    }

    @Override
    public void putEdge(Relationship edge) {
        mutate(staging -> staging.putEdge(edge));
    }

    @Override
    public void setMetadata(String key, String value) {
        mutate(staging -> staging.setMetadata(key, value));
    }

    @Override
    public void updateEntityMetrics(String entityId, OptionalDouble successRate, OptionalLong usageCount, OptionalDouble rating) {
        if (successRate.isPresent() && (successRate.getAsDouble() < 0 || successRate.getAsDouble() > 1)) {
            throw new ValidationException("Success rate must be within [0, 1]: " + successRate.getAsDouble());
        }
        mutate(staging -> {
            Entity entity = staging.entity(entityId);
            Map<String, MetadataValue> metadata = new TreeMap<>(entity.getMetadata());
            successRate.ifPresent(v -> metadata.put(MetadataKeys.SUCCESS_RATE, MetadataValue.of(v)));
            usageCount.ifPresent(v -> metadata.put(MetadataKeys.USAGE_COUNT, MetadataValue.of(v)));
            rating.ifPresent(v -> metadata.put(MetadataKeys.RATING, MetadataValue.of(v)));
            staging.putEntity(entity.toBuilder().metadata(metadata).build());
        });
        log.debug("Updated metrics for {}", entityId);
    }

    private void mutate(Consumer<StagingGraph> change) {
        if (!writeLock.tryLock()) {
            throw new BuildInProgressException();
        }
        if (writeLock.getHoldCount() > 1) {
            // this thread already holds an open build transaction
            writeLock.unlock();
            throw new BuildInProgressException();
        }
        try {
            StagingGraph staging = StagingGraph.copyOf(snapshot());
            change.accept(staging);
            publish(staging);
        } finally {
            writeLock.unlock();
        }
    }

    // ================================================================
    // BUILDS
    // ================================================================

    @Override
    public GraphTransaction beginBuild() {
        if (!writeLock.tryLock()) {
            throw new BuildInProgressException();
        }
        if (writeLock.getHoldCount() > 1) {
            writeLock.unlock();
            throw new BuildInProgressException();
        }
        log.debug("🔒 Build transaction opened");
        return new StoreTransaction(new StagingGraph(dimension));
    }

    @Override
    public boolean isBuildInProgress() {
        return writeLock.isLocked();
    }

    private GraphSnapshot publish(StagingGraph staging) {
        GraphSnapshot next = staging.freeze(lastVersion + 1);
        persistence.save(codec.encode(next, schemaVersion));
        lastVersion = next.version();
        current.set(next);
        corruption = null;
        return next;
    }

    private final class StoreTransaction implements GraphTransaction {

        private final StagingGraph staging;
        private boolean open = true;

        private StoreTransaction(StagingGraph staging) {
            this.staging = staging;
        }

        @Override
        public void putEntity(Entity entity) {
            ensureOpen();
            staging.putEntity(entity);
        }

        @Override
        public void putEmbedding(String entityId, EmbeddingVector vector) {
            ensureOpen();
            staging.putEmbedding(entityId, vector);
        }

        @Override
        public void putEdge(Relationship edge) {
            ensureOpen();
            staging.putEdge(edge);
        }

        @Override
        public void setMetadata(String key, String value) {
            ensureOpen();
            staging.setMetadata(key, value);
        }

        @Override
        public int entityCount() {
            return staging.entityCount();
        }

        @Override
        public GraphSnapshot commit() {
            ensureOpen();
            try {
                GraphSnapshot published = publish(staging);
                log.info("✅ Committed graph v{}: {} entities, {} edges",
                    published.version(), published.entityCount(), published.edges().size());
                return published;
            } finally {
                open = false;
                writeLock.unlock();
            }
        }

        @Override
        public void abort() {
            if (!open) {
                return;
            }
            open = false;
            writeLock.unlock();
            log.warn("↩️ Build transaction aborted, graph v{} stays live", current.get().version());
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        private void ensureOpen() {
            if (!open) {
                throw new IllegalStateException("Transaction already committed or aborted");
            }
        }
    }

    // ================================================================
    // QUERY TELEMETRY
    // ================================================================

    @Override
    public void recordQuery(QueryTrace trace) {
        synchronized (traces) {
            traces.addFirst(trace);
            while (traces.size() > maxQueryTraces) {
                traces.removeLast();
            }
        }
        try {
            persistence.appendQuery(trace);
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to append query trace: {}", e.getMessage());
        }
    }

    @Override
    public List<QueryTrace> recentQueries(int limit) {
        List<QueryTrace> result = new ArrayList<>();
        synchronized (traces) {
            Iterator<QueryTrace> it = traces.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }
}
