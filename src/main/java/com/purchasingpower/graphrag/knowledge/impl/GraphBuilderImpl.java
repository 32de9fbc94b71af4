package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.exception.EmbeddingUnavailableException;
import com.purchasingpower.graphrag.knowledge.BuildResult;
import com.purchasingpower.graphrag.knowledge.BuildState;
import com.purchasingpower.graphrag.knowledge.BuildStatus;
import com.purchasingpower.graphrag.knowledge.Catalog;
import com.purchasingpower.graphrag.knowledge.CatalogRecord;
import com.purchasingpower.graphrag.knowledge.GraphBuilder;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.GraphStore;
import com.purchasingpower.graphrag.storage.GraphTransaction;
import com.purchasingpower.graphrag.storage.StoreMetadataKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Four-stage build: extract, embed, infer, commit.
 *
 * <p>The store's write lock is taken before the first stage and held until the
 * commit or abort, so only one build runs at a time while queries keep reading
 * the previous snapshot.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphBuilderImpl implements GraphBuilder {

    private final GraphStore graphStore;
    private final EntityExtractor entityExtractor;
    private final RelationshipInferrer relationshipInferrer;
    private final GuardedEmbeddingClient embeddingClient;
    private final GraphRagProperties properties;

    private final AtomicReference<BuildStatus> status = new AtomicReference<>(BuildStatusImpl.idle());

    @Override
    public BuildResult build(Catalog catalog) {
        long startTime = System.currentTimeMillis();
        List<String> skipped = new ArrayList<>(catalog.getRejected());

        GraphTransaction tx = graphStore.beginBuild();
        try (tx) {
            log.info("🏗️ Building graph from {} ({} records, {} patterns)",
                catalog.getSource(), catalog.getRecords().size(), catalog.getPatterns().size());

            // [Stage 1/4] Extract entities
            updateStatus(BuildState.EXTRACTING, 10, "Extracting entities", startTime);
            EntityExtractor.ExtractionResult extraction = entityExtractor.extractAll(catalog.getRecords());
            skipped.addAll(extraction.skipped());
            List<Entity> entities = extraction.entities();
            log.info("[Stage 1/4] Extracted {} entities ({} skipped)", entities.size(), skipped.size());
            if (entities.isEmpty()) {
                return fail("Catalog produced no entities", skipped, startTime);
            }

            // [Stage 2/4] Generate embeddings
            updateStatus(BuildState.EMBEDDING, 30, "Generating embeddings", startTime);
            EmbeddingOutcome outcome = embed(entities);
            List<Entity> embedded = outcome.entities();
            int embeddingCount = entities.size() - outcome.failures();
            log.info("[Stage 2/4] Embedded {} of {} entities", embeddingCount, entities.size());

            // [Stage 3/4] Infer relationships
            updateStatus(BuildState.INFERRING, 60, "Inferring relationships", startTime);
            List<Relationship> relationships = relationshipInferrer.infer(
                embedded, catalog.getPatterns(), requiresById(catalog.getRecords()));
            log.info("[Stage 3/4] Inferred {} relationships", relationships.size());

            // [Stage 4/4] Commit
            updateStatus(BuildState.COMMITTING, 90, "Committing snapshot", startTime);
            embedded.forEach(tx::putEntity);
            relationships.forEach(tx::putEdge);
            tx.setMetadata(StoreMetadataKeys.BUILD_TIMESTAMP, Instant.now().toString());
            tx.setMetadata(StoreMetadataKeys.SCHEMA_VERSION, properties.getStore().getSchemaVersion());
            tx.setMetadata(StoreMetadataKeys.ENTITIES_TOTAL, String.valueOf(entities.size()));
            tx.setMetadata(StoreMetadataKeys.RELATIONSHIPS_TOTAL, String.valueOf(relationships.size()));
            tx.setMetadata(StoreMetadataKeys.EMBEDDINGS_TOTAL, String.valueOf(embeddingCount));
            tx.setMetadata(StoreMetadataKeys.EMBEDDING_MODEL, embeddingClient.provider().modelId());
            tx.setMetadata(StoreMetadataKeys.EMBEDDING_DIMENSION, String.valueOf(embeddingClient.provider().dimension()));
            tx.setMetadata(StoreMetadataKeys.CATALOG_SOURCE, catalog.getSource());
            GraphSnapshot snapshot = tx.commit();

            long duration = System.currentTimeMillis() - startTime;
            status.set(BuildStatusImpl.completed(startTime));
            log.info("[Stage 4/4] ✅ Graph v{} committed in {}ms: {} entities, {} relationships, {} embeddings",
                snapshot.version(), duration, entities.size(), relationships.size(), embeddingCount);

            return BuildResultImpl.builder()
                .success(true)
                .entitiesCreated(entities.size())
                .relationshipsCreated(relationships.size())
                .embeddingsGenerated(embeddingCount)
                .embeddingFailures(outcome.failures())
                .snapshotVersion(snapshot.version())
                .durationMs(duration)
                .skippedRecords(skipped)
                .build();
        } catch (RuntimeException e) {
            log.error("❌ Graph build failed, previous graph stays live", e);
            return fail(e.getClass().getSimpleName() + ": " + e.getMessage(), skipped, startTime);
        }
    }

    @Override
    public BuildStatus getStatus() {
        return status.get();
    }

    /**
     * Embeds in batches; a batch that still fails after its retries falls back
     * to one call per entity, and an entity that still fails stays without a vector.
     */
    private EmbeddingOutcome embed(List<Entity> entities) {
        int batchSize = properties.getEmbedding().getBatchSize();
        List<Entity> result = new ArrayList<>(entities.size());
        int failures = 0;
        for (int from = 0; from < entities.size(); from += batchSize) {
            List<Entity> batch = entities.subList(from, Math.min(from + batchSize, entities.size()));
            List<String> texts = batch.stream().map(Entity::embeddingText).toList();
            try {
                List<EmbeddingVector> vectors = embeddingClient.embedBatchForBuild(texts);
                for (int i = 0; i < batch.size(); i++) {
                    result.add(batch.get(i).withEmbedding(vectors.get(i)));
                }
            } catch (EmbeddingUnavailableException e) {
                log.warn("⚠️ Batch of {} failed, embedding entities one by one: {}", batch.size(), e.getMessage());
                for (Entity entity : batch) {
                    Entity single = embedSingle(entity);
                    if (!single.hasEmbedding()) {
                        failures++;
                    }
                    result.add(single);
                }
            }
        }
        return new EmbeddingOutcome(result, failures);
    }

    /**
     * Returns the entity unchanged when no vector could be produced.
     */
    private Entity embedSingle(Entity entity) {
        try {
            return entity.withEmbedding(embeddingClient.embedForBuild(entity.embeddingText()));
        } catch (EmbeddingUnavailableException e) {
            log.warn("⚠️ No embedding for {}, excluded from vector search: {}", entity.getId(), e.getMessage());
            return entity;
        }
    }

    private record EmbeddingOutcome(List<Entity> entities, int failures) {
    }

    private static Map<String, List<String>> requiresById(List<CatalogRecord> records) {
        Map<String, List<String>> requires = new LinkedHashMap<>();
        for (CatalogRecord record : records) {
            if (record.getId() != null && !record.getRequires().isEmpty()) {
                requires.put(record.getId().trim(), record.getRequires());
            }
        }
        return requires;
    }

    private BuildResult fail(String reason, List<String> skipped, long startTime) {
        status.set(BuildStatusImpl.failed(reason, startTime));
        log.error("❌ Build failed: {}", reason);
        return BuildResultImpl.failure(reason, skipped, System.currentTimeMillis() - startTime);
    }

    private void updateStatus(BuildState state, int progress, String step, long startTime) {
        status.set(BuildStatusImpl.inProgress(state, progress, step, startTime));
    }
}
