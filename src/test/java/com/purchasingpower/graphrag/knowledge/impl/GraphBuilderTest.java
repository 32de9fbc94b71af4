package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.GraphFixtures;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.exception.BuildInProgressException;
import com.purchasingpower.graphrag.knowledge.BuildResult;
import com.purchasingpower.graphrag.knowledge.BuildState;
import com.purchasingpower.graphrag.knowledge.Catalog;
import com.purchasingpower.graphrag.knowledge.CatalogRecord;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.GraphTransaction;
import com.purchasingpower.graphrag.storage.StoreMetadataKeys;
import com.purchasingpower.graphrag.storage.impl.SnapshotGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end build over the sample catalog with the hashing provider.
 */
@DisplayName("Graph Builder Tests")
class GraphBuilderTest {

    private GraphFixtures.Pipeline pipeline;
    private Catalog catalog;

    @BeforeEach
    void setUp() {
        pipeline = GraphFixtures.pipeline();
        catalog = GraphFixtures.load(GraphFixtures.SAMPLE_CATALOG);
    }

    @Test
    @DisplayName("Should build the sample catalog and report skipped records")
    void testSampleBuild() {
        // When
        BuildResult result = pipeline.builder().build(catalog);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(11, result.getEntitiesCreated());
        assertEquals(11, result.getEmbeddingsGenerated());
        assertEquals(0, result.getEmbeddingFailures());
        assertThat(result.getSkippedRecords()).hasSize(3);
        assertThat(result.getRelationshipsCreated()).isPositive();

        GraphSnapshot snapshot = pipeline.store().snapshot();
        assertEquals(result.getSnapshotVersion(), snapshot.version());
        assertEquals(11, snapshot.entityCount());
        assertEquals(result.getRelationshipsCreated(), snapshot.edges().size());
        assertThat(snapshot.metadata(StoreMetadataKeys.EMBEDDING_DIMENSION)).contains("64");
        assertThat(snapshot.metadata(StoreMetadataKeys.ENTITIES_TOTAL)).contains("11");
        assertThat(snapshot.metadata(StoreMetadataKeys.BUILD_TIMESTAMP)).isPresent();
        assertEquals(BuildState.COMPLETED, pipeline.builder().getStatus().getState());
    }

    @Test
    @DisplayName("Should never commit an edge to an unknown entity")
    void testReferentialIntegrity() {
        pipeline.builder().build(catalog);

        GraphSnapshot snapshot = pipeline.store().snapshot();
        Set<String> ids = snapshot.entities().stream().map(Entity::getId).collect(Collectors.toSet());
        assertThat(ids).doesNotContain("ghost-node");
        assertThat(snapshot.edges()).allSatisfy(edge -> {
            assertThat(ids).contains(edge.getSourceId(), edge.getTargetId());
            assertThat(edge.getStrength()).isBetween(0.0, 1.0);
        });
    }

    @Test
    @DisplayName("Should produce the same graph when rebuilt from the same catalog")
    void testIdempotentRebuild() {
        // Given
        pipeline.builder().build(catalog);
        GraphSnapshot first = pipeline.store().snapshot();

        // When
        pipeline.builder().build(catalog);
        GraphSnapshot second = pipeline.store().snapshot();

        // Then
        assertEquals(first.version() + 1, second.version());
        assertEquals(new ArrayList<>(first.entities()), new ArrayList<>(second.entities()));
        assertEquals(first.edges(), second.edges());
    }

    @Test
    @DisplayName("Should commit entities without vectors when embedding keeps failing")
    void testEmbeddingFailuresDoNotAbortBuild() {
        // Given
        SnapshotGraphStore store = GraphFixtures.store();
        GraphFixtures.Pipeline failing = GraphFixtures.pipeline(
            store, GraphFixtures.failingProvider(Duration.ZERO), GraphFixtures.properties());

        // When
        BuildResult result = failing.builder().build(catalog);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(11, result.getEntitiesCreated());
        assertEquals(0, result.getEmbeddingsGenerated());
        assertEquals(11, result.getEmbeddingFailures());
        assertEquals(0, store.snapshot().embeddingCount());
        assertEquals(11, store.snapshot().entityCount());
    }

    @Test
    @DisplayName("Should count only the entities whose one-by-one fallback also failed")
    void testPartialEmbeddingFailures() {
        // Given: Batches always fail and Discord cannot be embedded on its own either
        HashingEmbeddingProvider delegate = new HashingEmbeddingProvider(GraphFixtures.DIMENSION);
        EmbeddingProvider patchy = mock(EmbeddingProvider.class);
        when(patchy.dimension()).thenReturn(GraphFixtures.DIMENSION);
        when(patchy.modelId()).thenReturn("patchy");
        when(patchy.embedBatch(anyList())).thenThrow(new IllegalStateException("batch endpoint down"));
        when(patchy.embed(anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            if (text.startsWith("Discord")) {
                throw new IllegalStateException("rejected input");
            }
            return delegate.embed(text);
        });
        SnapshotGraphStore store = GraphFixtures.store();

        // When
        BuildResult result = GraphFixtures.pipeline(store, patchy, GraphFixtures.properties())
            .builder().build(catalog);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(1, result.getEmbeddingFailures());
        assertEquals(10, result.getEmbeddingsGenerated());
        assertEquals(10, store.snapshot().embeddingCount());
        assertFalse(store.snapshot().vector("discord").isPresent());
    }

    @Test
    @DisplayName("Should fail without touching the live graph when no record is usable")
    void testEmptyCatalogFails() {
        // Given
        pipeline.builder().build(catalog);
        long liveVersion = pipeline.store().snapshot().version();
        Catalog unusable = Catalog.builder()
            .source("unusable")
            .records(List.of(CatalogRecord.builder().description("no id").build()))
            .build();

        // When
        BuildResult result = pipeline.builder().build(unusable);

        // Then
        assertFalse(result.isSuccess());
        assertThat(result.getErrors()).isNotEmpty();
        assertEquals(liveVersion, pipeline.store().snapshot().version());
        assertEquals(11, pipeline.store().snapshot().entityCount());
        assertEquals(BuildState.FAILED, pipeline.builder().getStatus().getState());
        assertFalse(pipeline.store().isBuildInProgress());
    }

    @Test
    @DisplayName("Should reject a build while another one holds the store")
    void testConcurrentBuildRejected() throws Exception {
        GraphTransaction held = pipeline.store().beginBuild();
        try {
            Thread other = new Thread(() -> assertThrows(BuildInProgressException.class,
                () -> pipeline.builder().build(catalog)));
            List<Throwable> failures = new ArrayList<>();
            other.setUncaughtExceptionHandler((t, e) -> failures.add(e));
            other.start();
            other.join();
            assertThat(failures).isEmpty();
        } finally {
            held.abort();
        }
        assertTrue(pipeline.builder().build(catalog).isSuccess());
    }
}
