package com.purchasingpower.graphrag.export.impl;

import com.purchasingpower.graphrag.GraphFixtures;
import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.core.SearchMode;
import com.purchasingpower.graphrag.exception.StorageCorruptionException;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.knowledge.impl.HashingEmbeddingProvider;
import com.purchasingpower.graphrag.search.ScoredEntity;
import com.purchasingpower.graphrag.search.SearchResponse;
import com.purchasingpower.graphrag.search.impl.DefaultSearchOptions;
import com.purchasingpower.graphrag.search.impl.QueryEngineImpl;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.SnapshotManifest;
import com.purchasingpower.graphrag.storage.impl.InMemorySnapshotPersistence;
import com.purchasingpower.graphrag.storage.impl.SnapshotGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * ════════════════════════════════════════════════════════════════════════════
 * SNAPSHOT EXPORT / IMPORT TEST
 * ════════════════════════════════════════════════════════════════════════════
 *
 * An exported graph imported into an empty store must answer every query
 * exactly like the store it came from.
 *
 * ════════════════════════════════════════════════════════════════════════════
 */
@DisplayName("Snapshot Exporter Tests")
class SnapshotExporterTest {

    private static final List<String> QUERY_TERMS = List.of(
        "send a chat message", "slack", "discord server", "email", "http api", "rest endpoint",
        "webhook", "schedule cron", "start a workflow", "set fields", "filter items", "postgres sql",
        "database query", "openai", "condition branch", "send message to channel", "digest");

    @TempDir
    Path tempDir;

    private GraphFixtures.Pipeline source;
    private GraphRagProperties properties;

    @BeforeEach
    void setUp() {
        properties = GraphFixtures.properties();
        source = GraphFixtures.pipeline(GraphFixtures.store(), new HashingEmbeddingProvider(GraphFixtures.DIMENSION), properties);
        assertTrue(source.builder().build(GraphFixtures.load(GraphFixtures.SAMPLE_CATALOG)).isSuccess());
    }

    @Test
    @DisplayName("Should answer every query identically after export and import")
    void testRoundTripPreservesQueries() {
        // Given
        Path file = tempDir.resolve("graph.json");
        SnapshotManifest exported = exporter(source).exportTo(file);
        GraphFixtures.Pipeline target = GraphFixtures.pipeline();

        // When
        SnapshotManifest imported = exporter(target).importFrom(file);

        // Then
        assertEquals(exported, imported);
        GraphSnapshot before = source.store().snapshot();
        GraphSnapshot after = target.store().snapshot();
        assertEquals(before.entityCount(), after.entityCount());
        assertEquals(before.edges(), after.edges());
        assertEquals(before.metadata(), after.metadata());

        int compared = 0;
        for (String query : QUERY_TERMS) {
            for (SearchMode mode : SearchMode.values()) {
                DefaultSearchOptions options = DefaultSearchOptions.builder().mode(mode).maxResults(5).build();
                assertSameResults(query, source.engine().search(query, options), target.engine().search(query, options));
                compared++;
            }
        }
        assertThat(compared).isGreaterThanOrEqualTo(50);
    }

    @Test
    @DisplayName("Should describe the exported graph in the manifest")
    void testManifest() {
        Path file = tempDir.resolve("graph.json");

        SnapshotManifest manifest = exporter(source).exportTo(file);

        assertEquals(11, manifest.entityCount());
        assertEquals(11, manifest.embeddingCount());
        assertEquals(source.store().snapshot().edges().size(), manifest.edgeCount());
        assertEquals(GraphFixtures.DIMENSION, manifest.embeddingDimension());
        assertEquals("hashing-v1-64", manifest.embeddingModel());
        assertEquals(source.store().snapshot().version(), manifest.snapshotVersion());
        assertThat(manifest.categoryCounts()).containsKeys("messaging", "trigger");
        assertEquals(11, manifest.categoryCounts().values().stream().mapToInt(Integer::intValue).sum());
        assertThat(manifest.contentHash()).isNotBlank();
        assertEquals(manifest, exporter(source).verify(file));
    }

    @Test
    @DisplayName("Should refuse a tampered file and keep the live graph")
    void testTamperedFileRejected() throws Exception {
        // Given
        Path file = tempDir.resolve("graph.json");
        exporter(source).exportTo(file);
        String json = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, json.replace("Send a chat message to Slack", "Send a fax to Slack"), StandardCharsets.UTF_8);
        GraphFixtures.Pipeline target = GraphFixtures.pipeline();

        // When / Then
        StorageCorruptionException error = assertThrows(StorageCorruptionException.class,
            () -> exporter(target).verify(file));
        assertThat(error.getMessage()).contains("hash");
        assertThrows(StorageCorruptionException.class, () -> exporter(target).importFrom(file));
        assertEquals(0, target.store().snapshot().entityCount());
    }

    @Test
    @DisplayName("Should refuse a snapshot whose dimension differs from the store")
    void testDimensionMismatch() {
        Path file = tempDir.resolve("graph.json");
        exporter(source).exportTo(file);
        SnapshotGraphStore narrow = new SnapshotGraphStore(32, "1.0.0", 10, new InMemorySnapshotPersistence());
        narrow.open();
        SnapshotExporterImpl exporter = new SnapshotExporterImpl(narrow, new HashingEmbeddingProvider(32), properties);

        assertThrows(ValidationException.class, () -> exporter.importFrom(file));
        assertEquals(0, narrow.snapshot().entityCount());
    }

    @Test
    @DisplayName("Should import despite a different embedding model")
    void testModelMismatchOnlyWarns() {
        Path file = tempDir.resolve("graph.json");
        exporter(source).exportTo(file);
        SnapshotGraphStore store = GraphFixtures.store();
        SnapshotExporterImpl exporter = new SnapshotExporterImpl(
            store, GraphFixtures.failingProvider(Duration.ZERO), properties);

        exporter.importFrom(file);

        assertEquals(11, store.snapshot().entityCount());
        assertEquals(1, store.snapshot().version());
    }

    private SnapshotExporterImpl exporter(GraphFixtures.Pipeline pipeline) {
        return new SnapshotExporterImpl(pipeline.store(), pipeline.client().provider(), properties);
    }

    private static void assertSameResults(String query, SearchResponse expected, SearchResponse actual) {
        assertEquals(expected.ids(), actual.ids(), () -> "ids differ for '" + query + "'");
        assertEquals(expected.getExecutedMode(), actual.getExecutedMode());
        List<Double> expectedScores = new ArrayList<>();
        List<Double> actualScores = new ArrayList<>();
        expected.getResults().stream().map(ScoredEntity::getScore).forEach(expectedScores::add);
        actual.getResults().stream().map(ScoredEntity::getScore).forEach(actualScores::add);
        assertEquals(expectedScores, actualScores, () -> "scores differ for '" + query + "'");
    }
}
