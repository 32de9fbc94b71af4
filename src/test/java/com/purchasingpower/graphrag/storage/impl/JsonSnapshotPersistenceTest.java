package com.purchasingpower.graphrag.storage.impl;

import com.purchasingpower.graphrag.GraphFixtures;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.SearchMode;
import com.purchasingpower.graphrag.exception.StorageCorruptionException;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.QueryTrace;
import com.purchasingpower.graphrag.storage.StoreMetadataKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.purchasingpower.graphrag.storage.impl.SnapshotGraphStoreTest.edge;
import static com.purchasingpower.graphrag.storage.impl.SnapshotGraphStoreTest.entity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JSON Snapshot Persistence Tests")
class JsonSnapshotPersistenceTest {

    @TempDir
    Path directory;

    @Test
    @DisplayName("Should reload the committed graph after a restart")
    void testReloadAfterRestart() {
        // Given: A graph committed to disk
        SnapshotGraphStore first = GraphFixtures.store(new JsonSnapshotPersistence(directory));
        first.putEntity(entity("slack", 0));
        first.putEntity(entity("discord", 1));
        first.putEdge(edge("slack", "discord", RelationshipType.BELONGS_TO_CATEGORY, 0.4));
        first.setMetadata(StoreMetadataKeys.CATALOG_SOURCE, "unit-test");
        GraphSnapshot saved = first.snapshot();

        // When: A new store opens the same directory
        SnapshotGraphStore second = GraphFixtures.store(new JsonSnapshotPersistence(directory));

        // Then: Same content and version, embeddings included
        GraphSnapshot loaded = second.snapshot();
        assertTrue(second.isAvailable());
        assertEquals(saved.version(), loaded.version());
        assertThat(loaded.entities()).containsExactlyElementsOf(saved.entities());
        assertThat(loaded.edges()).containsExactlyElementsOf(saved.edges());
        assertThat(loaded.metadata(StoreMetadataKeys.CATALOG_SOURCE)).hasValue("unit-test");
        assertThat(loaded.vector("discord")).isEqualTo(saved.vector("discord"));

        // And: Versions keep increasing after the reload
        second.putEntity(entity("http-request", 2));
        assertEquals(saved.version() + 1, second.snapshot().version());
    }

    @Test
    @DisplayName("Should refuse a snapshot file whose content was edited by hand")
    void testTamperedFileDetected() throws Exception {
        // Given: A persisted graph
        JsonSnapshotPersistence persistence = new JsonSnapshotPersistence(directory);
        SnapshotGraphStore first = GraphFixtures.store(persistence);
        first.putEntity(entity("slack", 0));

        // When: The description is edited without updating the manifest hash
        Path file = persistence.snapshotFile();
        String json = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, json.replace("Slack node", "Edited node"), StandardCharsets.UTF_8);

        // Then: The reopened store is unavailable rather than silently empty
        SnapshotGraphStore reopened = GraphFixtures.store(new JsonSnapshotPersistence(directory));
        assertFalse(reopened.isAvailable());
        assertThatThrownBy(reopened::snapshot)
            .isInstanceOf(StorageCorruptionException.class)
            .hasMessageContaining("hash");
    }

    @Test
    @DisplayName("Should refuse a snapshot built with a different embedding dimension")
    void testDimensionMismatchOnOpen() {
        // Given: A graph persisted at the fixture dimension
        GraphFixtures.store(new JsonSnapshotPersistence(directory)).putEntity(entity("slack", 0));

        // When: A store with another dimension opens it
        SnapshotGraphStore other = new SnapshotGraphStore(GraphFixtures.DIMENSION * 2, "1.0.0", 10,
            new JsonSnapshotPersistence(directory));
        other.open();

        // Then
        assertFalse(other.isAvailable());
    }

    @Test
    @DisplayName("Should append query traces as JSON lines")
    void testQueryLogAppends() throws Exception {
        // Given
        SnapshotGraphStore store = GraphFixtures.store(new JsonSnapshotPersistence(directory));

        // When
        store.recordQuery(new QueryTrace(Instant.parse("2024-01-01T00:00:00Z"), "send a chat message",
            SearchMode.HYBRID, SearchMode.KEYWORD, true, 2, 5));
        store.recordQuery(new QueryTrace(Instant.parse("2024-01-01T00:00:01Z"), "http",
            SearchMode.KEYWORD, SearchMode.KEYWORD, false, 1, 1));

        // Then
        List<String> lines = Files.readAllLines(directory.resolve(JsonSnapshotPersistence.QUERY_LOG_FILE));
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("send a chat message").contains("\"degraded\":true");
        assertThat(lines.get(1)).contains("\"query\":\"http\"");
    }

    @Test
    @DisplayName("Should hand query log writes to the executor instead of the searching thread")
    void testQueryLogWrittenByExecutor() throws Exception {
        // Given: An executor that holds tasks until the test runs them
        List<Runnable> pending = new ArrayList<>();
        Executor deferred = pending::add;
        SnapshotGraphStore store = GraphFixtures.store(
            new JsonSnapshotPersistence(directory, deferred, JsonSnapshotPersistence.DEFAULT_QUERY_LOG_MAX_BYTES));

        // When
        store.recordQuery(trace(0));

        // Then: Nothing on disk until the writer runs
        assertThat(pending).hasSize(1);
        assertFalse(Files.exists(directory.resolve(JsonSnapshotPersistence.QUERY_LOG_FILE)));
        pending.forEach(Runnable::run);
        assertThat(Files.readAllLines(directory.resolve(JsonSnapshotPersistence.QUERY_LOG_FILE))).hasSize(1);
    }

    @Test
    @DisplayName("Should drop the file copy of a trace when the writer backlog is full")
    void testQueryLogBacklogFull() {
        // Given
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        SnapshotGraphStore store = GraphFixtures.store(new JsonSnapshotPersistence(directory, full, 0));

        // When
        store.recordQuery(trace(0));

        // Then: The in-memory trace survives, the file is untouched
        assertThat(store.recentQueries(5)).hasSize(1);
        assertFalse(Files.exists(directory.resolve(JsonSnapshotPersistence.QUERY_LOG_FILE)));
    }

    @Test
    @DisplayName("Should roll the query log once it would pass the size cap")
    void testQueryLogRolls() throws Exception {
        // Given: A cap that holds only a couple of lines
        long cap = 400;
        SnapshotGraphStore store = GraphFixtures.store(new JsonSnapshotPersistence(directory, Runnable::run, cap));

        // When
        for (int i = 0; i < 10; i++) {
            store.recordQuery(trace(i));
        }

        // Then: Both files stay under the cap and the newest trace is in the live file
        Path live = directory.resolve(JsonSnapshotPersistence.QUERY_LOG_FILE);
        Path rolled = directory.resolve(JsonSnapshotPersistence.ROLLED_QUERY_LOG_FILE);
        assertTrue(Files.exists(rolled));
        assertThat(Files.size(live)).isLessThanOrEqualTo(cap);
        assertThat(Files.size(rolled)).isLessThanOrEqualTo(cap);
        List<String> lines = Files.readAllLines(live, StandardCharsets.UTF_8);
        assertThat(lines.get(lines.size() - 1)).contains("query number 9");
        assertThat(lines.size() + Files.readAllLines(rolled).size()).isLessThan(10);
    }

    private static QueryTrace trace(int n) {
        return new QueryTrace(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(n), "query number " + n,
            SearchMode.HYBRID, SearchMode.HYBRID, false, 3, 4);
    }
}
