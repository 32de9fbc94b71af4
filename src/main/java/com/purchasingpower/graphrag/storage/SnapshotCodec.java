package com.purchasingpower.graphrag.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.exception.GraphRagException;
import com.purchasingpower.graphrag.exception.StorageCorruptionException;
import com.purchasingpower.graphrag.util.JsonMappers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes snapshot documents.
 *
 * <p>A document is a single JSON file: a manifest and the content it describes.
 * The manifest hash is computed over the canonical serialization of the typed
 * content, so verifying a file means parsing it, re-serializing the content and
 * comparing digests.
 *
 * @since 1.0.0
 */
@Slf4j
public final class SnapshotCodec {

    public static final String FORMAT_VERSION = "1";

    private final ObjectMapper mapper = JsonMappers.canonical();

    // ================================================================
    // ENCODE
    // ================================================================

    public SnapshotDocument encode(GraphSnapshot snapshot, String schemaVersion) {
        List<Entity> entities = new ArrayList<>(snapshot.entityCount());
        Map<String, EmbeddingVector> embeddings = new TreeMap<>();
        Map<String, Integer> categoryCounts = new TreeMap<>();
        for (Entity entity : snapshot.entities()) {
            if (entity.getEmbedding() != null) {
                embeddings.put(entity.getId(), entity.getEmbedding());
            }
            entities.add(entity.withEmbedding(null));
            categoryCounts.merge(entity.getCategory().id(), 1, Integer::sum);
        }
        SnapshotContent content = new SnapshotContent(
            entities,
            snapshot.edges(),
            embeddings,
            new TreeMap<>(snapshot.metadata()));

        SnapshotManifest manifest = new SnapshotManifest(
            FORMAT_VERSION,
            schemaVersion,
            snapshot.metadata(StoreMetadataKeys.BUILD_TIMESTAMP).orElse(Instant.now().toString()),
            snapshot.version(),
            entities.size(),
            content.edges().size(),
            embeddings.size(),
            categoryCounts,
            snapshot.embeddingModel(),
            snapshot.dimension(),
            contentHash(content));
        return new SnapshotDocument(manifest, content);
    }

    public String contentHash(SnapshotContent content) {
        try {
            return Hashing.sha256().hashBytes(mapper.writeValueAsBytes(content)).toString();
        } catch (JsonProcessingException e) {
            throw new GraphRagException("Failed to serialize snapshot content", e);
        }
    }

    /**
     * Replays the content into a staging area.
     */
    public void applyTo(SnapshotContent content, GraphWriter writer) {
        for (Entity entity : content.entities()) {
            EmbeddingVector vector = content.embeddings() == null ? null : content.embeddings().get(entity.getId());
            writer.putEntity(entity.withEmbedding(vector));
        }
        for (Relationship edge : content.edges()) {
            writer.putEdge(edge);
        }
        if (content.metadata() != null) {
            content.metadata().forEach(writer::setMetadata);
        }
    }

    // ================================================================
    // FILE I/O
    // ================================================================

    /**
     * Writes through a temp file in the target directory and moves it into place.
     */
    public void write(SnapshotDocument document, Path target) {
        try {
            Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try {
                mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot to " + target, e);
        }
        log.debug("💾 Wrote snapshot v{} to {}", document.manifest().snapshotVersion(), target);
    }

    /**
     * Parses and verifies a snapshot file.
     *
     * @throws StorageCorruptionException when the file cannot be parsed, is incomplete or fails its hash check
     */
    public SnapshotDocument read(Path source) {
        SnapshotDocument document;
        try {
            document = mapper.readValue(source.toFile(), SnapshotDocument.class);
        } catch (IOException | GraphRagException e) {
            throw new StorageCorruptionException(source, "Unreadable snapshot", e);
        }
        verify(document, source);
        return document;
    }

    public void verify(SnapshotDocument document, Path source) {
        if (document == null || document.manifest() == null || document.content() == null
                || document.content().entities() == null || document.content().edges() == null) {
            throw new StorageCorruptionException(source, "Snapshot is missing its manifest or content");
        }
        SnapshotManifest manifest = document.manifest();
        if (!FORMAT_VERSION.equals(manifest.formatVersion())) {
            throw new StorageCorruptionException(source, "Unsupported snapshot format " + manifest.formatVersion());
        }
        String actual = contentHash(document.content());
        if (!actual.equals(manifest.contentHash())) {
            throw new StorageCorruptionException(source,
                "Content hash mismatch: manifest " + manifest.contentHash() + ", actual " + actual);
        }
        if (manifest.entityCount() != document.content().entities().size()
                || manifest.edgeCount() != document.content().edges().size()) {
            throw new StorageCorruptionException(source, "Manifest counts do not match content");
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("⚠️ Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
