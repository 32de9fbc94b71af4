package com.purchasingpower.graphrag.export.impl;

import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.export.SnapshotExporter;
import com.purchasingpower.graphrag.knowledge.EmbeddingProvider;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import com.purchasingpower.graphrag.storage.GraphStore;
import com.purchasingpower.graphrag.storage.GraphTransaction;
import com.purchasingpower.graphrag.storage.SnapshotCodec;
import com.purchasingpower.graphrag.storage.SnapshotDocument;
import com.purchasingpower.graphrag.storage.SnapshotManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotExporterImpl implements SnapshotExporter {

    private final GraphStore graphStore;
    private final EmbeddingProvider embeddingProvider;
    private final GraphRagProperties properties;

    private final SnapshotCodec codec = new SnapshotCodec();

    @Override
    public SnapshotManifest exportTo(Path target) {
        GraphSnapshot snapshot = graphStore.snapshot();
        SnapshotDocument document = codec.encode(snapshot, properties.getStore().getSchemaVersion());
        codec.write(document, target);
        SnapshotManifest manifest = document.manifest();
        log.info("📤 Exported graph v{} to {}: {} entities, {} edges, {} embeddings",
            manifest.snapshotVersion(), target, manifest.entityCount(), manifest.edgeCount(), manifest.embeddingCount());
        return manifest;
    }

    @Override
    public SnapshotManifest importFrom(Path source) {
        SnapshotDocument document = codec.read(source);
        SnapshotManifest manifest = document.manifest();
        if (manifest.embeddingDimension() != graphStore.dimension()) {
            throw new ValidationException("Snapshot " + source + " has dimension " + manifest.embeddingDimension()
                + ", store expects " + graphStore.dimension());
        }
        if (manifest.embeddingModel() != null && !manifest.embeddingModel().equals(embeddingProvider.modelId())) {
            log.warn("⚠️ Snapshot {} was embedded with {}, queries will be embedded with {}",
                source, manifest.embeddingModel(), embeddingProvider.modelId());
        }

        GraphSnapshot published;
        try (GraphTransaction tx = graphStore.beginBuild()) {
            codec.applyTo(document.content(), tx);
            published = tx.commit();
        }
        log.info("📥 Imported {} (exported as v{}) as graph v{}: {} entities, {} edges",
            source, manifest.snapshotVersion(), published.version(), published.entityCount(), published.edges().size());
        return manifest;
    }

    @Override
    public SnapshotManifest verify(Path source) {
        SnapshotManifest manifest = codec.read(source).manifest();
        log.info("✅ Snapshot {} verified: v{}, hash {}", source, manifest.snapshotVersion(), manifest.contentHash());
        return manifest;
    }
}
