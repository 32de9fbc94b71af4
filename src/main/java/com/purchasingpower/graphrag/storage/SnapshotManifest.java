package com.purchasingpower.graphrag.storage;

import java.util.Map;

/**
 * Header of a snapshot file. {@code contentHash} is the SHA-256 of the canonical
 * serialization of the content block.
 */
public record SnapshotManifest(
    String formatVersion,
    String schemaVersion,
    String buildTimestamp,
    long snapshotVersion,
    int entityCount,
    int edgeCount,
    int embeddingCount,
    Map<String, Integer> categoryCounts,
    String embeddingModel,
    int embeddingDimension,
    String contentHash
) {
}
