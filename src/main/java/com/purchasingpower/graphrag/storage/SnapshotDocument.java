package com.purchasingpower.graphrag.storage;

public record SnapshotDocument(SnapshotManifest manifest, SnapshotContent content) {
}
