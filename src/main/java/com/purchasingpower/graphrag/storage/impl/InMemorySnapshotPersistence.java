package com.purchasingpower.graphrag.storage.impl;

import com.purchasingpower.graphrag.storage.QueryTrace;
import com.purchasingpower.graphrag.storage.SnapshotDocument;
import com.purchasingpower.graphrag.storage.SnapshotPersistence;

import java.util.Optional;

/**
 * Keeps the last committed document in memory. Used when no store directory is configured.
 */
public class InMemorySnapshotPersistence implements SnapshotPersistence {

    private volatile SnapshotDocument document;

    @Override
    public Optional<SnapshotDocument> load() {
        return Optional.ofNullable(document);
    }

    @Override
    public void save(SnapshotDocument document) {
        this.document = document;
    }

    @Override
    public void appendQuery(QueryTrace trace) {
        // traces live only in the store's in-memory ring
    }
}
