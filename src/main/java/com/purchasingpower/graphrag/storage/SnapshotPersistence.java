package com.purchasingpower.graphrag.storage;

import java.util.Optional;

/**
 * Durable home of the committed snapshot and the query log.
 *
 * @since 1.0.0
 */
public interface SnapshotPersistence {

    /**
     * Loads and verifies the last committed snapshot.
     *
     * @return empty when nothing was ever committed
     * @throws com.purchasingpower.graphrag.exception.StorageCorruptionException when verification fails
     */
    Optional<SnapshotDocument> load();

    /**
     * Replaces the committed snapshot. Either the old or the new document is
     * readable afterwards, never a mix.
     */
    void save(SnapshotDocument document);

    void appendQuery(QueryTrace trace);
}
