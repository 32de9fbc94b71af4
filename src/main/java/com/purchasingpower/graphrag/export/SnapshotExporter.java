package com.purchasingpower.graphrag.export;

import com.purchasingpower.graphrag.storage.SnapshotManifest;

import java.nio.file.Path;

/**
 * Portable snapshot files for distribution and backup.
 *
 * <p>An exported file carries the full entity, edge and embedding set, so an
 * import answers every query exactly as the exporting store did.
 *
 * @since 1.0.0
 */
public interface SnapshotExporter {

    /**
     * Write the current snapshot to {@code target}.
     *
     * @return Manifest of the written file
     */
    SnapshotManifest exportTo(Path target);

    /**
     * Verify {@code source} and publish it as the live graph.
     *
     * @throws com.purchasingpower.graphrag.exception.StorageCorruptionException when the file fails verification
     * @throws com.purchasingpower.graphrag.exception.ValidationException when its dimension differs from the store's
     * @throws com.purchasingpower.graphrag.exception.BuildInProgressException while a build is running
     */
    SnapshotManifest importFrom(Path source);

    /**
     * Check a file's hash and counts without touching the store.
     */
    SnapshotManifest verify(Path source);
}
