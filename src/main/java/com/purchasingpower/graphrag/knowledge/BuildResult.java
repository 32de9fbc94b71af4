package com.purchasingpower.graphrag.knowledge;

import java.util.List;

/**
 * Outcome of one graph build.
 *
 * @since 1.0.0
 */
public interface BuildResult {
    boolean isSuccess();
    int getEntitiesCreated();
    int getRelationshipsCreated();
    int getEmbeddingsGenerated();
    int getEmbeddingFailures();
    long getSnapshotVersion();
    long getDurationMs();

    /**
     * Catalog records skipped during loading or extraction, with the reason.
     */
    List<String> getSkippedRecords();

    List<String> getErrors();
}
