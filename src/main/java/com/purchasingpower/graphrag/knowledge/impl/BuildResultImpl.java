package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.knowledge.BuildResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of BuildResult.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildResultImpl implements BuildResult {

    private boolean success;
    private int entitiesCreated;
    private int relationshipsCreated;
    private int embeddingsGenerated;
    private int embeddingFailures;
    private long snapshotVersion;
    private long durationMs;

    @Builder.Default
    private List<String> skippedRecords = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static BuildResultImpl failure(List<String> errors, List<String> skipped, long durationMs) {
        return BuildResultImpl.builder()
            .success(false)
            .errors(errors)
            .skippedRecords(skipped)
            .durationMs(durationMs)
            .build();
    }

    public static BuildResultImpl failure(String error, List<String> skipped, long durationMs) {
        return failure(List.of(error), skipped, durationMs);
    }
}
