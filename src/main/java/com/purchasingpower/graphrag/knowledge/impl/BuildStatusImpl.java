package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.knowledge.BuildState;
import com.purchasingpower.graphrag.knowledge.BuildStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Default implementation of BuildStatus.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildStatusImpl implements BuildStatus {

    @Builder.Default
    private BuildState state = BuildState.IDLE;

    private int progress;
    private String currentStep;
    private long startedAt;

    public static BuildStatusImpl idle() {
        return BuildStatusImpl.builder()
            .state(BuildState.IDLE)
            .currentStep("Idle")
            .build();
    }

    public static BuildStatusImpl inProgress(BuildState state, int progress, String step, long startedAt) {
        return BuildStatusImpl.builder()
            .state(state)
            .progress(progress)
            .currentStep(step)
            .startedAt(startedAt)
            .build();
    }

    public static BuildStatusImpl completed(long startedAt) {
        return BuildStatusImpl.builder()
            .state(BuildState.COMPLETED)
            .progress(100)
            .currentStep("Completed")
            .startedAt(startedAt)
            .build();
    }

    public static BuildStatusImpl failed(String reason, long startedAt) {
        return BuildStatusImpl.builder()
            .state(BuildState.FAILED)
            .progress(0)
            .currentStep("Failed: " + reason)
            .startedAt(startedAt)
            .build();
    }
}
