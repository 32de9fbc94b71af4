package com.purchasingpower.graphrag.knowledge;

/**
 * Progress of the current or most recent build.
 *
 * @since 1.0.0
 */
public interface BuildStatus {
    BuildState getState();
    int getProgress();
    String getCurrentStep();
    long getStartedAt();
}
