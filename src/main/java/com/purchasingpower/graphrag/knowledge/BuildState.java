package com.purchasingpower.graphrag.knowledge;

/**
 * Lifecycle of a graph build.
 *
 * @since 1.0.0
 */
public enum BuildState {
    IDLE,
    EXTRACTING,
    EMBEDDING,
    INFERRING,
    COMMITTING,
    COMPLETED,
    FAILED
}
