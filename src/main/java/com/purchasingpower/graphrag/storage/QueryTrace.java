package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.SearchMode;

import java.time.Instant;

/**
 * Append-only record of one executed query. Observability only.
 */
public record QueryTrace(
    Instant timestamp,
    String query,
    SearchMode requestedMode,
    SearchMode executedMode,
    boolean degraded,
    int resultCount,
    long latencyMs
) {
}
