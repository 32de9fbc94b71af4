package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.SearchMode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked results plus the strategy that actually ran. {@code degraded} is set
 * when the requested strategy could not run and a fallback answered instead.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SearchResponse {

    String query;
    SearchMode requestedMode;
    SearchMode executedMode;
    boolean degraded;
    String degradationReason;

    @Builder.Default
    List<ScoredEntity> results = List.of();

    long latencyMs;
    long snapshotVersion;

    public List<String> ids() {
        return results.stream().map(ScoredEntity::getId).toList();
    }
}
