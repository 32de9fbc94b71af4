package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.SearchMode;

import java.time.Duration;
import java.util.Set;

/**
 * Per-query options. Null weights fall back to the configured defaults.
 *
 * @since 1.0.0
 */
public interface SearchOptions {
    SearchMode getMode();
    int getMaxResults();
    Double getSemanticWeight();
    Double getKeywordWeight();
    Double getGraphWeight();

    /**
     * Restrict results to these categories; empty means no restriction.
     */
    Set<EntityCategory> getCategories();

    /**
     * Caller deadline for the embedding call; null uses the configured query timeout.
     */
    Duration getTimeout();
}
