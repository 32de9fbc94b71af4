package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.SearchMode;
import com.purchasingpower.graphrag.search.SearchOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Set;

/**
 * Default implementation of SearchOptions.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefaultSearchOptions implements SearchOptions {

    @Builder.Default
    private SearchMode mode = SearchMode.HYBRID;

    @Builder.Default
    private int maxResults = 10;

    private Double semanticWeight;
    private Double keywordWeight;
    private Double graphWeight;

    @Builder.Default
    private Set<EntityCategory> categories = Set.of();

    private Duration timeout;

    public static DefaultSearchOptions hybrid(int maxResults) {
        return DefaultSearchOptions.builder().maxResults(maxResults).build();
    }
}
