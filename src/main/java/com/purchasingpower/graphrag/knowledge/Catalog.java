package com.purchasingpower.graphrag.knowledge;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed catalog ready for a build.
 */
@Value
@Builder
public class Catalog {

    String source;

    @Builder.Default
    List<CatalogRecord> records = List.of();

    @Builder.Default
    List<CatalogPattern> patterns = List.of();

    /**
     * Records that could not be parsed, with the reason.
     */
    @Builder.Default
    List<String> rejected = List.of();
}
