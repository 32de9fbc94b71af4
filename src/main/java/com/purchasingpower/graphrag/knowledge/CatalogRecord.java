package com.purchasingpower.graphrag.knowledge;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One raw catalog entry as supplied by the catalog file.
 *
 * <p>Metrics are boxed: a missing value means unknown and is never turned into zero.
 */
@Value
@Builder
@Jacksonized
public class CatalogRecord {

    @JsonAlias({"type", "nodeType"})
    String id;

    @JsonAlias({"name", "displayName"})
    String label;

    String description;

    String category;

    @Builder.Default
    List<String> patterns = List.of();

    @Builder.Default
    List<String> requires = List.of();

    @Builder.Default
    List<String> useCases = List.of();

    @Builder.Default
    List<String> properties = List.of();

    @Builder.Default
    List<String> operations = List.of();

    Double successRate;
    Long usageCount;
    Double rating;

    public List<String> getPatterns() {
        return orEmpty(patterns);
    }

    public List<String> getRequires() {
        return orEmpty(requires);
    }

    public List<String> getUseCases() {
        return orEmpty(useCases);
    }

    public List<String> getProperties() {
        return orEmpty(properties);
    }

    public List<String> getOperations() {
        return orEmpty(operations);
    }

    // explicit JSON nulls bypass the builder defaults
    private static List<String> orEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
