package com.purchasingpower.graphrag.knowledge;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A named workflow pattern: an ordered chain of catalog ids, upstream first.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CatalogPattern {

    String id;
    String name;
    String description;

    @Builder.Default
    List<String> nodes = List.of();

    public List<String> getNodes() {
        return nodes == null ? List.of() : nodes;
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
