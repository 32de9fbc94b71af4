package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Agent-facing hints on an edge. Opaque text, surfaced verbatim in explanations.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class RelationshipHints {

    String configMapping;

    @Builder.Default
    List<String> pitfalls = List.of();

    String guidance;
}
