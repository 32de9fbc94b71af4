package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.Relationship;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable justification assembled only from fields already stored on
 * entities and edges.
 */
@Value
@Builder(toBuilder = true)
public class Explanation {

    String subjectId;
    String query;
    String summary;

    @Builder.Default
    List<String> reasons = List.of();

    @Builder.Default
    List<String> caveats = List.of();

    @Builder.Default
    List<String> tips = List.of();

    @Builder.Default
    List<Relationship> evidence = List.of();

    public String text() {
        List<String> lines = new ArrayList<>();
        lines.add(summary);
        reasons.forEach(r -> lines.add("- " + r));
        caveats.forEach(c -> lines.add("- " + c));
        tips.forEach(t -> lines.add("- " + t));
        return String.join("\n", lines);
    }
}
