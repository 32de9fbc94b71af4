package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.Relationship;
import lombok.Value;

import java.util.List;

/**
 * A closed chain of directed dependency edges. {@code edges.get(i)} leads from
 * {@code entityIds.get(i)} to the next id, and the last edge returns to the
 * first. The chain starts at its smallest id.
 */
@Value
public class DependencyCycle {
    List<String> entityIds;
    List<Relationship> edges;

    public int length() {
        return entityIds.size();
    }

    public boolean contains(String entityId) {
        return entityIds.contains(entityId);
    }
}
