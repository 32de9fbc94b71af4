package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import lombok.Value;

/**
 * An entity reached by traversal, at its minimum hop distance from the root.
 */
@Value
public class NeighborNode {
    Entity entity;
    int hops;
    String parentId;
    Relationship via;
}
