package com.purchasingpower.graphrag.search;

import lombok.Value;

import java.util.List;

@Value
public class NeighborResult {
    String rootId;
    int depth;
    List<NeighborNode> neighbors;

    /**
     * True when the result limit stopped the traversal early.
     */
    boolean truncated;

    public List<String> ids() {
        return neighbors.stream().map(n -> n.getEntity().getId()).toList();
    }
}
