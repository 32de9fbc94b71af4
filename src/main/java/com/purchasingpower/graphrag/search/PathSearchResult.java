package com.purchasingpower.graphrag.search;

import lombok.Value;

import java.util.List;

@Value
public class PathSearchResult {
    String sourceId;
    String targetId;
    List<GraphPath> paths;

    /**
     * True when more paths existed within the hop bound than {@code maxPaths} allowed.
     */
    boolean truncated;
}
