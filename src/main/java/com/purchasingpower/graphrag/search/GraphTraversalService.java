package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.TraversalDirection;
import com.purchasingpower.graphrag.storage.GraphSnapshot;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Bounded traversals over one snapshot.
 *
 * @since 1.0.0
 */
public interface GraphTraversalService {

    /**
     * Breadth-first neighbourhood of {@code rootId} up to {@code depth} hops.
     * The root is never part of the result.
     *
     * @param limit Maximum neighbours returned; the result is flagged truncated when hit
     */
    NeighborResult neighbors(GraphSnapshot snapshot, String rootId, int depth,
                             TraversalDirection direction, Set<RelationshipType> types, int limit);

    /**
     * Simple paths from source to target, produced one at a time in
     * non-decreasing hop count.
     *
     * @param direction How edges may be walked; null means {@link TraversalDirection#BOTH}
     */
    Iterator<GraphPath> paths(GraphSnapshot snapshot, String sourceId, String targetId,
                              TraversalDirection direction, int maxHops, int maxPaths);

    /**
     * Cycles over directed edges of {@code types}.
     *
     * @param fromId Only cycles reachable from this entity; null checks the whole graph
     */
    List<DependencyCycle> cycles(GraphSnapshot snapshot, Set<RelationshipType> types, String fromId);
}
