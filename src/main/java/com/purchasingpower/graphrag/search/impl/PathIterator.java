package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.TraversalDirection;
import com.purchasingpower.graphrag.search.GraphPath;
import com.purchasingpower.graphrag.storage.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Breadth-first producer of simple paths. Work happens only when the consumer
 * asks for the next path, so a consumer that stops early stops the search.
 *
 * <p>{@link TraversalDirection#BOTH} walks every edge either way; the directed
 * modes follow stored direction, with symmetric edges usable both ways. A path
 * ends at the first visit of the target.
 */
final class PathIterator implements Iterator<GraphPath> {

    private final GraphSnapshot snapshot;
    private final String targetId;
    private final TraversalDirection direction;
    private final int maxHops;
    private final int maxPaths;

    private final Deque<GraphPath> queue = new ArrayDeque<>();
    private final Deque<GraphPath> ready = new ArrayDeque<>();
    private int emitted;

    PathIterator(GraphSnapshot snapshot, String sourceId, String targetId,
                 TraversalDirection direction, int maxHops, int maxPaths) {
        this.snapshot = snapshot;
        this.targetId = targetId;
        this.direction = direction;
        this.maxHops = maxHops;
        this.maxPaths = maxPaths;
        if (sourceId.equals(targetId)) {
            ready.add(GraphPath.start(sourceId));
        } else {
            queue.add(GraphPath.start(sourceId));
        }
    }

    @Override
    public boolean hasNext() {
        if (emitted >= maxPaths) {
            return false;
        }
        advance();
        return !ready.isEmpty();
    }

    @Override
    public GraphPath next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        emitted++;
        return ready.poll();
    }

    /**
     * Expands queued partial paths until at least one complete path is ready
     * or the hop bound exhausts the queue.
     */
    private void advance() {
        while (ready.isEmpty() && !queue.isEmpty()) {
            GraphPath partial = queue.poll();
            if (partial.hops() >= maxHops) {
                continue;
            }
            String last = partial.last();
            for (Relationship edge : snapshot.adjacent(last, direction)) {
                String next = edge.other(last);
                if (partial.visits(next)) {
                    continue;
                }
                GraphPath extended = partial.extend(edge, next);
                if (next.equals(targetId)) {
                    ready.add(extended);
                } else {
                    queue.add(extended);
                }
            }
        }
    }
}
