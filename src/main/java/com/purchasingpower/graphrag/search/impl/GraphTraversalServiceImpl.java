package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.core.TraversalDirection;
import com.purchasingpower.graphrag.exception.NotFoundException;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.search.DependencyCycle;
import com.purchasingpower.graphrag.search.GraphPath;
import com.purchasingpower.graphrag.search.GraphTraversalService;
import com.purchasingpower.graphrag.search.NeighborNode;
import com.purchasingpower.graphrag.search.NeighborResult;
import com.purchasingpower.graphrag.storage.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class GraphTraversalServiceImpl implements GraphTraversalService {

    @Override
    public NeighborResult neighbors(GraphSnapshot snapshot, String rootId, int depth,
                                    TraversalDirection direction, Set<RelationshipType> types, int limit) {
        if (depth <= 0) {
            throw new ValidationException("depth must be positive, got " + depth);
        }
        if (!snapshot.containsEntity(rootId)) {
            throw new NotFoundException(rootId);
        }
        TraversalDirection dir = direction != null ? direction : TraversalDirection.BOTH;

        List<NeighborNode> found = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(rootId);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(rootId);
        boolean truncated = false;

        // Level by level, so the first visit of a node is at its minimum hop count
        for (int hop = 1; hop <= depth && !frontier.isEmpty() && !truncated; hop++) {
            Deque<String> next = new ArrayDeque<>();
            while (!frontier.isEmpty() && !truncated) {
                String current = frontier.poll();
                for (Relationship edge : snapshot.adjacent(current, dir)) {
                    if (!follows(edge, types)) {
                        continue;
                    }
                    String other = edge.other(current);
                    if (!visited.add(other)) {
                        continue;
                    }
                    if (found.size() >= limit) {
                        truncated = true;
                        break;
                    }
                    found.add(new NeighborNode(snapshot.entity(other), hop, current, edge));
                    next.add(other);
                }
            }
            frontier = next;
        }

        if (truncated) {
            log.warn("⚠️ Neighbourhood of {} truncated at {} entities", rootId, limit);
        }
        log.debug("Found {} neighbours of {} within {} hop(s)", found.size(), rootId, depth);
        return new NeighborResult(rootId, depth, List.copyOf(found), truncated);
    }

    @Override
    public Iterator<GraphPath> paths(GraphSnapshot snapshot, String sourceId, String targetId,
                                     TraversalDirection direction, int maxHops, int maxPaths) {
        if (maxHops <= 0) {
            throw new ValidationException("maxHops must be positive, got " + maxHops);
        }
        if (maxPaths <= 0) {
            throw new ValidationException("maxPaths must be positive, got " + maxPaths);
        }
        if (!snapshot.containsEntity(sourceId)) {
            throw new NotFoundException(sourceId);
        }
        if (!snapshot.containsEntity(targetId)) {
            throw new NotFoundException(targetId);
        }
        return new PathIterator(snapshot, sourceId, targetId,
            direction != null ? direction : TraversalDirection.BOTH, maxHops, maxPaths);
    }

    @Override
    public List<DependencyCycle> cycles(GraphSnapshot snapshot, Set<RelationshipType> types, String fromId) {
        if (fromId != null && !snapshot.containsEntity(fromId)) {
            throw new NotFoundException(fromId);
        }
        List<DependencyCycle> cycles = new CycleFinder(snapshot, types).find(fromId);
        log.debug("Found {} dependency cycle(s) over {}", cycles.size(), types);
        return cycles;
    }

    private static boolean follows(Relationship edge, Set<RelationshipType> types) {
        return types == null || types.isEmpty() || types.contains(edge.getType());
    }
}
