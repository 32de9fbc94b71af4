package com.purchasingpower.graphrag.search.impl;

import com.purchasingpower.graphrag.core.Relationship;
import com.purchasingpower.graphrag.core.RelationshipType;
import com.purchasingpower.graphrag.search.DependencyCycle;
import com.purchasingpower.graphrag.storage.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Depth-first walk over directed edges of the given types that reports one
 * cycle per back edge. Roots and edges are visited in id order, so the same
 * snapshot always yields the same cycles.
 *
 * <p>Every cyclic component reachable from the roots shows up at least once;
 * not every elementary cycle inside a component is listed.
 */
final class CycleFinder {

    private static final Comparator<Relationship> EDGE_ORDER = Comparator
        .comparing(Relationship::getTargetId)
        .thenComparing(edge -> edge.getType().wireName());

    private enum Mark { ON_STACK, DONE }

    private final GraphSnapshot snapshot;
    private final Set<RelationshipType> types;
    private final Map<String, Mark> marks = new HashMap<>();
    private final Map<String, DependencyCycle> cycles = new TreeMap<>();

    CycleFinder(GraphSnapshot snapshot, Set<RelationshipType> types) {
        this.snapshot = snapshot;
        this.types = types;
    }

    /**
     * Walks from every entity, or from {@code rootId} alone when it is set.
     */
    List<DependencyCycle> find(String rootId) {
        if (rootId != null) {
            walk(rootId);
        } else {
            snapshot.entities().forEach(entity -> {
                if (!marks.containsKey(entity.getId())) {
                    walk(entity.getId());
                }
            });
        }
        return List.copyOf(cycles.values());
    }

    private void walk(String rootId) {
        Deque<Iterator<Relationship>> stack = new ArrayDeque<>();
        List<String> pathIds = new ArrayList<>();
        List<Relationship> pathEdges = new ArrayList<>();
        enter(rootId, stack, pathIds);

        while (!stack.isEmpty()) {
            Iterator<Relationship> pending = stack.peek();
            if (!pending.hasNext()) {
                stack.pop();
                marks.put(pathIds.remove(pathIds.size() - 1), Mark.DONE);
                if (!pathEdges.isEmpty()) {
                    pathEdges.remove(pathEdges.size() - 1);
                }
                continue;
            }
            Relationship edge = pending.next();
            String next = edge.getTargetId();
            Mark mark = marks.get(next);
            if (mark == null) {
                pathEdges.add(edge);
                enter(next, stack, pathIds);
            } else if (mark == Mark.ON_STACK) {
                int start = pathIds.indexOf(next);
                List<Relationship> edges = new ArrayList<>(pathEdges.subList(start, pathEdges.size()));
                edges.add(edge);
                record(new ArrayList<>(pathIds.subList(start, pathIds.size())), edges);
            }
        }
    }

    private void enter(String id, Deque<Iterator<Relationship>> stack, List<String> pathIds) {
        marks.put(id, Mark.ON_STACK);
        pathIds.add(id);
        stack.push(snapshot.edgesFrom(id).stream()
            .filter(edge -> types.contains(edge.getType()))
            .sorted(EDGE_ORDER)
            .iterator());
    }

    /**
     * Rotates the cycle to start at its smallest id so each cycle is kept once.
     */
    private void record(List<String> ids, List<Relationship> edges) {
        int start = 0;
        for (int i = 1; i < ids.size(); i++) {
            if (ids.get(i).compareTo(ids.get(start)) < 0) {
                start = i;
            }
        }
        List<String> rotatedIds = new ArrayList<>(ids.size());
        List<Relationship> rotatedEdges = new ArrayList<>(edges.size());
        for (int i = 0; i < ids.size(); i++) {
            rotatedIds.add(ids.get((start + i) % ids.size()));
            rotatedEdges.add(edges.get((start + i) % edges.size()));
        }
        cycles.putIfAbsent(String.join(" > ", rotatedIds),
            new DependencyCycle(List.copyOf(rotatedIds), List.copyOf(rotatedEdges)));
    }
}
