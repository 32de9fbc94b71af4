package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.Relationship;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A simple path: {@code entityIds} has one more element than {@code edges}.
 * Confidence is the product of edge strengths, 1 for the zero-length path.
 */
@Value
public class GraphPath {

    List<String> entityIds;
    List<Relationship> edges;

    public static GraphPath start(String entityId) {
        return new GraphPath(List.of(entityId), List.of());
    }

    public GraphPath extend(Relationship edge, String next) {
        List<String> ids = new ArrayList<>(entityIds);
        ids.add(next);
        List<Relationship> path = new ArrayList<>(edges);
        path.add(edge);
        return new GraphPath(List.copyOf(ids), List.copyOf(path));
    }

    public String source() {
        return entityIds.get(0);
    }

    public String last() {
        return entityIds.get(entityIds.size() - 1);
    }

    public int hops() {
        return edges.size();
    }

    public boolean visits(String entityId) {
        return entityIds.contains(entityId);
    }

    public double confidence() {
        double product = 1.0;
        for (Relationship edge : edges) {
            product *= edge.getStrength();
        }
        return product;
    }
}
