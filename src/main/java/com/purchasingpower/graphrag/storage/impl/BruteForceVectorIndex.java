package com.purchasingpower.graphrag.storage.impl;

import com.purchasingpower.graphrag.core.EmbeddingVector;
import com.purchasingpower.graphrag.storage.NeighborMatch;
import com.purchasingpower.graphrag.storage.VectorIndex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * Exact cosine scan over every stored vector.
 *
 * <p>Catalogs are a few thousand entities at most, so a linear scan with a
 * bounded heap is well inside the query latency budget.
 *
 * @since 1.0.0
 */
public class BruteForceVectorIndex implements VectorIndex {

    static final Comparator<NeighborMatch> RANKING = Comparator
        .comparingDouble(NeighborMatch::similarity).reversed()
        .thenComparing(NeighborMatch::entityId);

    private final Map<String, EmbeddingVector> vectors;

    public BruteForceVectorIndex(Map<String, EmbeddingVector> vectors) {
        this.vectors = new TreeMap<>(vectors);
    }

    @Override
    public List<NeighborMatch> search(EmbeddingVector query, int k) {
        if (k <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        // Worst-ranked match sits at the head so it can be evicted
        PriorityQueue<NeighborMatch> heap = new PriorityQueue<>(k + 1, RANKING.reversed());
        for (Map.Entry<String, EmbeddingVector> entry : vectors.entrySet()) {
            heap.add(new NeighborMatch(entry.getKey(), query.cosine(entry.getValue())));
            if (heap.size() > k) {
                heap.poll();
            }
        }
        List<NeighborMatch> result = new ArrayList<>(heap);
        result.sort(RANKING);
        return result;
    }

    @Override
    public Optional<EmbeddingVector> vector(String entityId) {
        return Optional.ofNullable(vectors.get(entityId));
    }

    @Override
    public int size() {
        return vectors.size();
    }
}
