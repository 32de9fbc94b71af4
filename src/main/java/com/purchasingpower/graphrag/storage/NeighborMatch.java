package com.purchasingpower.graphrag.storage;

/**
 * One nearest-neighbour hit: entity id and cosine similarity.
 */
public record NeighborMatch(String entityId, double similarity) {
}
