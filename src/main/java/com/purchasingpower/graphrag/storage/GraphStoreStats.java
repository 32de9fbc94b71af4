package com.purchasingpower.graphrag.storage;

import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.RelationshipType;

import java.util.Map;

/**
 * Point-in-time counts of a snapshot.
 */
public record GraphStoreStats(
    long snapshotVersion,
    int entityCount,
    int edgeCount,
    int embeddingCount,
    double averageStrength,
    Map<EntityCategory, Integer> entitiesByCategory,
    Map<RelationshipType, Integer> edgesByType
) {
}
