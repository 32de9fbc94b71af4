package com.purchasingpower.graphrag.core;

/**
 * Retrieval strategy requested by, or actually executed for, a query.
 */
public enum SearchMode {
    SEMANTIC,
    KEYWORD,
    HYBRID
}
