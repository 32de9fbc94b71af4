package com.purchasingpower.graphrag.core;

/**
 * Which stored edge directions a traversal follows. Symmetric edges are
 * always followed both ways.
 */
public enum TraversalDirection {
    OUTGOING,
    INCOMING,
    BOTH
}
