package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.exception.ValidationException;

/**
 * Fusion weights. Semantic and keyword weights share one unit of budget; the
 * graph weight is an additive boost on top.
 */
public record HybridWeights(double semantic, double keyword, double graph) {

    public HybridWeights {
        check("semantic", semantic);
        check("keyword", keyword);
        check("graph", graph);
        if (semantic + keyword > 1.0 + 1e-9) {
            throw new ValidationException("semantic + keyword weights must not exceed 1, got " + (semantic + keyword));
        }
    }

    private static void check(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(name + " weight must be within [0, 1], got " + value);
        }
    }
}
