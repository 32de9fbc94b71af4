package com.purchasingpower.graphrag.exception;

import lombok.Getter;

/**
 * Raised when an edge names an endpoint that is not in the graph.
 */
@Getter
public class DanglingReferenceException extends GraphRagException {

    private final String edgeId;
    private final String missingEntityId;

    public DanglingReferenceException(String edgeId, String missingEntityId) {
        super("Edge " + edgeId + " references missing entity " + missingEntityId);
        this.edgeId = edgeId;
        this.missingEntityId = missingEntityId;
    }
}
