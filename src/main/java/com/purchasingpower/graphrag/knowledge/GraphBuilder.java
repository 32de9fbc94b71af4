package com.purchasingpower.graphrag.knowledge;

/**
 * Turns a flat catalog into the committed entity/relationship graph.
 *
 * <p>The build runs extraction, embedding, relationship inference and commit in
 * that order, inside one store transaction. A failed build leaves the previous
 * graph live.
 *
 * @since 1.0.0
 */
public interface GraphBuilder {

    /**
     * Build and publish a new graph.
     *
     * @param catalog Parsed catalog
     * @return Result with counts; {@code success=false} when no entity could be built
     *         or a systemic error aborted the build
     * @throws com.purchasingpower.graphrag.exception.BuildInProgressException when another build holds the store
     */
    BuildResult build(Catalog catalog);

    BuildStatus getStatus();
}
