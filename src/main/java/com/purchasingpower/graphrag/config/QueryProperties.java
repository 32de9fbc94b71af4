package com.purchasingpower.graphrag.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class QueryProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double semanticWeight = 0.6;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double keywordWeight = 0.25;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double graphWeight = 0.15;

    /**
     * Candidate pool per strategy is {@code k * candidateMultiplier}.
     */
    @Min(1)
    private int candidateMultiplier = 3;

    /**
     * Top semantic hits whose 1-hop neighbours receive the graph boost.
     */
    @Min(0)
    private int graphBoostSeeds = 5;

    @Min(1)
    private int maxNeighborResults = 500;

    /**
     * Embedding attempts on the query path; the build path uses {@code graphrag.retry}.
     */
    @Min(1)
    private int embeddingAttempts = 1;
}
