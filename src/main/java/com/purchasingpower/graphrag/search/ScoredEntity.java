package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One ranked hit with the score components that produced it.
 */
@Value
@Builder(toBuilder = true)
public class ScoredEntity {

    Entity entity;
    double score;
    double semanticScore;
    double keywordScore;
    double graphBoost;

    @Builder.Default
    List<String> matchedTerms = List.of();

    /**
     * Edges linking this hit to the top semantic hits, when it received the graph boost.
     */
    @Builder.Default
    List<Relationship> graphEvidence = List.of();

    public String getId() {
        return entity.getId();
    }
}
