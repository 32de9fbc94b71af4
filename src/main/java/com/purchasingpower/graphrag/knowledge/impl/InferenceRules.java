package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.exception.GraphRagException;
import com.purchasingpower.graphrag.util.JsonMappers;
import lombok.Data;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule table for {@link RelationshipInferrer}, bound from {@code heuristics/inference-rules.yaml}.
 */
@Data
public class InferenceRules {

    static final String DEFAULT_RESOURCE = "heuristics/inference-rules.yaml";

    private List<String> triggerCategories = new ArrayList<>(List.of("trigger"));
    private List<CompatiblePair> compatiblePairs = new ArrayList<>();

    @Data
    public static class CompatiblePair {
        private String source;
        private String target;
        private double strength;
        private String reasoning;
        private String mapping;
        private List<String> pitfalls = new ArrayList<>();
    }

    public static InferenceRules load(String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return JsonMappers.yaml().readValue(in, InferenceRules.class);
        } catch (IOException e) {
            throw new GraphRagException("Failed to load inference rules from " + resource, e);
        }
    }
}
