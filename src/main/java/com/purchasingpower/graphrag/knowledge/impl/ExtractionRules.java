package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.exception.GraphRagException;
import com.purchasingpower.graphrag.util.JsonMappers;
import lombok.Data;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword tables driving {@link EntityExtractor}, bound from {@code heuristics/extraction-rules.yaml}.
 */
@Data
public class ExtractionRules {

    static final String DEFAULT_RESOURCE = "heuristics/extraction-rules.yaml";

    private Map<String, List<String>> categoryKeywords = new LinkedHashMap<>();
    private Map<String, Profile> profiles = new LinkedHashMap<>();
    private List<PrerequisiteRule> prerequisites = new ArrayList<>();
    private List<String> defaultPitfalls = new ArrayList<>();
    private Complexity complexity = new Complexity();
    private LearningCurve learningCurve = new LearningCurve();
    private int maxKeywords = 15;
    private int maxPrerequisites = 4;
    private int maxTips = 3;
    private int maxPitfalls = 3;
    private int maxListItems = 10;

    @Data
    public static class Profile {
        private List<String> useCases = new ArrayList<>();
        private List<String> tips = new ArrayList<>();
        private List<String> pitfalls = new ArrayList<>();
        private List<String> presets = new ArrayList<>();
    }

    @Data
    public static class PrerequisiteRule {
        private List<String> match = new ArrayList<>();
        private List<String> items = new ArrayList<>();
    }

    @Data
    public static class Complexity {
        private int simpleMaxWords = 20;
        private int mediumMaxWords = 50;
    }

    @Data
    public static class LearningCurve {
        private List<String> easyKeywords = new ArrayList<>();
        private List<String> hardKeywords = new ArrayList<>();
    }

    public static ExtractionRules load(String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return JsonMappers.yaml().readValue(in, ExtractionRules.class);
        } catch (IOException e) {
            throw new GraphRagException("Failed to load extraction rules from " + resource, e);
        }
    }
}
