package com.purchasingpower.graphrag.knowledge.impl;

import com.purchasingpower.graphrag.config.GraphRagProperties;
import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.EntityCategory;
import com.purchasingpower.graphrag.core.MetadataKeys;
import com.purchasingpower.graphrag.core.MetadataValue;
import com.purchasingpower.graphrag.exception.ValidationException;
import com.purchasingpower.graphrag.knowledge.CatalogRecord;
import com.purchasingpower.graphrag.template.TemplateLibrary;
import com.purchasingpower.graphrag.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns raw catalog records into entities carrying agent-facing metadata:
 * category, keywords, use cases, prerequisites, pitfalls, tips, presets,
 * complexity and learning curve.
 *
 * <p>Rules come from {@code heuristics/extraction-rules.yaml}; generated sentences
 * come from the {@code extraction} template set.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class EntityExtractor {

    private final ExtractionRules rules;
    private final TemplateLibrary templates;
    private final int minUseCases;
    private final int maxUseCases;

    @Autowired
    public EntityExtractor(TemplateLibrary templates, GraphRagProperties properties) {
        this(ExtractionRules.load(ExtractionRules.DEFAULT_RESOURCE), templates, properties);
    }

    public EntityExtractor(ExtractionRules rules, TemplateLibrary templates, GraphRagProperties properties) {
        this.rules = rules;
        this.templates = templates;
        this.minUseCases = properties.getBuilder().getMinUseCases();
        this.maxUseCases = Math.max(minUseCases, properties.getBuilder().getMaxUseCases());
    }

    public record ExtractionResult(List<Entity> entities, List<String> skipped) {
    }

    /**
     * Extract every valid record. Records without an id and repeated ids are
     * skipped and reported; the result is ordered by id.
     */
    public ExtractionResult extractAll(List<CatalogRecord> records) {
        Map<String, Entity> byId = new TreeMap<>();
        List<String> skipped = new ArrayList<>();
        for (CatalogRecord record : records) {
            try {
                Entity entity = extract(record);
                if (byId.containsKey(entity.getId())) {
                    skipped.add(entity.getId() + ": duplicate id");
                    log.warn("⚠️ Skipping duplicate catalog id {}", entity.getId());
                    continue;
                }
                byId.put(entity.getId(), entity);
            } catch (ValidationException e) {
                skipped.add(describe(record) + ": " + e.getMessage());
                log.warn("⚠️ Skipping catalog record {}: {}", describe(record), e.getMessage());
            }
        }
        return new ExtractionResult(new ArrayList<>(byId.values()), skipped);
    }

    public Entity extract(CatalogRecord record) {
        if (record == null || record.getId() == null || record.getId().isBlank()) {
            throw new ValidationException("record has no id");
        }
        String id = record.getId().trim();
        String label = record.getLabel() == null || record.getLabel().isBlank() ? id : record.getLabel().trim();
        String description = record.getDescription() == null ? "" : record.getDescription().trim();

        Set<String> nameTokens = new LinkedHashSet<>(TextUtils.tokenize(label));
        nameTokens.addAll(TextUtils.tokenize(id));
        EntityCategory category = categorize(record, nameTokens, description);
        Optional<ExtractionRules.Profile> profile = profileFor(nameTokens);

        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("label", label);
        vars.put("category", category.id());
        vars.put("summary", summary(description));

        Map<String, MetadataValue> metadata = new TreeMap<>();
        putList(metadata, MetadataKeys.KEYWORDS, keywords(label, id, description));
        putList(metadata, MetadataKeys.USE_CASES, useCases(record, profile, vars));
        putList(metadata, MetadataKeys.PREREQUISITES, prerequisites(nameTokens));
        putList(metadata, MetadataKeys.TIPS, tips(profile, vars));
        putList(metadata, MetadataKeys.PITFALLS, pitfalls(profile));
        putList(metadata, MetadataKeys.CONFIGURATION_PRESETS, profile.map(ExtractionRules.Profile::getPresets).orElse(List.of()));
        putList(metadata, MetadataKeys.PROPERTIES, limit(record.getProperties(), rules.getMaxListItems()));
        putList(metadata, MetadataKeys.OPERATIONS, limit(record.getOperations(), rules.getMaxListItems()));
        metadata.put(MetadataKeys.COMPLEXITY, MetadataValue.of(complexity(description)));
        metadata.put(MetadataKeys.LEARNING_CURVE, MetadataValue.of(learningCurve(description)));
        putMetrics(metadata, record, id);

        return Entity.builder()
            .id(id)
            .label(label)
            .description(description)
            .category(category)
            .metadata(metadata)
            .build();
    }

    // ================================================================
    // CATEGORY & KEYWORDS
    // ================================================================

    EntityCategory categorize(CatalogRecord record, Set<String> nameTokens, String description) {
        Optional<EntityCategory> declared = EntityCategory.tryParse(record.getCategory());
        if (declared.isPresent()) {
            return declared.get();
        }
        List<String> descriptionTokens = TextUtils.tokenize(description);
        EntityCategory best = EntityCategory.OTHER;
        int bestScore = 0;
        for (Map.Entry<String, List<String>> entry : rules.getCategoryKeywords().entrySet()) {
            int score = 0;
            for (String keyword : entry.getValue()) {
                if (nameTokens.contains(keyword)) {
                    score += 2;
                }
                if (descriptionTokens.contains(keyword)) {
                    score += 1;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = EntityCategory.fromId(entry.getKey());
            }
        }
        return best;
    }

    List<String> keywords(String label, String id, String description) {
        Set<String> keywords = new LinkedHashSet<>(TextUtils.tokenize(label));
        keywords.addAll(TextUtils.tokenize(id));
        for (String token : TextUtils.tokenize(description)) {
            if (token.length() > 3) {
                keywords.add(token);
            }
        }
        return limit(new ArrayList<>(keywords), rules.getMaxKeywords());
    }

    private Optional<ExtractionRules.Profile> profileFor(Set<String> nameTokens) {
        for (Map.Entry<String, ExtractionRules.Profile> entry : rules.getProfiles().entrySet()) {
            if (nameTokens.contains(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    // ================================================================
    // AGENT GUIDANCE
    // ================================================================

    private List<String> useCases(CatalogRecord record, Optional<ExtractionRules.Profile> profile, Map<String, Object> vars) {
        Set<String> useCases = new LinkedHashSet<>(record.getUseCases());
        profile.ifPresent(p -> useCases.addAll(p.getUseCases()));
        for (String operation : limit(record.getOperations(), 2)) {
            Map<String, Object> opVars = new LinkedHashMap<>(vars);
            opVars.put("operation", capitalize(operation));
            useCases.add(templates.render("extraction", "operation-use-case", opVars));
        }
        List<String> fallbacks = new ArrayList<>();
        if (!String.valueOf(vars.get("summary")).isBlank()) {
            fallbacks.add("use-case-describe");
        }
        fallbacks.add("use-case-integrate");
        fallbacks.add("use-case-combine");
        for (String fallback : fallbacks) {
            if (useCases.size() >= minUseCases) {
                break;
            }
            useCases.add(templates.render("extraction", fallback, vars));
        }
        return limit(new ArrayList<>(useCases), maxUseCases);
    }

    private List<String> prerequisites(Set<String> nameTokens) {
        Set<String> result = new LinkedHashSet<>();
        for (ExtractionRules.PrerequisiteRule rule : rules.getPrerequisites()) {
            if (rule.getMatch().stream().anyMatch(nameTokens::contains)) {
                result.addAll(rule.getItems());
            }
        }
        return limit(new ArrayList<>(result), rules.getMaxPrerequisites());
    }

    private List<String> tips(Optional<ExtractionRules.Profile> profile, Map<String, Object> vars) {
        List<String> tips = profile.map(ExtractionRules.Profile::getTips).orElse(List.of());
        if (tips.isEmpty()) {
            tips = List.of(
                templates.render("extraction", "tip-test", vars),
                templates.render("extraction", "tip-docs", vars));
        }
        return limit(tips, rules.getMaxTips());
    }

    private List<String> pitfalls(Optional<ExtractionRules.Profile> profile) {
        List<String> pitfalls = profile.map(ExtractionRules.Profile::getPitfalls).orElse(List.of());
        return limit(pitfalls.isEmpty() ? rules.getDefaultPitfalls() : pitfalls, rules.getMaxPitfalls());
    }

    String complexity(String description) {
        if (description.isBlank()) {
            return "medium";
        }
        int words = description.split("\\s+").length;
        if (words < rules.getComplexity().getSimpleMaxWords()) {
            return "simple";
        }
        return words < rules.getComplexity().getMediumMaxWords() ? "medium" : "complex";
    }

    String learningCurve(String description) {
        if (description.isBlank()) {
            return "medium";
        }
        Set<String> tokens = new HashSet<>(TextUtils.tokenize(description));
        if (rules.getLearningCurve().getEasyKeywords().stream().anyMatch(tokens::contains)) {
            return "easy";
        }
        if (rules.getLearningCurve().getHardKeywords().stream().anyMatch(tokens::contains)) {
            return "hard";
        }
        return "medium";
    }

    // ================================================================
    // METRICS
    // ================================================================

    private void putMetrics(Map<String, MetadataValue> metadata, CatalogRecord record, String id) {
        Double successRate = record.getSuccessRate();
        if (successRate != null) {
            if (successRate.isNaN() || successRate < 0.0 || successRate > 1.0) {
                log.warn("⚠️ Ignoring success rate {} of {}: outside [0, 1]", successRate, id);
            } else {
                metadata.put(MetadataKeys.SUCCESS_RATE, MetadataValue.of(successRate));
            }
        }
        if (record.getUsageCount() != null && record.getUsageCount() >= 0) {
            metadata.put(MetadataKeys.USAGE_COUNT, MetadataValue.of(record.getUsageCount()));
        }
        if (record.getRating() != null && !record.getRating().isNaN() && record.getRating() >= 0) {
            metadata.put(MetadataKeys.RATING, MetadataValue.of(record.getRating()));
        }
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private static void putList(Map<String, MetadataValue> metadata, String key, List<String> values) {
        if (values != null && !values.isEmpty()) {
            metadata.put(key, MetadataValue.of(values));
        }
    }

    private static List<String> limit(List<String> values, int max) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .limit(max)
            .toList();
    }

    /**
     * First sentence of the description with a lower-case lead, usable after "to".
     */
    private static String summary(String description) {
        if (description.isBlank()) {
            return "";
        }
        String sentence = description.split("(?<=[.!?])\\s+", 2)[0].trim();
        if (sentence.endsWith(".") || sentence.endsWith("!") || sentence.endsWith("?")) {
            sentence = sentence.substring(0, sentence.length() - 1);
        }
        if (sentence.isEmpty()) {
            return "";
        }
        // keep acronyms like "HTTP" intact
        if (sentence.length() > 1 && Character.isUpperCase(sentence.charAt(1))) {
            return sentence;
        }
        return sentence.substring(0, 1).toLowerCase(Locale.ROOT) + sentence.substring(1);
    }

    private static String capitalize(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? trimmed : trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1);
    }

    private static String describe(CatalogRecord record) {
        if (record == null) {
            return "(null)";
        }
        return record.getId() != null ? record.getId() : String.valueOf(record.getLabel());
    }
}
